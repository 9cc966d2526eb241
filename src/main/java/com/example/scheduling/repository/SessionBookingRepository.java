package com.example.scheduling.repository;

import com.example.scheduling.model.SessionBooking;
import com.example.scheduling.model.SessionBooking.BookingStatus;
import com.example.scheduling.model.SessionStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

public interface SessionBookingRepository extends JpaRepository<SessionBooking, Long> {

    @Query("""
            select b from SessionBooking b join fetch b.session s
            where b.memberId in :memberIds
              and b.status = :bookingStatus
              and s.status <> :excludedStatus
              and s.scheduledStart < :end and s.scheduledEnd > :start
              and (:excludeSessionId is null or s.id <> :excludeSessionId)
            order by s.scheduledStart
            """)
    List<SessionBooking> findOverlapping(@Param("memberIds") Collection<Long> memberIds,
                                         @Param("bookingStatus") BookingStatus bookingStatus,
                                         @Param("excludedStatus") SessionStatus excludedStatus,
                                         @Param("start") Instant start,
                                         @Param("end") Instant end,
                                         @Param("excludeSessionId") Long excludeSessionId);

    /**
     * Confirmed bookings of the given members in non-cancelled sessions whose window intersects {@code [start, end)}.
     */
    default List<SessionBooking> findConfirmedOverlapping(Collection<Long> memberIds, Instant start, Instant end,
                                                          Long excludeSessionId) {
        return findOverlapping(memberIds, BookingStatus.CONFIRMED, SessionStatus.CANCELLED, start, end, excludeSessionId);
    }

    @Query("""
            select b from SessionBooking b join fetch b.session s
            where b.memberId = :memberId and b.status = :bookingStatus
            order by s.scheduledStart
            """)
    List<SessionBooking> findByMemberAndStatus(@Param("memberId") Long memberId,
                                               @Param("bookingStatus") BookingStatus bookingStatus);

    default List<SessionBooking> findConfirmedByMemberId(Long memberId) {
        return findByMemberAndStatus(memberId, BookingStatus.CONFIRMED);
    }

    long countBySessionIdAndStatus(Long sessionId, BookingStatus status);
}
