package com.example.scheduling.repository;

import com.example.scheduling.model.SessionStatus;
import com.example.scheduling.model.TrainingSession;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface TrainingSessionRepository extends JpaRepository<TrainingSession, Long> {

    @EntityGraph(attributePaths = "bookings")
    @Query("select s from TrainingSession s where s.id = :id")
    Optional<TrainingSession> findWithBookingsById(@Param("id") Long id);

    List<TrainingSession> findByStatusNot(SessionStatus status);

    List<TrainingSession> findByTrainerIdAndStatusNot(Long trainerId, SessionStatus status);

    List<TrainingSession> findByTrainerIdAndStatusNotAndScheduledStartGreaterThanEqualAndScheduledEndLessThanEqualOrderByScheduledStart(
            Long trainerId, SessionStatus status, Instant from, Instant to);

    /** Non-cancelled sessions of the trainer lying entirely inside {@code [from, to]}. */
    default List<TrainingSession> findActiveWithin(Long trainerId, Instant from, Instant to) {
        return findByTrainerIdAndStatusNotAndScheduledStartGreaterThanEqualAndScheduledEndLessThanEqualOrderByScheduledStart(
                trainerId, SessionStatus.CANCELLED, from, to);
    }

    @EntityGraph(attributePaths = "bookings")
    @Query("""
            select distinct s from TrainingSession s
            where s.scheduledStart >= :from and s.scheduledStart < :to
              and (:trainerId is null or s.trainerId = :trainerId)
            """)
    List<TrainingSession> findForAnalytics(@Param("trainerId") Long trainerId,
                                           @Param("from") Instant from,
                                           @Param("to") Instant to);

    @Query("select distinct s.trainerId from TrainingSession s where s.status <> :excludedStatus")
    List<Long> findTrainerIdsByStatusNot(@Param("excludedStatus") SessionStatus excludedStatus);
}
