package com.example.scheduling.service;

import com.example.scheduling.dto.SessionDTO;
import com.example.scheduling.exception.InvariantViolationException;
import com.example.scheduling.exception.SchedulingUnavailableException;
import com.example.scheduling.model.SessionBooking;
import com.example.scheduling.model.SessionBooking.BookingStatus;
import com.example.scheduling.model.SessionStatus;
import com.example.scheduling.model.TrainingSession;
import com.example.scheduling.repository.SessionBookingRepository;
import com.example.scheduling.repository.TrainingSessionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Sole writer of sessions and bookings.
 * <p>
 * Each operation runs in one transaction, recomputes {@code currentParticipants} from the confirmed
 * bookings and checks it against the store before commit. The {@link IntervalIndex} is updated only
 * after the commit succeeded. Callers hold the trainer and member locks for the whole call.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SessionLifecycleManager {

    private final TrainingSessionRepository sessionRepository;
    private final SessionBookingRepository bookingRepository;
    private final TransactionTemplate transactionTemplate;
    private final IntervalIndex intervalIndex;
    private final Clock clock;

    public SessionDTO createSession(BookingDecision decision) {
        if (!decision.isAccepted()) {
            throw new IllegalArgumentException("Only accepted decisions can be committed");
        }
        BookingProposal proposal = decision.proposal();

        SessionDTO created = inTransaction(status -> {
            Instant now = clock.instant();
            TrainingSession session = new TrainingSession();
            session.setTrainerId(proposal.trainerId());
            session.setScheduledStart(proposal.start());
            session.setScheduledEnd(proposal.end());
            session.setLocation(proposal.location());
            session.setMaxParticipants(proposal.maxParticipants());
            session.setNotes(proposal.notes());
            session.setStatus(SessionStatus.SCHEDULED);
            session.setCreatedAt(now);
            session.setUpdatedAt(now);

            for (Long memberId : proposal.memberIds()) {
                session.getBookings().add(newBooking(session, memberId, now));
            }
            syncParticipantCount(session);

            TrainingSession saved = sessionRepository.save(session);
            assertParticipantInvariants(saved);
            return SessionDTO.from(saved);
        });

        intervalIndex.insert(created.getTrainerId(), proposal.interval(), created.getId());
        return created;
    }

    /** Applies new trainer, window, location, capacity and notes from an accepted decision. */
    public SessionDTO updateSchedule(Long sessionId, BookingDecision decision) {
        if (!decision.isAccepted()) {
            throw new IllegalArgumentException("Only accepted decisions can be committed");
        }
        BookingProposal proposal = decision.proposal();

        Rescheduled result = inTransaction(status -> {
            TrainingSession session = load(sessionId);
            if (session.getStatus() != SessionStatus.SCHEDULED) {
                throw new InvariantViolationException("Session " + sessionId + " is " + session.getStatus() + ", not reschedulable");
            }
            Long previousTrainerId = session.getTrainerId();

            session.setTrainerId(proposal.trainerId());
            session.setScheduledStart(proposal.start());
            session.setScheduledEnd(proposal.end());
            session.setLocation(proposal.location());
            session.setMaxParticipants(proposal.maxParticipants());
            session.setNotes(proposal.notes());
            session.setUpdatedAt(clock.instant());
            syncParticipantCount(session);

            assertParticipantInvariants(session);
            return new Rescheduled(previousTrainerId, SessionDTO.from(session));
        });

        intervalIndex.move(result.previousTrainerId(), result.session().getTrainerId(), proposal.interval(), sessionId);
        return result.session();
    }

    /**
     * Moves the session along its state machine. Booking rows are left untouched, so a cancelled
     * session keeps its history while dropping out of conflict checks.
     */
    public SessionDTO transition(Long sessionId, SessionStatus target) {
        SessionDTO updated = inTransaction(status -> {
            TrainingSession session = load(sessionId);
            SessionStatus from = session.getStatus();
            if (!from.canTransitionTo(target)) {
                throw new InvariantViolationException("Illegal transition " + from + " -> " + target + " for session " + sessionId);
            }
            session.setStatus(target);
            session.setUpdatedAt(clock.instant());
            assertParticipantInvariants(session);
            return SessionDTO.from(session);
        });

        if (target == SessionStatus.CANCELLED) {
            intervalIndex.remove(updated.getTrainerId(), sessionId);
        }
        return updated;
    }

    /** Confirms the member's seat, reviving a previously cancelled booking row if there is one. */
    public SessionDTO addMember(Long sessionId, Long memberId) {
        return inTransaction(status -> {
            TrainingSession session = load(sessionId);
            Instant now = clock.instant();

            Optional<SessionBooking> existing = findBooking(session, memberId);
            if (existing.isPresent()) {
                SessionBooking booking = existing.get();
                if (!booking.isConfirmed()) {
                    booking.setStatus(BookingStatus.CONFIRMED);
                    booking.setUpdatedAt(now);
                }
            } else {
                session.getBookings().add(newBooking(session, memberId, now));
            }
            session.setUpdatedAt(now);
            syncParticipantCount(session);

            // new booking is persisted by cascade when the count query flushes
            assertParticipantInvariants(session);
            return SessionDTO.from(session);
        });
    }

    public SessionDTO removeMember(Long sessionId, Long memberId) {
        return inTransaction(status -> {
            TrainingSession session = load(sessionId);
            Instant now = clock.instant();

            findBooking(session, memberId)
                    .filter(SessionBooking::isConfirmed)
                    .ifPresent(booking -> {
                        booking.setStatus(BookingStatus.CANCELLED);
                        booking.setUpdatedAt(now);
                    });
            session.setUpdatedAt(now);
            syncParticipantCount(session);

            assertParticipantInvariants(session);
            return SessionDTO.from(session);
        });
    }

    private TrainingSession load(Long sessionId) {
        return sessionRepository.findWithBookingsById(sessionId)
                .orElseThrow(() -> new InvariantViolationException("Session " + sessionId + " disappeared during commit"));
    }

    private static Optional<SessionBooking> findBooking(TrainingSession session, Long memberId) {
        return session.getBookings().stream()
                .filter(b -> b.getMemberId().equals(memberId))
                .findFirst();
    }

    private static SessionBooking newBooking(TrainingSession session, Long memberId, Instant now) {
        SessionBooking booking = new SessionBooking();
        booking.setSession(session);
        booking.setMemberId(memberId);
        booking.setStatus(BookingStatus.CONFIRMED);
        booking.setCreatedAt(now);
        booking.setUpdatedAt(now);
        return booking;
    }

    private static void syncParticipantCount(TrainingSession session) {
        session.setCurrentParticipants((int) session.confirmedBookingCount());
    }

    /**
     * Commit-time check: the stored confirmed-booking count must equal {@code currentParticipants},
     * which must not exceed capacity. A failure rolls the transaction back.
     */
    private void assertParticipantInvariants(TrainingSession session) {
        long stored = bookingRepository.countBySessionIdAndStatus(session.getId(), BookingStatus.CONFIRMED);
        int counter = session.getCurrentParticipants();
        if (stored != counter) {
            log.error("Participant count mismatch on session {}: counter={} confirmedBookings={}",
                    session.getId(), counter, stored);
            throw new InvariantViolationException("Participant count mismatch on session " + session.getId());
        }
        if (counter > session.getMaxParticipants()) {
            log.error("Session {} over capacity: participants={} max={}",
                    session.getId(), counter, session.getMaxParticipants());
            throw new InvariantViolationException("Session " + session.getId() + " over capacity");
        }
    }

    private record Rescheduled(Long previousTrainerId, SessionDTO session) {}

    private <T> T inTransaction(TransactionCallback<T> work) {
        try {
            return transactionTemplate.execute(work);
        } catch (InvariantViolationException e) {
            throw e;
        } catch (DataIntegrityViolationException e) {
            log.error("Integrity violation while committing: {}", e.getMessage(), e);
            throw new InvariantViolationException("Storage rejected the change: " + e.getMostSpecificCause().getMessage());
        } catch (DataAccessException | TransactionException e) {
            throw new SchedulingUnavailableException("Storage unavailable, change not applied", e);
        }
    }
}
