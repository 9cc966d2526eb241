package com.example.scheduling.service.impl;

import com.example.scheduling.config.SchedulingConfig;
import com.example.scheduling.dto.AvailabilityResponse;
import com.example.scheduling.dto.BookingResult;
import com.example.scheduling.dto.CreateSessionRequest;
import com.example.scheduling.dto.MemberBookingDTO;
import com.example.scheduling.dto.ReasonCode;
import com.example.scheduling.dto.Rejection;
import com.example.scheduling.dto.SessionDTO;
import com.example.scheduling.dto.SlotDTO;
import com.example.scheduling.dto.UpdateSessionRequest;
import com.example.scheduling.exception.NotAccessibleException;
import com.example.scheduling.exception.SchedulingUnavailableException;
import com.example.scheduling.model.SessionBooking;
import com.example.scheduling.model.SessionStatus;
import com.example.scheduling.model.TimeInterval;
import com.example.scheduling.model.TrainingSession;
import com.example.scheduling.repository.SessionBookingRepository;
import com.example.scheduling.repository.TrainingSessionRepository;
import com.example.scheduling.security.AuthorizationGuard;
import com.example.scheduling.security.Operation;
import com.example.scheduling.security.Principal;
import com.example.scheduling.security.ResourceKind;
import com.example.scheduling.service.BookingDecision;
import com.example.scheduling.service.BookingProposal;
import com.example.scheduling.service.BookingValidator;
import com.example.scheduling.service.ConflictDetector;
import com.example.scheduling.service.RosterOperation;
import com.example.scheduling.service.SessionLifecycleManager;
import com.example.scheduling.service.SessionSchedulingService;
import com.example.scheduling.service.TrainerConflictCheck;
import com.example.scheduling.service.util.KeyedLockRegistry;
import com.example.scheduling.service.util.KeyedLockRegistry.HeldLocks;
import com.example.scheduling.service.util.KeyedLockRegistry.LockKey;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Writes hold the locks of every trainer and member they touch from validation until the index is
 * updated, so two attempts on the same trainer are serialized while unrelated trainers proceed in
 * parallel.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionSchedulingServiceImpl implements SessionSchedulingService {

    private static final int MAX_LOCK_ATTEMPTS = 3;

    private final BookingValidator validator;
    private final SessionLifecycleManager lifecycle;
    private final ConflictDetector conflictDetector;
    private final AuthorizationGuard authorizationGuard;
    private final KeyedLockRegistry locks;
    private final TrainingSessionRepository sessionRepository;
    private final SessionBookingRepository bookingRepository;
    private final SchedulingConfig config;

    @Override
    public BookingResult validateAndCreate(Principal principal, CreateSessionRequest request) {
        Optional<Rejection> denied = validator.checkWriteAccess(principal, ResourceKind.SESSION);
        if (denied.isPresent()) {
            return BookingResult.rejected(denied.get());
        }

        BookingProposal proposal = BookingProposal.from(request);
        Set<LockKey> keys = new HashSet<>();
        if (proposal.trainerId() != null) {
            keys.add(LockKey.trainer(proposal.trainerId()));
        }
        proposal.memberIds().forEach(id -> keys.add(LockKey.member(id)));

        try (HeldLocks ignored = locks.acquireAll(keys, config.lockTimeout())) {
            BookingDecision decision = validator.validate(principal, proposal, null);
            if (!decision.isAccepted()) {
                log.debug("Create rejected for trainer {}: {} {}", proposal.trainerId(),
                        decision.rejection().reasonCode(), decision.rejection().message());
                return BookingResult.rejected(decision.rejection());
            }

            SessionDTO created = lifecycle.createSession(decision);
            log.info("Session {} created: trainer={} {}-{} members={}", created.getId(), created.getTrainerId(),
                    created.getScheduledStart(), created.getScheduledEnd(), proposal.memberIds());
            return BookingResult.accepted(created);
        }
    }

    @Override
    public BookingResult validateAndUpdate(Principal principal, Long sessionId, UpdateSessionRequest patch) {
        Optional<Rejection> denied = validator.checkWriteAccess(principal, ResourceKind.SESSION);
        if (denied.isPresent()) {
            return BookingResult.rejected(denied.get());
        }

        Set<LockKey> extra = new HashSet<>();
        if (patch.getTrainerId() != null) {
            extra.add(LockKey.trainer(patch.getTrainerId()));
        }

        return withSessionLocks(sessionId, extra, true, session -> {
            if (session.getStatus() != SessionStatus.SCHEDULED) {
                return BookingResult.rejected(ReasonCode.INVALID_STATE_TRANSITION,
                        "Only scheduled sessions can be edited, this one is " + describe(session.getStatus()));
            }
            if (patch.isEmpty()) {
                return BookingResult.accepted(SessionDTO.from(session));
            }

            BookingDecision decision = validator.validate(principal, BookingProposal.merge(session, patch), session.getId());
            if (!decision.isAccepted()) {
                log.debug("Update of session {} rejected: {} {}", sessionId,
                        decision.rejection().reasonCode(), decision.rejection().message());
                return BookingResult.rejected(decision.rejection());
            }

            SessionDTO updated = lifecycle.updateSchedule(session.getId(), decision);
            log.info("Session {} updated: trainer={} {}-{} location='{}' max={}", sessionId, updated.getTrainerId(),
                    updated.getScheduledStart(), updated.getScheduledEnd(), updated.getLocation(), updated.getMaxParticipants());
            return BookingResult.accepted(updated);
        });
    }

    @Override
    public BookingResult cancel(Principal principal, Long sessionId) {
        return changeStatus(principal, sessionId, SessionStatus.CANCELLED);
    }

    @Override
    public BookingResult changeStatus(Principal principal, Long sessionId, SessionStatus target) {
        Optional<Rejection> denied = validator.checkWriteAccess(principal, ResourceKind.SESSION);
        if (denied.isPresent()) {
            return BookingResult.rejected(denied.get());
        }

        return withSessionLocks(sessionId, Set.of(), false, session -> {
            SessionStatus from = session.getStatus();
            if (!from.canTransitionTo(target)) {
                log.debug("Session {} cannot move from {} to {}", sessionId, from, target);
                return BookingResult.rejected(ReasonCode.INVALID_STATE_TRANSITION,
                        "A " + describe(from) + " session cannot become " + (target == null ? "unknown" : describe(target)));
            }
            SessionDTO updated = lifecycle.transition(sessionId, target);
            log.info("Session {} moved {} -> {}", sessionId, from, target);
            return BookingResult.accepted(updated);
        });
    }

    @Override
    public BookingResult changeRoster(Principal principal, Long sessionId, Long memberId, RosterOperation operation) {
        Optional<Rejection> denied = validator.checkWriteAccess(principal, ResourceKind.BOOKING);
        if (denied.isPresent()) {
            return BookingResult.rejected(denied.get());
        }
        if (memberId == null) {
            return BookingResult.rejected(Rejection.unauthorized());
        }

        return withSessionLocks(sessionId, Set.of(LockKey.member(memberId)), false, session -> {
            Optional<Rejection> rejection = operation == RosterOperation.ADD
                    ? validator.validateAddMember(principal, session, memberId)
                    : validator.validateRemoveMember(principal, session, memberId);
            if (rejection.isPresent()) {
                log.debug("{} of member {} on session {} rejected: {}", operation, memberId, sessionId,
                        rejection.get().reasonCode());
                return BookingResult.rejected(rejection.get());
            }

            SessionDTO updated = operation == RosterOperation.ADD
                    ? lifecycle.addMember(sessionId, memberId)
                    : lifecycle.removeMember(sessionId, memberId);
            log.info("Member {} {} session {}, participants now {}/{}", memberId,
                    operation == RosterOperation.ADD ? "added to" : "removed from",
                    sessionId, updated.getCurrentParticipants(), updated.getMaxParticipants());
            return BookingResult.accepted(updated);
        });
    }

    @Override
    public AvailabilityResponse checkAvailability(Principal principal, Long trainerId, Instant start, Instant end,
                                                  Long excludeSessionId) {
        requireRead(principal, ResourceKind.SESSION, null);
        return availability(trainerId, start, end, excludeSessionId);
    }

    @Override
    public List<AvailabilityResponse> checkAvailability(Principal principal, Long trainerId, List<SlotDTO> slots,
                                                        Long excludeSessionId) {
        requireRead(principal, ResourceKind.SESSION, null);
        if (slots == null) {
            return List.of();
        }
        return slots.stream()
                .map(slot -> availability(trainerId, slot.getStart(), slot.getEnd(), excludeSessionId))
                .toList();
    }

    @Override
    public SessionDTO getSession(Principal principal, Long sessionId) {
        requireRead(principal, ResourceKind.SESSION, null);
        return loadSession(sessionId)
                .map(SessionDTO::from)
                .orElseThrow(NotAccessibleException::new);
    }

    @Override
    public List<SessionDTO> getTrainerDaySchedule(Principal principal, Long trainerId, LocalDate date) {
        requireRead(principal, ResourceKind.SESSION, null);
        Instant from = date.atStartOfDay(ZoneOffset.UTC).toInstant();
        Instant to = date.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant();
        return storage(() -> sessionRepository.findActiveWithin(trainerId, from, to)).stream()
                .map(SessionDTO::from)
                .toList();
    }

    @Override
    public List<MemberBookingDTO> getMemberBookings(Principal principal, Long memberId) {
        requireRead(principal, ResourceKind.BOOKING, memberId);
        return storage(() -> bookingRepository.findConfirmedByMemberId(memberId)).stream()
                .map(MemberBookingDTO::from)
                .toList();
    }

    private AvailabilityResponse availability(Long trainerId, Instant start, Instant end, Long excludeSessionId) {
        if (start == null || end == null || !end.isAfter(start)) {
            return new AvailabilityResponse(trainerId, start, end, false, List.of(),
                    "Session end time must be later than start time");
        }
        TrainerConflictCheck check = conflictDetector.checkTrainerConflict(trainerId, new TimeInterval(start, end), excludeSessionId);
        String message = check.conflict()
                ? "Trainer has " + check.conflictingSessions().size() + " conflicting session(s) during this time"
                : "Trainer is available";
        return new AvailabilityResponse(trainerId, start, end, !check.conflict(), check.conflictingSessions(), message);
    }

    /**
     * Locks the session's trainer (and roster when asked) plus {@code extraKeys}, re-reads the session
     * under the locks and runs {@code body}. Retries when the trainer or roster changed while waiting.
     */
    private BookingResult withSessionLocks(Long sessionId, Set<LockKey> extraKeys, boolean lockRoster,
                                           Function<TrainingSession, BookingResult> body) {
        for (int attempt = 1; attempt <= MAX_LOCK_ATTEMPTS; attempt++) {
            Optional<TrainingSession> snapshot = loadSession(sessionId);
            if (snapshot.isEmpty()) {
                return BookingResult.rejected(Rejection.unauthorized());
            }

            Set<LockKey> keys = new HashSet<>(extraKeys);
            keys.add(LockKey.trainer(snapshot.get().getTrainerId()));
            if (lockRoster) {
                confirmedMembers(snapshot.get()).forEach(id -> keys.add(LockKey.member(id)));
            }

            try (HeldLocks held = locks.acquireAll(keys, config.lockTimeout())) {
                Optional<TrainingSession> current = loadSession(sessionId);
                if (current.isEmpty()) {
                    return BookingResult.rejected(Rejection.unauthorized());
                }
                TrainingSession session = current.get();
                boolean stale = !held.covers(LockKey.trainer(session.getTrainerId()))
                        || (lockRoster && !confirmedMembers(session).stream().allMatch(id -> held.covers(LockKey.member(id))));
                if (stale) {
                    log.debug("Session {} changed while acquiring locks (attempt {}), retrying", sessionId, attempt);
                    continue;
                }
                return body.apply(session);
            }
        }
        throw new SchedulingUnavailableException("Session " + sessionId + " is being changed concurrently, retry shortly");
    }

    private Optional<TrainingSession> loadSession(Long sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        return storage(() -> sessionRepository.findWithBookingsById(sessionId));
    }

    private void requireRead(Principal principal, ResourceKind kind, Long ownerRef) {
        if (authorizationGuard.authorize(principal, Operation.READ, kind, ownerRef).denied()) {
            throw new NotAccessibleException();
        }
    }

    private static List<Long> confirmedMembers(TrainingSession session) {
        return session.getBookings().stream()
                .filter(SessionBooking::isConfirmed)
                .map(SessionBooking::getMemberId)
                .toList();
    }

    private static String describe(SessionStatus status) {
        return status.name().toLowerCase(Locale.ROOT);
    }

    private static <T> T storage(Supplier<T> query) {
        try {
            return query.get();
        } catch (DataAccessException e) {
            throw new SchedulingUnavailableException("Session storage unavailable", e);
        }
    }
}
