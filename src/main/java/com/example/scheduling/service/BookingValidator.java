package com.example.scheduling.service;

import com.example.scheduling.config.SchedulingConfig;
import com.example.scheduling.dto.ConflictingSessionDTO;
import com.example.scheduling.dto.MemberConflictDTO;
import com.example.scheduling.dto.ReasonCode;
import com.example.scheduling.dto.Rejection;
import com.example.scheduling.model.TimeInterval;
import com.example.scheduling.model.TrainingSession;
import com.example.scheduling.security.AuthorizationDecision;
import com.example.scheduling.security.AuthorizationGuard;
import com.example.scheduling.security.Operation;
import com.example.scheduling.security.Principal;
import com.example.scheduling.security.ResourceKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Business rules for a booking attempt. Never writes; the caller commits an accepted decision.
 * <p>
 * Rules run in a fixed order and stop at the first failure:
 * authorization, directory lookup, time window, capacity, trainer conflict, member conflicts, location.
 * All conflicting members are reported together.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingValidator {

    private final AuthorizationGuard authorizationGuard;
    private final ParticipantDirectory directory;
    private final ConflictDetector conflictDetector;
    private final SchedulingConfig config;
    private final Clock clock;

    public Optional<Rejection> checkWriteAccess(Principal principal, ResourceKind kind) {
        AuthorizationDecision decision = authorizationGuard.authorize(principal, Operation.WRITE, kind, null);
        if (decision.denied()) {
            log.debug("Write on {} denied for {}: {}", kind, principal, decision.reason());
            return Optional.of(Rejection.unauthorized());
        }
        return Optional.empty();
    }

    /**
     * @param excludeSessionId the session being edited, whose own window and bookings are ignored; null on create
     */
    public BookingDecision validate(Principal principal, BookingProposal proposal, Long excludeSessionId) {
        Optional<Rejection> denied = checkWriteAccess(principal, ResourceKind.SESSION);
        if (denied.isPresent()) {
            return BookingDecision.rejected(denied.get());
        }

        if (!directory.isActiveTrainer(proposal.trainerId())) {
            log.debug("Trainer {} unknown or inactive", proposal.trainerId());
            return BookingDecision.rejected(Rejection.unauthorized());
        }
        Set<Long> unavailableMembers = directory.findUnavailableMembers(proposal.memberIds());
        if (!unavailableMembers.isEmpty()) {
            return BookingDecision.rejected(Rejection.unauthorized());
        }

        Optional<Rejection> temporal = checkTimeWindow(proposal);
        if (temporal.isPresent()) {
            return BookingDecision.rejected(temporal.get());
        }

        Optional<Rejection> capacity = checkCapacity(proposal.maxParticipants(), proposal.memberIds().size());
        if (capacity.isPresent()) {
            return BookingDecision.rejected(capacity.get());
        }

        TimeInterval interval = proposal.interval();
        TrainerConflictCheck trainerCheck = conflictDetector.checkTrainerConflict(proposal.trainerId(), interval, excludeSessionId);
        if (trainerCheck.conflict()) {
            return BookingDecision.rejected(Rejection.trainerConflict(trainerCheck.conflictingSessions()));
        }

        Map<Long, ConflictingSessionDTO> memberConflicts =
                conflictDetector.checkMemberConflicts(proposal.memberIds(), interval, excludeSessionId);
        if (!memberConflicts.isEmpty()) {
            return BookingDecision.rejected(Rejection.memberConflict(toMemberConflicts(memberConflicts)));
        }

        if (proposal.location() == null || proposal.location().isEmpty()) {
            return BookingDecision.rejected(Rejection.of(ReasonCode.LOCATION_REQUIRED, "Location is required"));
        }

        return BookingDecision.accepted(proposal);
    }

    /**
     * Rules for adding one member to an existing session: capacity and that member's conflicts only.
     * An already confirmed member yields no rejection.
     */
    public Optional<Rejection> validateAddMember(Principal principal, TrainingSession session, Long memberId) {
        Optional<Rejection> denied = checkWriteAccess(principal, ResourceKind.BOOKING);
        if (denied.isPresent()) {
            return denied;
        }
        if (session.getStatus().isTerminal()) {
            return Optional.of(Rejection.of(ReasonCode.INVALID_STATE_TRANSITION,
                    "Roster of a " + session.getStatus().name().toLowerCase(Locale.ROOT) + " session cannot change"));
        }
        if (memberId == null || !directory.findUnavailableMembers(List.of(memberId)).isEmpty()) {
            return Optional.of(Rejection.unauthorized());
        }
        if (isConfirmedMember(session, memberId)) {
            return Optional.empty();
        }

        int seats = session.getMaxParticipants();
        if (session.getCurrentParticipants() + 1 > seats) {
            return Optional.of(Rejection.of(ReasonCode.CAPACITY_EXCEEDED,
                    "Session is full (" + seats + " of " + seats + " seats taken)"));
        }

        Map<Long, ConflictingSessionDTO> conflicts =
                conflictDetector.checkMemberConflicts(List.of(memberId), session.interval(), session.getId());
        if (!conflicts.isEmpty()) {
            return Optional.of(Rejection.memberConflict(toMemberConflicts(conflicts)));
        }
        return Optional.empty();
    }

    public Optional<Rejection> validateRemoveMember(Principal principal, TrainingSession session, Long memberId) {
        Optional<Rejection> denied = checkWriteAccess(principal, ResourceKind.BOOKING);
        if (denied.isPresent()) {
            return denied;
        }
        if (session.getStatus().isTerminal()) {
            return Optional.of(Rejection.of(ReasonCode.INVALID_STATE_TRANSITION,
                    "Roster of a " + session.getStatus().name().toLowerCase(Locale.ROOT) + " session cannot change"));
        }
        if (isConfirmedMember(session, memberId) && session.confirmedBookingCount() <= 1) {
            return Optional.of(Rejection.of(ReasonCode.CAPACITY_EXCEEDED,
                    "A session must keep at least one member; cancel the session instead"));
        }
        return Optional.empty();
    }

    private Optional<Rejection> checkTimeWindow(BookingProposal proposal) {
        Instant start = proposal.start();
        Instant end = proposal.end();
        if (start == null || end == null || !end.isAfter(start)) {
            return Optional.of(Rejection.of(ReasonCode.END_BEFORE_START, "Session end time must be later than start time"));
        }
        if (start.isBefore(clock.instant())) {
            return Optional.of(Rejection.of(ReasonCode.PAST_DATE,
                    "Training sessions cannot be scheduled for past dates. Please choose a future date and time."));
        }
        return Optional.empty();
    }

    private Optional<Rejection> checkCapacity(Integer maxParticipants, int memberCount) {
        int upperBound = config.getCapacityUpperBound();
        if (maxParticipants == null || maxParticipants < 1 || maxParticipants > upperBound) {
            return Optional.of(Rejection.of(ReasonCode.CAPACITY_EXCEEDED,
                    "Max participants must be between 1 and " + upperBound));
        }
        if (memberCount < 1) {
            return Optional.of(Rejection.of(ReasonCode.CAPACITY_EXCEEDED, "At least one member is required"));
        }
        if (memberCount > maxParticipants) {
            return Optional.of(Rejection.of(ReasonCode.CAPACITY_EXCEEDED,
                    memberCount + " members requested but the session holds " + maxParticipants));
        }
        return Optional.empty();
    }

    private static boolean isConfirmedMember(TrainingSession session, Long memberId) {
        return session.getBookings().stream()
                .anyMatch(b -> b.isConfirmed() && b.getMemberId().equals(memberId));
    }

    private static List<MemberConflictDTO> toMemberConflicts(Map<Long, ConflictingSessionDTO> conflicts) {
        return conflicts.entrySet().stream()
                .map(e -> new MemberConflictDTO(e.getKey(), e.getValue()))
                .toList();
    }
}
