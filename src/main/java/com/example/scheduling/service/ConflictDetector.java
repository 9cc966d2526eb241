package com.example.scheduling.service;

import com.example.scheduling.config.SchedulingConfig;
import com.example.scheduling.dto.ConflictingSessionDTO;
import com.example.scheduling.exception.SchedulingUnavailableException;
import com.example.scheduling.model.SessionBooking;
import com.example.scheduling.model.TimeInterval;
import com.example.scheduling.model.TrainingSession;
import com.example.scheduling.repository.SessionBookingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Overlap checks for a proposed window. Trainer checks go through the {@link IntervalIndex};
 * member checks query committed bookings. Both use {@link TimeInterval#overlaps}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConflictDetector {

    private final IntervalIndex intervalIndex;
    private final SessionBookingRepository bookingRepository;
    private final SchedulingConfig config;

    /**
     * @param excludeSessionId session whose own window is ignored (in-place edit), may be null
     */
    public TrainerConflictCheck checkTrainerConflict(Long trainerId, TimeInterval proposed, Long excludeSessionId) {
        List<ConflictingSessionDTO> conflicts = intervalIndex
                .overlapping(trainerId, proposed, excludeSessionId, config.availabilityTimeout())
                .stream()
                .map(i -> new ConflictingSessionDTO(i.sessionId(), i.trainerId(), i.interval().start(), i.interval().end()))
                .toList();

        if (conflicts.isEmpty()) {
            return TrainerConflictCheck.none();
        }
        log.debug("Trainer {} has {} conflict(s) with {}", trainerId, conflicts.size(), proposed);
        return new TrainerConflictCheck(true, conflicts);
    }

    /**
     * Every member holding a confirmed booking in another active session overlapping {@code proposed},
     * mapped to the earliest such session. Members are reported in request order.
     */
    public Map<Long, ConflictingSessionDTO> checkMemberConflicts(Collection<Long> memberIds,
                                                                 TimeInterval proposed,
                                                                 Long excludeSessionId) {
        Map<Long, ConflictingSessionDTO> conflicts = new LinkedHashMap<>();
        if (memberIds == null || memberIds.isEmpty()) {
            return conflicts;
        }

        List<SessionBooking> overlapping;
        try {
            overlapping = bookingRepository.findConfirmedOverlapping(
                    memberIds, proposed.start(), proposed.end(), excludeSessionId);
        } catch (DataAccessException e) {
            throw new SchedulingUnavailableException("Member schedule lookup failed", e);
        }

        for (Long memberId : memberIds) {
            overlapping.stream()
                    .filter(b -> b.getMemberId().equals(memberId))
                    .filter(b -> b.getSession().interval().overlaps(proposed))
                    .findFirst()
                    .ifPresent(b -> conflicts.put(memberId, toDto(b.getSession())));
        }
        return conflicts;
    }

    private static ConflictingSessionDTO toDto(TrainingSession session) {
        return new ConflictingSessionDTO(session.getId(), session.getTrainerId(),
                session.getScheduledStart(), session.getScheduledEnd());
    }
}
