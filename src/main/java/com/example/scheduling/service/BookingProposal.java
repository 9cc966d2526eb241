package com.example.scheduling.service;

import com.example.scheduling.dto.CreateSessionRequest;
import com.example.scheduling.dto.UpdateSessionRequest;
import com.example.scheduling.model.SessionBooking;
import com.example.scheduling.model.TimeInterval;
import com.example.scheduling.model.TrainingSession;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * Values a booking is validated against. Built from raw input, so any field may be null
 * until the validator has accepted it. Member ids are de-duplicated in request order.
 * Start and end are truncated to microseconds, the precision the store keeps.
 */
public record BookingProposal(Long trainerId,
                              Instant start,
                              Instant end,
                              String location,
                              Integer maxParticipants,
                              List<Long> memberIds,
                              String notes) {

    public BookingProposal {
        start = start == null ? null : start.truncatedTo(ChronoUnit.MICROS);
        end = end == null ? null : end.truncatedTo(ChronoUnit.MICROS);
        memberIds = memberIds == null
                ? List.of()
                : List.copyOf(new LinkedHashSet<>(memberIds.stream().filter(Objects::nonNull).toList()));
        location = location == null ? null : location.trim();
        notes = notes == null || notes.isBlank() ? null : notes.trim();
    }

    public static BookingProposal from(CreateSessionRequest request) {
        return new BookingProposal(
                request.getTrainerId(),
                request.getScheduledStart(),
                request.getScheduledEnd(),
                request.getLocation(),
                request.getMaxParticipants(),
                request.getMemberIds(),
                request.getNotes());
    }

    /** Current session values overlaid with the non-null fields of {@code patch}. Roster stays as is. */
    public static BookingProposal merge(TrainingSession current, UpdateSessionRequest patch) {
        List<Long> roster = current.getBookings().stream()
                .filter(SessionBooking::isConfirmed)
                .map(SessionBooking::getMemberId)
                .toList();
        return new BookingProposal(
                patch.getTrainerId() != null ? patch.getTrainerId() : current.getTrainerId(),
                patch.getScheduledStart() != null ? patch.getScheduledStart() : current.getScheduledStart(),
                patch.getScheduledEnd() != null ? patch.getScheduledEnd() : current.getScheduledEnd(),
                patch.getLocation() != null ? patch.getLocation() : current.getLocation(),
                patch.getMaxParticipants() != null ? patch.getMaxParticipants() : current.getMaxParticipants(),
                roster,
                patch.getNotes() != null ? patch.getNotes() : current.getNotes());
    }

    /** Null when either bound is missing. */
    public TimeInterval interval() {
        return start == null || end == null ? null : new TimeInterval(start, end);
    }
}
