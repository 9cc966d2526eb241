package com.example.scheduling.service;

import com.example.scheduling.dto.AvailabilityResponse;
import com.example.scheduling.dto.BookingResult;
import com.example.scheduling.dto.CreateSessionRequest;
import com.example.scheduling.dto.MemberBookingDTO;
import com.example.scheduling.dto.SessionDTO;
import com.example.scheduling.dto.SlotDTO;
import com.example.scheduling.dto.UpdateSessionRequest;
import com.example.scheduling.model.SessionStatus;
import com.example.scheduling.security.Principal;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Entry point for every session write and the reads used for live form feedback.
 * Business rejections come back as {@link BookingResult} values. Transient failures are thrown as
 * {@link com.example.scheduling.exception.SchedulingUnavailableException}; denied reads as
 * {@link com.example.scheduling.exception.NotAccessibleException}.
 */
public interface SessionSchedulingService {

    BookingResult validateAndCreate(Principal principal, CreateSessionRequest request);

    BookingResult validateAndUpdate(Principal principal, Long sessionId, UpdateSessionRequest patch);

    BookingResult cancel(Principal principal, Long sessionId);

    BookingResult changeStatus(Principal principal, Long sessionId, SessionStatus target);

    BookingResult changeRoster(Principal principal, Long sessionId, Long memberId, RosterOperation operation);

    /** Read-only and idempotent against unchanged state. */
    AvailabilityResponse checkAvailability(Principal principal, Long trainerId, Instant start, Instant end, Long excludeSessionId);

    List<AvailabilityResponse> checkAvailability(Principal principal, Long trainerId, List<SlotDTO> slots, Long excludeSessionId);

    SessionDTO getSession(Principal principal, Long sessionId);

    /** Non-cancelled sessions of the trainer within the given UTC day, ordered by start. */
    List<SessionDTO> getTrainerDaySchedule(Principal principal, Long trainerId, LocalDate date);

    List<MemberBookingDTO> getMemberBookings(Principal principal, Long memberId);
}
