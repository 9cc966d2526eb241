package com.example.scheduling.controllers;

import com.example.scheduling.dto.AvailabilityResponse;
import com.example.scheduling.dto.BookingResult;
import com.example.scheduling.dto.BulkAvailabilityRequest;
import com.example.scheduling.dto.CreateSessionRequest;
import com.example.scheduling.dto.MemberBookingDTO;
import com.example.scheduling.dto.SessionDTO;
import com.example.scheduling.dto.StatusChangeRequest;
import com.example.scheduling.dto.UpdateSessionRequest;
import com.example.scheduling.model.SessionStatus;
import com.example.scheduling.security.Principal;
import com.example.scheduling.security.PrincipalResolver;
import com.example.scheduling.service.RosterOperation;
import com.example.scheduling.service.SessionSchedulingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

@RestController
@RequiredArgsConstructor
@Slf4j
public class TrainingSessionController {

    private final SessionSchedulingService schedulingService;
    private final PrincipalResolver principalResolver;

    @PostMapping("/sessions")
    public ResponseEntity<BookingResult> create(@RequestHeader(value = PrincipalResolver.ROLE_HEADER, required = false) String role,
                                                @RequestHeader(value = PrincipalResolver.ID_HEADER, required = false) String id,
                                                @RequestBody CreateSessionRequest request) {
        BookingResult result = schedulingService.validateAndCreate(principal(role, id), request);
        return respond(result, HttpStatus.CREATED);
    }

    @PatchMapping("/sessions/{sessionId}")
    public ResponseEntity<BookingResult> update(@RequestHeader(value = PrincipalResolver.ROLE_HEADER, required = false) String role,
                                                @RequestHeader(value = PrincipalResolver.ID_HEADER, required = false) String id,
                                                @PathVariable Long sessionId,
                                                @RequestBody UpdateSessionRequest patch) {
        return respond(schedulingService.validateAndUpdate(principal(role, id), sessionId, patch), HttpStatus.OK);
    }

    @PostMapping("/sessions/{sessionId}/cancel")
    public ResponseEntity<BookingResult> cancel(@RequestHeader(value = PrincipalResolver.ROLE_HEADER, required = false) String role,
                                                @RequestHeader(value = PrincipalResolver.ID_HEADER, required = false) String id,
                                                @PathVariable Long sessionId) {
        return respond(schedulingService.cancel(principal(role, id), sessionId), HttpStatus.OK);
    }

    /** Body {"status": "in_progress"}; an unrecognized status is rejected as an invalid transition. */
    @PostMapping("/sessions/{sessionId}/status")
    public ResponseEntity<BookingResult> changeStatus(@RequestHeader(value = PrincipalResolver.ROLE_HEADER, required = false) String role,
                                                      @RequestHeader(value = PrincipalResolver.ID_HEADER, required = false) String id,
                                                      @PathVariable Long sessionId,
                                                      @RequestBody StatusChangeRequest request) {
        SessionStatus target = SessionStatus.fromValue(request.getStatus());
        return respond(schedulingService.changeStatus(principal(role, id), sessionId, target), HttpStatus.OK);
    }

    @PostMapping("/sessions/{sessionId}/members/{memberId}")
    public ResponseEntity<BookingResult> addMember(@RequestHeader(value = PrincipalResolver.ROLE_HEADER, required = false) String role,
                                                   @RequestHeader(value = PrincipalResolver.ID_HEADER, required = false) String id,
                                                   @PathVariable Long sessionId,
                                                   @PathVariable Long memberId) {
        BookingResult result = schedulingService.changeRoster(principal(role, id), sessionId, memberId, RosterOperation.ADD);
        return respond(result, HttpStatus.OK);
    }

    @DeleteMapping("/sessions/{sessionId}/members/{memberId}")
    public ResponseEntity<BookingResult> removeMember(@RequestHeader(value = PrincipalResolver.ROLE_HEADER, required = false) String role,
                                                      @RequestHeader(value = PrincipalResolver.ID_HEADER, required = false) String id,
                                                      @PathVariable Long sessionId,
                                                      @PathVariable Long memberId) {
        BookingResult result = schedulingService.changeRoster(principal(role, id), sessionId, memberId, RosterOperation.REMOVE);
        return respond(result, HttpStatus.OK);
    }

    @GetMapping("/sessions/{sessionId}")
    public ResponseEntity<SessionDTO> getSession(@RequestHeader(value = PrincipalResolver.ROLE_HEADER, required = false) String role,
                                                 @RequestHeader(value = PrincipalResolver.ID_HEADER, required = false) String id,
                                                 @PathVariable Long sessionId) {
        return ResponseEntity.ok(schedulingService.getSession(principal(role, id), sessionId));
    }

    @GetMapping("/trainers/{trainerId}/availability")
    public ResponseEntity<AvailabilityResponse> availability(@RequestHeader(value = PrincipalResolver.ROLE_HEADER, required = false) String role,
                                                             @RequestHeader(value = PrincipalResolver.ID_HEADER, required = false) String id,
                                                             @PathVariable Long trainerId,
                                                             @RequestParam Instant start,
                                                             @RequestParam Instant end,
                                                             @RequestParam(required = false) Long excludeSessionId) {
        return ResponseEntity.ok(schedulingService.checkAvailability(principal(role, id), trainerId, start, end, excludeSessionId));
    }

    @PostMapping("/trainers/{trainerId}/availability/bulk")
    public ResponseEntity<List<AvailabilityResponse>> bulkAvailability(@RequestHeader(value = PrincipalResolver.ROLE_HEADER, required = false) String role,
                                                                       @RequestHeader(value = PrincipalResolver.ID_HEADER, required = false) String id,
                                                                       @PathVariable Long trainerId,
                                                                       @RequestBody BulkAvailabilityRequest request) {
        List<AvailabilityResponse> results = schedulingService.checkAvailability(
                principal(role, id), trainerId, request.getSlots(), request.getExcludeSessionId());
        return ResponseEntity.ok(results);
    }

    @GetMapping("/trainers/{trainerId}/schedule")
    public ResponseEntity<List<SessionDTO>> daySchedule(@RequestHeader(value = PrincipalResolver.ROLE_HEADER, required = false) String role,
                                                        @RequestHeader(value = PrincipalResolver.ID_HEADER, required = false) String id,
                                                        @PathVariable Long trainerId,
                                                        @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return ResponseEntity.ok(schedulingService.getTrainerDaySchedule(principal(role, id), trainerId, date));
    }

    @GetMapping("/members/{memberId}/bookings")
    public ResponseEntity<List<MemberBookingDTO>> memberBookings(@RequestHeader(value = PrincipalResolver.ROLE_HEADER, required = false) String role,
                                                                 @RequestHeader(value = PrincipalResolver.ID_HEADER, required = false) String id,
                                                                 @PathVariable Long memberId) {
        return ResponseEntity.ok(schedulingService.getMemberBookings(principal(role, id), memberId));
    }

    private Principal principal(String role, String id) {
        return principalResolver.resolve(role, id);
    }

    /**
     * Rejections map by reason: authorization to 403, conflicts and illegal transitions to 409,
     * every other business rule to 422.
     */
    static ResponseEntity<BookingResult> respond(BookingResult result, HttpStatus acceptedStatus) {
        if (result.accepted()) {
            return new ResponseEntity<>(result, acceptedStatus);
        }
        HttpStatus status = switch (result.reasonCode()) {
            case UNAUTHORIZED -> HttpStatus.FORBIDDEN;
            case TRAINER_CONFLICT, MEMBER_CONFLICT, INVALID_STATE_TRANSITION -> HttpStatus.CONFLICT;
            case PAST_DATE, END_BEFORE_START, CAPACITY_EXCEEDED, LOCATION_REQUIRED -> HttpStatus.UNPROCESSABLE_ENTITY;
        };
        return new ResponseEntity<>(result, status);
    }
}
