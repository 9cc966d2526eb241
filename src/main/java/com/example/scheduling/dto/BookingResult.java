package com.example.scheduling.dto;

import java.util.List;

/**
 * Outcome of a write request: either accepted (with the committed session) or rejected with a reason.
 */
public record BookingResult(boolean accepted,
                            Long sessionId,
                            SessionDTO session,
                            ReasonCode reasonCode,
                            String message,
                            List<ConflictingSessionDTO> conflicts,
                            List<MemberConflictDTO> memberConflicts) {

    public static BookingResult accepted(SessionDTO session) {
        return new BookingResult(true, session.getId(), session, null, null, List.of(), List.of());
    }

    public static BookingResult rejected(Rejection rejection) {
        return new BookingResult(false, null, null,
                rejection.reasonCode(), rejection.message(), rejection.conflicts(), rejection.memberConflicts());
    }

    public static BookingResult rejected(ReasonCode code, String message) {
        return rejected(Rejection.of(code, message));
    }
}
