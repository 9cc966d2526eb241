package com.example.scheduling.dto;

import java.util.List;

public record Rejection(ReasonCode reasonCode,
                        String message,
                        List<ConflictingSessionDTO> conflicts,
                        List<MemberConflictDTO> memberConflicts) {

    /** Shared by "not permitted" and "does not exist" so the two cannot be told apart. */
    public static final String NOT_ACCESSIBLE = "Resource not found or not accessible";

    public Rejection {
        conflicts = conflicts == null ? List.of() : List.copyOf(conflicts);
        memberConflicts = memberConflicts == null ? List.of() : List.copyOf(memberConflicts);
    }

    public static Rejection of(ReasonCode code, String message) {
        return new Rejection(code, message, List.of(), List.of());
    }

    public static Rejection unauthorized() {
        return of(ReasonCode.UNAUTHORIZED, NOT_ACCESSIBLE);
    }

    public static Rejection trainerConflict(List<ConflictingSessionDTO> conflicts) {
        return new Rejection(ReasonCode.TRAINER_CONFLICT,
                "Trainer has " + conflicts.size() + " conflicting session(s) during this time",
                conflicts, List.of());
    }

    public static Rejection memberConflict(List<MemberConflictDTO> memberConflicts) {
        return new Rejection(ReasonCode.MEMBER_CONFLICT,
                memberConflicts.size() + " member(s) already booked in an overlapping session",
                List.of(), memberConflicts);
    }
}
