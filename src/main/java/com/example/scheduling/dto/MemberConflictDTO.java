package com.example.scheduling.dto;

/** A requested member who already holds a confirmed seat in an overlapping session. */
public record MemberConflictDTO(Long memberId, ConflictingSessionDTO conflictingSession) {
}
