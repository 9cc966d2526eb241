package com.example.scheduling.dto;

import java.time.Instant;

public record ConflictingSessionDTO(Long sessionId, Long trainerId, Instant start, Instant end) {
}
