package com.example.scheduling.dto;

import java.time.Instant;
import java.util.List;

public record AvailabilityResponse(Long trainerId,
                                   Instant start,
                                   Instant end,
                                   boolean available,
                                   List<ConflictingSessionDTO> conflicts,
                                   String message) {

    public AvailabilityResponse {
        conflicts = conflicts == null ? List.of() : List.copyOf(conflicts);
    }
}
