package com.example.scheduling.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/** Partial update; null fields keep their current value. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateSessionRequest {
    private Long trainerId;
    private Instant scheduledStart;
    private Instant scheduledEnd;
    private String location;
    private Integer maxParticipants;
    private String notes;

    public boolean isEmpty() {
        return trainerId == null && scheduledStart == null && scheduledEnd == null
                && location == null && maxParticipants == null && notes == null;
    }
}
