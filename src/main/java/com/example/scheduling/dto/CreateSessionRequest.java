package com.example.scheduling.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateSessionRequest {
    private Long trainerId;

    /** Advisory only; validated against the server clock. */
    private Instant scheduledStart;
    private Instant scheduledEnd;

    private String location;
    private Integer maxParticipants;

    @Builder.Default
    private List<Long> memberIds = new ArrayList<>();

    private String notes;
}
