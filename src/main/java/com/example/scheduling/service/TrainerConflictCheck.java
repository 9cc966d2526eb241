package com.example.scheduling.service;

import com.example.scheduling.dto.ConflictingSessionDTO;

import java.util.List;

public record TrainerConflictCheck(boolean conflict, List<ConflictingSessionDTO> conflictingSessions) {

    public TrainerConflictCheck {
        conflictingSessions = List.copyOf(conflictingSessions);
    }

    public static TrainerConflictCheck none() {
        return new TrainerConflictCheck(false, List.of());
    }
}
