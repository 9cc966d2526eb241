package com.example.scheduling.dto;

/**
 * Booked versus available minutes of one trainer over the report period.
 * {@code utilization} is a fraction in {@code [0, 1]} (it can exceed 1 only if the trainer
 * worked longer than the configured daily availability).
 */
public record TrainerUtilizationDTO(Long trainerId, long bookedMinutes, long availableMinutes, double utilization) {
}
