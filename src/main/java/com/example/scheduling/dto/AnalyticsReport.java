package com.example.scheduling.dto;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Read-only rollup over sessions whose start falls in {@code [from, to)}.
 * Rates are fractions in {@code [0, 1]}.
 *
 * @param trainerId null for the all-trainers scope
 */
public record AnalyticsReport(Long trainerId,
                              Instant from,
                              Instant to,
                              long totalSessions,
                              long scheduledSessions,
                              long inProgressSessions,
                              long completedSessions,
                              long cancelledSessions,
                              long upcomingSessions,
                              double completionRate,
                              double averageAttendanceRate,
                              double bookedHours,
                              List<TrainerUtilizationDTO> utilization,
                              long distinctClients,
                              long repeatClients,
                              Integer peakHour,
                              long peakHourSessionCount,
                              Map<Integer, Long> sessionsByHourOfDay,
                              Map<DayOfWeek, Long> sessionsByDayOfWeek,
                              Map<LocalDate, Long> sessionsPerDay) {
}
