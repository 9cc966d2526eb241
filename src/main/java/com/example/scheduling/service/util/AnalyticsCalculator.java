package com.example.scheduling.service.util;

import com.example.scheduling.dto.AnalyticsReport;
import com.example.scheduling.dto.TrainerUtilizationDTO;
import com.example.scheduling.model.SessionBooking;
import com.example.scheduling.model.SessionStatus;
import com.example.scheduling.model.TrainingSession;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Pure rollups over a set of sessions. Cancelled sessions count only toward the status totals.
 */
public final class AnalyticsCalculator {

    private AnalyticsCalculator() {
    }

    public static AnalyticsReport calculate(Long trainerId,
                                            Instant from,
                                            Instant to,
                                            Instant now,
                                            int availableHoursPerDay,
                                            Collection<TrainingSession> sessions) {
        Map<SessionStatus, Long> byStatus = new EnumMap<>(SessionStatus.class);
        for (SessionStatus status : SessionStatus.values()) {
            byStatus.put(status, 0L);
        }
        sessions.forEach(s -> byStatus.merge(s.getStatus(), 1L, Long::sum));

        List<TrainingSession> active = sessions.stream()
                .filter(TrainingSession::isActive)
                .toList();

        long total = sessions.size();
        long cancelled = byStatus.get(SessionStatus.CANCELLED);
        long completed = byStatus.get(SessionStatus.COMPLETED);
        long upcoming = active.stream()
                .filter(s -> s.getStatus() == SessionStatus.SCHEDULED && s.getScheduledStart().isAfter(now))
                .count();

        long bookedMinutes = active.stream().mapToLong(s -> s.duration().toMinutes()).sum();

        Map<Long, Long> bookingsPerMember = active.stream()
                .flatMap(s -> s.getBookings().stream())
                .filter(SessionBooking::isConfirmed)
                .collect(Collectors.groupingBy(SessionBooking::getMemberId, Collectors.counting()));

        Map<Integer, Long> byHour = new TreeMap<>();
        Map<DayOfWeek, Long> byDay = new EnumMap<>(DayOfWeek.class);
        Map<LocalDate, Long> perDay = new TreeMap<>();
        for (TrainingSession session : active) {
            ZonedDateTime start = session.getScheduledStart().atZone(ZoneOffset.UTC);
            byHour.merge(start.getHour(), 1L, Long::sum);
            byDay.merge(start.getDayOfWeek(), 1L, Long::sum);
            perDay.merge(start.toLocalDate(), 1L, Long::sum);
        }

        Map.Entry<Integer, Long> peak = byHour.entrySet().stream()
                .reduce((best, next) -> next.getValue() > best.getValue() ? next : best)
                .orElse(null);

        return new AnalyticsReport(
                trainerId,
                from,
                to,
                total,
                byStatus.get(SessionStatus.SCHEDULED),
                byStatus.get(SessionStatus.IN_PROGRESS),
                completed,
                cancelled,
                upcoming,
                completionRate(completed, total - cancelled - upcoming),
                averageAttendance(active),
                bookedMinutes / 60.0,
                utilization(active, from, to, availableHoursPerDay),
                bookingsPerMember.size(),
                bookingsPerMember.values().stream().filter(count -> count > 1).count(),
                peak == null ? null : peak.getKey(),
                peak == null ? 0 : peak.getValue(),
                byHour,
                byDay,
                perDay
        );
    }

    /** {@code current / max}; 0 for a session without capacity. */
    public static double attendanceRate(TrainingSession session) {
        Integer max = session.getMaxParticipants();
        if (max == null || max <= 0) {
            return 0.0;
        }
        return Math.min(1.0, session.getCurrentParticipants() / (double) max);
    }

    /** Whole UTC days the period touches, at least one. */
    public static long periodDays(Instant from, Instant to) {
        long minutes = Math.max(0, Duration.between(from, to).toMinutes());
        return Math.max(1, (minutes + 24 * 60 - 1) / (24 * 60));
    }

    private static double completionRate(long completed, long finishedOrRunning) {
        return finishedOrRunning <= 0 ? 0.0 : completed / (double) finishedOrRunning;
    }

    private static double averageAttendance(List<TrainingSession> active) {
        return active.stream()
                .mapToDouble(AnalyticsCalculator::attendanceRate)
                .average()
                .orElse(0.0);
    }

    private static List<TrainerUtilizationDTO> utilization(List<TrainingSession> active, Instant from, Instant to,
                                                           int availableHoursPerDay) {
        long availableMinutes = periodDays(from, to) * Math.max(0, availableHoursPerDay) * 60L;
        Map<Long, Long> bookedByTrainer = active.stream()
                .collect(Collectors.groupingBy(TrainingSession::getTrainerId, TreeMap::new,
                        Collectors.summingLong(s -> s.duration().toMinutes())));

        return bookedByTrainer.entrySet().stream()
                .map(e -> new TrainerUtilizationDTO(
                        e.getKey(),
                        e.getValue(),
                        availableMinutes,
                        availableMinutes == 0 ? 0.0 : e.getValue() / (double) availableMinutes))
                .toList();
    }
}
