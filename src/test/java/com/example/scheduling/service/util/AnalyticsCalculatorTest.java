package com.example.scheduling.service.util;

import com.example.scheduling.dto.AnalyticsReport;
import com.example.scheduling.dto.TrainerUtilizationDTO;
import com.example.scheduling.model.SessionBooking;
import com.example.scheduling.model.SessionBooking.BookingStatus;
import com.example.scheduling.model.SessionStatus;
import com.example.scheduling.model.TrainingSession;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.assertj.core.api.Assertions.within;

class AnalyticsCalculatorTest {

    private static final Instant FROM = Instant.parse("2030-01-07T00:00:00Z"); // Monday
    private static final Instant TO = Instant.parse("2030-01-09T00:00:00Z");
    private static final Instant NOW = Instant.parse("2030-01-08T12:00:00Z");

    private long ids = 1;

    private TrainingSession session(Long trainerId, String start, String end, SessionStatus status, int max, Long... members) {
        TrainingSession session = new TrainingSession();
        session.setId(ids++);
        session.setTrainerId(trainerId);
        session.setScheduledStart(Instant.parse(start));
        session.setScheduledEnd(Instant.parse(end));
        session.setLocation("Gym");
        session.setMaxParticipants(max);
        session.setStatus(status);
        for (Long memberId : members) {
            SessionBooking booking = new SessionBooking();
            booking.setSession(session);
            booking.setMemberId(memberId);
            booking.setStatus(BookingStatus.CONFIRMED);
            session.getBookings().add(booking);
        }
        session.setCurrentParticipants(members.length);
        return session;
    }

    @Test
    void emptyPeriodYieldsZeros() {
        AnalyticsReport report = AnalyticsCalculator.calculate(null, FROM, TO, NOW, 10, List.of());

        assertThat(report.totalSessions()).isZero();
        assertThat(report.completionRate()).isZero();
        assertThat(report.averageAttendanceRate()).isZero();
        assertThat(report.peakHour()).isNull();
        assertThat(report.utilization()).isEmpty();
    }

    @Test
    void countsRatesAndClients() {
        List<TrainingSession> sessions = List.of(
                session(1L, "2030-01-07T09:00:00Z", "2030-01-07T10:00:00Z", SessionStatus.COMPLETED, 4, 10L, 11L),
                session(1L, "2030-01-07T10:00:00Z", "2030-01-07T11:00:00Z", SessionStatus.COMPLETED, 2, 10L, 12L),
                session(1L, "2030-01-08T09:00:00Z", "2030-01-08T10:30:00Z", SessionStatus.IN_PROGRESS, 4, 13L),
                session(2L, "2030-01-08T15:00:00Z", "2030-01-08T16:00:00Z", SessionStatus.SCHEDULED, 4, 10L),
                session(2L, "2030-01-07T09:00:00Z", "2030-01-07T10:00:00Z", SessionStatus.CANCELLED, 4, 14L, 15L)
        );

        AnalyticsReport report = AnalyticsCalculator.calculate(null, FROM, TO, NOW, 10, sessions);

        assertThat(report.totalSessions()).isEqualTo(5);
        assertThat(report.completedSessions()).isEqualTo(2);
        assertThat(report.cancelledSessions()).isEqualTo(1);
        assertThat(report.inProgressSessions()).isEqualTo(1);
        assertThat(report.scheduledSessions()).isEqualTo(1);
        assertThat(report.upcomingSessions()).isEqualTo(1);
        // 2 completed of 3 that are past or running
        assertThat(report.completionRate()).isCloseTo(2.0 / 3.0, within(1e-9));
        // (0.5 + 1.0 + 0.25 + 0.25) / 4
        assertThat(report.averageAttendanceRate()).isCloseTo(0.5, within(1e-9));
        assertThat(report.bookedHours()).isCloseTo(4.5, within(1e-9));
        assertThat(report.distinctClients()).isEqualTo(4);
        assertThat(report.repeatClients()).isEqualTo(1);
    }

    @Test
    void utilizationPerTrainerOverPeriodDays() {
        List<TrainingSession> sessions = List.of(
                session(1L, "2030-01-07T09:00:00Z", "2030-01-07T11:00:00Z", SessionStatus.COMPLETED, 4, 10L),
                session(2L, "2030-01-07T09:00:00Z", "2030-01-07T10:00:00Z", SessionStatus.SCHEDULED, 4, 11L),
                session(2L, "2030-01-07T12:00:00Z", "2030-01-07T13:00:00Z", SessionStatus.CANCELLED, 4, 11L)
        );

        AnalyticsReport report = AnalyticsCalculator.calculate(null, FROM, TO, NOW, 10, sessions);

        assertThat(report.utilization())
                .extracting(TrainerUtilizationDTO::trainerId, TrainerUtilizationDTO::bookedMinutes, TrainerUtilizationDTO::availableMinutes)
                .containsExactly(
                        tuple(1L, 120L, 1200L),
                        tuple(2L, 60L, 1200L));
        assertThat(report.utilization().get(0).utilization()).isCloseTo(0.1, within(1e-9));
    }

    @Test
    void histogramsAndEarliestPeakHour() {
        List<TrainingSession> sessions = List.of(
                session(1L, "2030-01-07T18:00:00Z", "2030-01-07T19:00:00Z", SessionStatus.COMPLETED, 4, 10L),
                session(2L, "2030-01-08T18:00:00Z", "2030-01-08T19:00:00Z", SessionStatus.COMPLETED, 4, 10L),
                session(1L, "2030-01-07T07:00:00Z", "2030-01-07T08:00:00Z", SessionStatus.COMPLETED, 4, 10L),
                session(2L, "2030-01-08T07:00:00Z", "2030-01-08T08:00:00Z", SessionStatus.COMPLETED, 4, 10L),
                session(2L, "2030-01-08T12:00:00Z", "2030-01-08T13:00:00Z", SessionStatus.CANCELLED, 4, 10L)
        );

        AnalyticsReport report = AnalyticsCalculator.calculate(null, FROM, TO, NOW, 10, sessions);

        assertThat(report.peakHour()).isEqualTo(7);
        assertThat(report.peakHourSessionCount()).isEqualTo(2);
        assertThat(report.sessionsByHourOfDay()).containsOnlyKeys(7, 18);
        assertThat(report.sessionsByDayOfWeek())
                .containsEntry(DayOfWeek.MONDAY, 2L)
                .containsEntry(DayOfWeek.TUESDAY, 2L);
        assertThat(report.sessionsPerDay()).containsOnlyKeys(LocalDate.of(2030, 1, 7), LocalDate.of(2030, 1, 8));
    }

    @Test
    void periodDaysRoundsUpAndNeverDropsBelowOne() {
        assertThat(AnalyticsCalculator.periodDays(FROM, TO)).isEqualTo(2);
        assertThat(AnalyticsCalculator.periodDays(FROM, FROM.plusSeconds(3600))).isEqualTo(1);
        assertThat(AnalyticsCalculator.periodDays(FROM, FROM.plusSeconds(25 * 3600))).isEqualTo(2);
    }

    @Test
    void attendanceRateIsCappedAtOne() {
        TrainingSession session = session(1L, "2030-01-07T09:00:00Z", "2030-01-07T10:00:00Z", SessionStatus.SCHEDULED, 2, 10L, 11L);

        assertThat(AnalyticsCalculator.attendanceRate(session)).isEqualTo(1.0);
    }
}
