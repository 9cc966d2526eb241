package com.example.scheduling.service;

import com.example.scheduling.model.TimeInterval;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class IntervalIndexTest {

    private static final Duration TIMEOUT = Duration.ofMillis(200);
    private static final Long TRAINER = 7L;

    private IntervalIndex index;

    @BeforeEach
    void setUp() {
        index = new IntervalIndex();
    }

    private static TimeInterval at(String start, String end) {
        return new TimeInterval(Instant.parse("2030-05-06T" + start + ":00Z"), Instant.parse("2030-05-06T" + end + ":00Z"));
    }

    @Test
    void intervalsAreOrderedByStart() {
        index.insert(TRAINER, at("13:00", "14:00"), 3L);
        index.insert(TRAINER, at("08:00", "09:00"), 1L);
        index.insert(TRAINER, at("10:00", "11:00"), 2L);

        assertThat(index.intervals(TRAINER))
                .extracting(IndexedInterval::sessionId)
                .containsExactly(1L, 2L, 3L);
    }

    @Test
    void findsOverlapAndIgnoresBackToBack() {
        index.insert(TRAINER, at("09:00", "10:00"), 1L);
        index.insert(TRAINER, at("10:00", "11:00"), 2L);

        assertThat(index.overlapping(TRAINER, at("09:30", "10:00"), null, TIMEOUT))
                .extracting(IndexedInterval::sessionId)
                .containsExactly(1L);
        assertThat(index.overlapping(TRAINER, at("11:00", "12:00"), null, TIMEOUT)).isEmpty();
        assertThat(index.overlapping(TRAINER, at("08:00", "09:00"), null, TIMEOUT)).isEmpty();
    }

    @Test
    void longSessionStartingEarlyIsStillFound() {
        index.insert(TRAINER, at("06:00", "18:00"), 1L);
        index.insert(TRAINER, at("12:00", "12:30"), 2L);

        List<IndexedInterval> hits = index.overlapping(TRAINER, at("15:00", "15:30"), null, TIMEOUT);

        assertThat(hits).extracting(IndexedInterval::sessionId).containsExactly(1L);
    }

    @Test
    void excludedSessionIsSkipped() {
        index.insert(TRAINER, at("09:00", "10:00"), 1L);

        assertThat(index.overlapping(TRAINER, at("09:15", "09:45"), 1L, TIMEOUT)).isEmpty();
    }

    @Test
    void otherTrainersAreIndependent() {
        index.insert(TRAINER, at("09:00", "10:00"), 1L);

        assertThat(index.overlapping(99L, at("09:00", "10:00"), null, TIMEOUT)).isEmpty();
        assertThat(index.intervals(99L)).isEmpty();
    }

    @Test
    void removeDropsTheEntry() {
        index.insert(TRAINER, at("09:00", "10:00"), 1L);
        index.remove(TRAINER, 1L);

        assertThat(index.intervals(TRAINER)).isEmpty();
        assertThat(index.overlapping(TRAINER, at("09:00", "10:00"), null, TIMEOUT)).isEmpty();
    }

    @Test
    void reinsertReplacesPreviousWindow() {
        index.insert(TRAINER, at("09:00", "10:00"), 1L);
        index.insert(TRAINER, at("15:00", "16:00"), 1L);

        assertThat(index.intervals(TRAINER)).hasSize(1);
        assertThat(index.overlapping(TRAINER, at("09:00", "10:00"), null, TIMEOUT)).isEmpty();
    }

    @Test
    void moveToAnotherTrainer() {
        index.insert(TRAINER, at("09:00", "10:00"), 1L);

        index.move(TRAINER, 8L, at("11:00", "12:00"), 1L);

        assertThat(index.intervals(TRAINER)).isEmpty();
        assertThat(index.intervals(8L))
                .singleElement()
                .satisfies(entry -> {
                    assertThat(entry.trainerId()).isEqualTo(8L);
                    assertThat(entry.interval()).isEqualTo(at("11:00", "12:00"));
                });
    }

    @Test
    void replaceSwapsWholeTrainerSet() {
        index.insert(TRAINER, at("09:00", "10:00"), 1L);

        index.replace(TRAINER, List.of(new IndexedInterval(5L, TRAINER, at("14:00", "15:00"))));

        assertThat(index.intervals(TRAINER)).extracting(IndexedInterval::sessionId).containsExactly(5L);
        assertThat(index.trainerIds()).containsExactly(TRAINER);
    }

    @Test
    void invertedQueryWindowMatchesNothing() {
        index.insert(TRAINER, at("09:00", "10:00"), 1L);

        assertThat(index.overlapping(TRAINER, at("10:00", "09:00"), null, TIMEOUT)).isEmpty();
    }
}
