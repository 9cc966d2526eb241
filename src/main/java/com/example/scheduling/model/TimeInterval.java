package com.example.scheduling.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Half-open time window {@code [start, end)} in UTC.
 * <p>
 * Two windows overlap iff {@code s1 < e2 && s2 < e1}; touching endpoints do not overlap.
 * This is the only place the overlap rule is written down; trainer and member checks both use it.
 */
public record TimeInterval(Instant start, Instant end) {

    public TimeInterval {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
    }

    public boolean overlaps(TimeInterval other) {
        return start.isBefore(other.end) && other.start.isBefore(end);
    }

    public boolean isEmptyOrInverted() {
        return !end.isAfter(start);
    }

    public Duration duration() {
        return Duration.between(start, end);
    }
}
