package com.example.scheduling.service;

import com.example.scheduling.model.TimeInterval;

import java.util.Comparator;

/** One active session's window as held by the {@link IntervalIndex}. */
public record IndexedInterval(Long sessionId, Long trainerId, TimeInterval interval) {

    static final Comparator<IndexedInterval> BY_START = Comparator
            .comparing((IndexedInterval i) -> i.interval().start())
            .thenComparing(IndexedInterval::sessionId);
}
