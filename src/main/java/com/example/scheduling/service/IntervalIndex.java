package com.example.scheduling.service;

import com.example.scheduling.exception.SchedulingUnavailableException;
import com.example.scheduling.model.TimeInterval;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Per-trainer ordered set of active session windows.
 * <p>
 * Entries are sorted by start. An overlap query only scans entries starting in
 * {@code (queryStart - longestDuration, queryEnd)}, which is O(log n + k) for a trainer's
 * interval set. Only non-cancelled sessions are held here; the index is updated by the
 * lifecycle manager after each commit and rebuilt from storage by {@link IntervalIndexReconciler}.
 */
@Slf4j
@Component
public class IntervalIndex {

    private final Map<Long, TrainerIntervals> byTrainer = new ConcurrentHashMap<>();

    /** Ordered snapshot of a trainer's active windows. */
    public List<IndexedInterval> intervals(Long trainerId) {
        TrainerIntervals set = byTrainer.get(trainerId);
        if (set == null) {
            return List.of();
        }
        set.lock.readLock().lock();
        try {
            return List.copyOf(set.ordered);
        } finally {
            set.lock.readLock().unlock();
        }
    }

    /**
     * Active windows of the trainer overlapping {@code window}, ordered by start.
     *
     * @throws SchedulingUnavailableException when the trainer's set cannot be read within {@code timeout}
     */
    public List<IndexedInterval> overlapping(Long trainerId, TimeInterval window, Long excludeSessionId, Duration timeout) {
        TrainerIntervals set = byTrainer.get(trainerId);
        if (set == null || window.isEmptyOrInverted()) {
            return List.of();
        }
        boolean locked;
        try {
            locked = set.lock.readLock().tryLock(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SchedulingUnavailableException("Interrupted while reading trainer schedule", e);
        }
        if (!locked) {
            throw new SchedulingUnavailableException("Trainer schedule busy, availability check timed out");
        }
        try {
            Instant lowerStart = window.start().minus(set.longest);
            IndexedInterval from = searchKey(lowerStart);
            IndexedInterval to = searchKey(window.end());

            List<IndexedInterval> result = new ArrayList<>();
            for (IndexedInterval candidate : set.ordered.subSet(from, true, to, false)) {
                if (candidate.sessionId().equals(excludeSessionId)) {
                    continue;
                }
                if (candidate.interval().overlaps(window)) {
                    result.add(candidate);
                }
            }
            return result;
        } finally {
            set.lock.readLock().unlock();
        }
    }

    public void insert(Long trainerId, TimeInterval interval, Long sessionId) {
        TrainerIntervals set = byTrainer.computeIfAbsent(trainerId, id -> new TrainerIntervals());
        set.lock.writeLock().lock();
        try {
            set.removeSession(sessionId);
            set.add(new IndexedInterval(sessionId, trainerId, interval));
        } finally {
            set.lock.writeLock().unlock();
        }
    }

    public void remove(Long trainerId, Long sessionId) {
        TrainerIntervals set = byTrainer.get(trainerId);
        if (set == null) {
            return;
        }
        set.lock.writeLock().lock();
        try {
            set.removeSession(sessionId);
        } finally {
            set.lock.writeLock().unlock();
        }
    }

    /** Moves a session's entry, possibly to another trainer. */
    public void move(Long fromTrainerId, Long toTrainerId, TimeInterval interval, Long sessionId) {
        if (!fromTrainerId.equals(toTrainerId)) {
            remove(fromTrainerId, sessionId);
        }
        insert(toTrainerId, interval, sessionId);
    }

    /** Replaces everything held for a trainer with the given windows. */
    public void replace(Long trainerId, Collection<IndexedInterval> intervals) {
        TrainerIntervals set = byTrainer.computeIfAbsent(trainerId, id -> new TrainerIntervals());
        set.lock.writeLock().lock();
        try {
            set.clear();
            intervals.forEach(set::add);
        } finally {
            set.lock.writeLock().unlock();
        }
    }

    public Set<Long> trainerIds() {
        return Set.copyOf(byTrainer.keySet());
    }

    public void clear() {
        byTrainer.clear();
    }

    private static IndexedInterval searchKey(Instant start) {
        return new IndexedInterval(Long.MIN_VALUE, null, new TimeInterval(start, start));
    }

    private static final class TrainerIntervals {
        final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
        final NavigableSet<IndexedInterval> ordered = new TreeSet<>(IndexedInterval.BY_START);
        final Map<Long, IndexedInterval> bySession = new HashMap<>();
        // only grows; a stale upper bound widens the scan but never hides an overlap
        Duration longest = Duration.ZERO;

        void add(IndexedInterval entry) {
            ordered.add(entry);
            bySession.put(entry.sessionId(), entry);
            Duration duration = entry.interval().duration();
            if (duration.compareTo(longest) > 0) {
                longest = duration;
            }
        }

        void removeSession(Long sessionId) {
            IndexedInterval previous = bySession.remove(sessionId);
            if (previous != null) {
                ordered.remove(previous);
            }
        }

        void clear() {
            ordered.clear();
            bySession.clear();
            longest = Duration.ZERO;
        }
    }
}
