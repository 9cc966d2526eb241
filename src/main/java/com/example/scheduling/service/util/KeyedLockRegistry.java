package com.example.scheduling.service.util;

import com.example.scheduling.exception.SchedulingUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One fair lock per trainer id and per member id.
 * <p>
 * {@link #acquireAll} takes keys in a fixed global order, so two writers touching overlapping key
 * sets can never deadlock. Keys of unrelated trainers and members never share a lock.
 * <p>
 * A lock lives only while some thread holds it or waits for it; the last one out removes it.
 */
@Slf4j
@Component
public class KeyedLockRegistry {

    private final Map<LockKey, Entry> locks = new ConcurrentHashMap<>();

    public HeldLocks acquireAll(Collection<LockKey> keys, Duration timeout) {
        TreeSet<LockKey> ordered = new TreeSet<>(LockKey.ORDER);
        ordered.addAll(keys);

        Deque<LockKey> held = new ArrayDeque<>();
        long deadline = System.nanoTime() + timeout.toNanos();
        try {
            for (LockKey key : ordered) {
                Entry entry = retain(key);
                long remaining = deadline - System.nanoTime();
                boolean locked = false;
                try {
                    locked = entry.lock.tryLock(Math.max(remaining, 0), TimeUnit.NANOSECONDS);
                } finally {
                    if (!locked) {
                        release(key);
                    }
                }
                if (!locked) {
                    log.warn("Timed out after {} ms waiting for lock {}", timeout.toMillis(), key);
                    unlockAll(held);
                    throw new SchedulingUnavailableException("Another booking for " + key + " is in progress, retry shortly");
                }
                held.push(key);
            }
        } catch (InterruptedException e) {
            unlockAll(held);
            Thread.currentThread().interrupt();
            throw new SchedulingUnavailableException("Interrupted while waiting for scheduling locks", e);
        }
        return new HeldLocks(this, held, List.copyOf(ordered));
    }

    /** Non-blocking variant used by background jobs; returns null when any key is busy. */
    public HeldLocks tryAcquireAll(Collection<LockKey> keys) {
        TreeSet<LockKey> ordered = new TreeSet<>(LockKey.ORDER);
        ordered.addAll(keys);

        Deque<LockKey> held = new ArrayDeque<>();
        for (LockKey key : ordered) {
            Entry entry = retain(key);
            if (!entry.lock.tryLock()) {
                release(key);
                unlockAll(held);
                return null;
            }
            held.push(key);
        }
        return new HeldLocks(this, held, List.copyOf(ordered));
    }

    /** Number of keys currently held or waited on. */
    int activeKeys() {
        return locks.size();
    }

    private Entry retain(LockKey key) {
        return locks.compute(key, (k, entry) -> {
            Entry current = entry == null ? new Entry() : entry;
            current.users++;
            return current;
        });
    }

    private void release(LockKey key) {
        locks.computeIfPresent(key, (k, entry) -> --entry.users == 0 ? null : entry);
    }

    private void unlockAll(Deque<LockKey> held) {
        while (!held.isEmpty()) {
            LockKey key = held.pop();
            locks.get(key).lock.unlock();
            release(key);
        }
    }

    /** Guarded by the map's per-key compute. */
    private static final class Entry {
        private final ReentrantLock lock = new ReentrantLock(true);
        private int users;
    }

    public enum Kind { TRAINER, MEMBER }

    public record LockKey(Kind kind, Long id) {

        static final Comparator<LockKey> ORDER = Comparator
                .comparing(LockKey::kind)
                .thenComparing(LockKey::id);

        public static LockKey trainer(Long trainerId) {
            return new LockKey(Kind.TRAINER, trainerId);
        }

        public static LockKey member(Long memberId) {
            return new LockKey(Kind.MEMBER, memberId);
        }

        @Override
        public String toString() {
            return kind.name().toLowerCase(Locale.ROOT) + ":" + id;
        }
    }

    /** Releases in reverse acquisition order on close. */
    public static final class HeldLocks implements AutoCloseable {
        private final KeyedLockRegistry registry;
        private final Deque<LockKey> held;
        private final List<LockKey> keys;

        private HeldLocks(KeyedLockRegistry registry, Deque<LockKey> held, List<LockKey> keys) {
            this.registry = registry;
            this.held = held;
            this.keys = keys;
        }

        public List<LockKey> keys() {
            return keys;
        }

        public boolean covers(LockKey key) {
            return keys.contains(key);
        }

        @Override
        public void close() {
            registry.unlockAll(held);
        }
    }
}
