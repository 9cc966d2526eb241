package com.example.scheduling.service;

import com.example.scheduling.model.SessionStatus;
import com.example.scheduling.model.TrainingSession;
import com.example.scheduling.repository.TrainingSessionRepository;
import com.example.scheduling.service.util.KeyedLockRegistry;
import com.example.scheduling.service.util.KeyedLockRegistry.HeldLocks;
import com.example.scheduling.service.util.KeyedLockRegistry.LockKey;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Keeps the {@link IntervalIndex} equal to the committed non-cancelled sessions.
 * Rebuilt once at startup, then compared trainer by trainer on a fixed delay.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IntervalIndexReconciler {

    private final TrainingSessionRepository sessionRepository;
    private final IntervalIndex intervalIndex;
    private final KeyedLockRegistry locks;

    @PostConstruct
    public void rebuild() {
        List<TrainingSession> active = sessionRepository.findByStatusNot(SessionStatus.CANCELLED);
        Map<Long, List<IndexedInterval>> byTrainer = active.stream()
                .map(IntervalIndexReconciler::toIndexed)
                .collect(Collectors.groupingBy(IndexedInterval::trainerId));

        intervalIndex.clear();
        byTrainer.forEach(intervalIndex::replace);
        log.info("Interval index rebuilt: {} active session(s) across {} trainer(s)", active.size(), byTrainer.size());
    }

    @Scheduled(fixedDelayString = "${scheduling.index.reconcile-interval-ms:300000}",
            initialDelayString = "${scheduling.index.reconcile-interval-ms:300000}")
    public void reconcile() {
        Set<Long> trainerIds;
        try {
            trainerIds = new HashSet<>(sessionRepository.findTrainerIdsByStatusNot(SessionStatus.CANCELLED));
        } catch (DataAccessException e) {
            log.warn("Index reconciliation skipped, storage unavailable: {}", e.getMessage());
            return;
        }
        trainerIds.addAll(intervalIndex.trainerIds());

        int repaired = 0;
        for (Long trainerId : trainerIds) {
            if (reconcileTrainer(trainerId)) {
                repaired++;
            }
        }
        if (repaired > 0) {
            log.warn("Interval index drift repaired for {} trainer(s)", repaired);
        }
    }

    /**
     * @return true when the trainer's entries differed from storage and were replaced
     */
    boolean reconcileTrainer(Long trainerId) {
        // busy trainers are picked up on the next run
        try (HeldLocks held = locks.tryAcquireAll(List.of(LockKey.trainer(trainerId)))) {
            if (held == null) {
                return false;
            }
            Set<IndexedInterval> stored = sessionRepository.findByTrainerIdAndStatusNot(trainerId, SessionStatus.CANCELLED)
                    .stream()
                    .map(IntervalIndexReconciler::toIndexed)
                    .collect(Collectors.toSet());
            Set<IndexedInterval> indexed = new HashSet<>(intervalIndex.intervals(trainerId));

            if (stored.equals(indexed)) {
                return false;
            }
            log.warn("Trainer {} index drift: indexed={} stored={}", trainerId, indexed.size(), stored.size());
            intervalIndex.replace(trainerId, stored);
            return true;
        } catch (DataAccessException e) {
            log.warn("Reconciliation of trainer {} failed: {}", trainerId, e.getMessage());
            return false;
        }
    }

    private static IndexedInterval toIndexed(TrainingSession session) {
        return new IndexedInterval(session.getId(), session.getTrainerId(), session.interval());
    }
}
