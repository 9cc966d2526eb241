package com.example.scheduling.service;

import java.util.Collection;
import java.util.Set;

/** Trainer and member lookup the engine consumes. */
public interface ParticipantDirectory {

    boolean isActiveTrainer(Long trainerId);

    /** Ids from {@code memberIds} that are unknown or not active. */
    Set<Long> findUnavailableMembers(Collection<Long> memberIds);
}
