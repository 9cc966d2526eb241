package com.example.scheduling.service.impl;

import com.example.scheduling.exception.SchedulingUnavailableException;
import com.example.scheduling.model.Member;
import com.example.scheduling.model.Trainer;
import com.example.scheduling.repository.MemberRepository;
import com.example.scheduling.repository.TrainerRepository;
import com.example.scheduling.service.ParticipantDirectory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class JpaParticipantDirectory implements ParticipantDirectory {

    private final TrainerRepository trainerRepository;
    private final MemberRepository memberRepository;

    @Override
    public boolean isActiveTrainer(Long trainerId) {
        if (trainerId == null) {
            return false;
        }
        try {
            return trainerRepository.findById(trainerId)
                    .map(Trainer::isActive)
                    .orElse(false);
        } catch (DataAccessException e) {
            throw new SchedulingUnavailableException("Trainer directory lookup failed", e);
        }
    }

    @Override
    public Set<Long> findUnavailableMembers(Collection<Long> memberIds) {
        if (memberIds.isEmpty()) {
            return Set.of();
        }
        Set<Long> active;
        try {
            active = memberRepository.findAllById(memberIds).stream()
                    .filter(Member::isActive)
                    .map(Member::getId)
                    .collect(Collectors.toSet());
        } catch (DataAccessException e) {
            throw new SchedulingUnavailableException("Member directory lookup failed", e);
        }

        Set<Long> unavailable = new LinkedHashSet<>(memberIds);
        unavailable.removeAll(active);
        if (!unavailable.isEmpty()) {
            log.debug("Members unknown or inactive: {}", unavailable);
        }
        return unavailable;
    }
}
