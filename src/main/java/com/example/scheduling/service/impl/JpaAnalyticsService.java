package com.example.scheduling.service.impl;

import com.example.scheduling.config.SchedulingConfig;
import com.example.scheduling.dto.AnalyticsReport;
import com.example.scheduling.exception.NotAccessibleException;
import com.example.scheduling.exception.SchedulingUnavailableException;
import com.example.scheduling.model.TrainingSession;
import com.example.scheduling.repository.TrainingSessionRepository;
import com.example.scheduling.security.AuthorizationGuard;
import com.example.scheduling.security.Principal;
import com.example.scheduling.service.AnalyticsService;
import com.example.scheduling.service.util.AnalyticsCalculator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class JpaAnalyticsService implements AnalyticsService {

    private final TrainingSessionRepository sessionRepository;
    private final AuthorizationGuard authorizationGuard;
    private final SchedulingConfig config;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public AnalyticsReport getAnalytics(Principal principal, Long trainerId, Instant from, Instant to) {
        if (!authorizationGuard.canReadSessions(principal)) {
            throw new NotAccessibleException();
        }
        if (from == null || to == null || !to.isAfter(from)) {
            throw new IllegalArgumentException("Report period end must be later than its start");
        }

        List<TrainingSession> sessions;
        try {
            sessions = sessionRepository.findForAnalytics(trainerId, from, to);
        } catch (DataAccessException e) {
            throw new SchedulingUnavailableException("Session storage unavailable", e);
        }
        log.debug("Analytics for trainer={} {}-{} over {} sessions", trainerId, from, to, sessions.size());

        return AnalyticsCalculator.calculate(trainerId, from, to, clock.instant(),
                config.getAvailableHoursPerDay(), sessions);
    }
}
