package com.example.scheduling.service;

import com.example.scheduling.dto.AnalyticsReport;
import com.example.scheduling.security.Principal;

import java.time.Instant;

public interface AnalyticsService {

    /**
     * Rollup over sessions starting in {@code [from, to)}.
     *
     * @param trainerId restricts the report to one trainer; null covers all trainers
     */
    AnalyticsReport getAnalytics(Principal principal, Long trainerId, Instant from, Instant to);
}
