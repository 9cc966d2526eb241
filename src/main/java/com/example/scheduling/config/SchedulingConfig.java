package com.example.scheduling.config;

import com.example.scheduling.security.AuthorizationGuard;
import com.example.scheduling.security.CapabilityTable;
import com.example.scheduling.security.RoleAliases;
import lombok.Data;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;

@Configuration
@Data
public class SchedulingConfig {

    @Value("${scheduling.capacity.upper-bound:20}")
    int capacityUpperBound;

    @Value("${scheduling.lock.timeout-ms:300}")
    long lockTimeoutMs;

    @Value("${scheduling.availability.timeout-ms:250}")
    long availabilityTimeoutMs;

    @Value("${scheduling.analytics.available-hours-per-day:10}")
    int availableHoursPerDay;

    /** "coach:TRAINER,owner:ADMIN" */
    @Value("${scheduling.authorization.role-aliases:}")
    String roleAliasSpec;

    public Duration lockTimeout() {
        return Duration.ofMillis(lockTimeoutMs);
    }

    public Duration availabilityTimeout() {
        return Duration.ofMillis(availabilityTimeoutMs);
    }

    /** Fails startup when an alias names an unknown role. */
    @Bean
    public RoleAliases roleAliases() {
        return RoleAliases.parse(roleAliasSpec);
    }

    @Bean
    public AuthorizationGuard authorizationGuard() {
        return new AuthorizationGuard(CapabilityTable.standard());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public TransactionTemplate transactionTemplate(PlatformTransactionManager transactionManager) {
        return new TransactionTemplate(transactionManager);
    }
}
