package com.example.scheduling.model;

import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;

class SessionStatusTest {

    @Test
    void scheduledMovesToInProgressOrCancelled() {
        assertThat(SessionStatus.SCHEDULED.allowedTargets())
                .containsExactlyInAnyOrder(SessionStatus.IN_PROGRESS, SessionStatus.CANCELLED);
        assertThat(SessionStatus.SCHEDULED.canTransitionTo(SessionStatus.COMPLETED)).isFalse();
    }

    @Test
    void inProgressMovesToCompletedOrCancelled() {
        assertThat(SessionStatus.IN_PROGRESS.allowedTargets())
                .containsExactlyInAnyOrder(SessionStatus.COMPLETED, SessionStatus.CANCELLED);
        assertThat(SessionStatus.IN_PROGRESS.canTransitionTo(SessionStatus.SCHEDULED)).isFalse();
    }

    @Test
    void terminalStatesHaveNoExits() {
        for (SessionStatus terminal : new SessionStatus[]{SessionStatus.COMPLETED, SessionStatus.CANCELLED}) {
            assertThat(terminal.isTerminal()).isTrue();
            for (SessionStatus target : SessionStatus.values()) {
                assertThat(terminal.canTransitionTo(target)).isFalse();
            }
        }
    }

    @Test
    void nullTargetIsNeverAllowed() {
        assertThat(SessionStatus.SCHEDULED.canTransitionTo(null)).isFalse();
    }

    @Test
    void parsesLowerAndUpperCase() {
        assertThat(SessionStatus.fromValue("in_progress")).isEqualTo(SessionStatus.IN_PROGRESS);
        assertThat(SessionStatus.fromValue(" CANCELLED ")).isEqualTo(SessionStatus.CANCELLED);
        assertThat(SessionStatus.fromValue("archived")).isNull();
        assertThat(SessionStatus.fromValue(null)).isNull();
    }

    @Test
    void parsingIgnoresDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            assertThat(SessionStatus.fromValue("in_progress")).isEqualTo(SessionStatus.IN_PROGRESS);
            assertThat(SessionStatus.fromValue("scheduled")).isEqualTo(SessionStatus.SCHEDULED);
        } finally {
            Locale.setDefault(previous);
        }
    }
}
