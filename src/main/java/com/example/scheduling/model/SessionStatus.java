package com.example.scheduling.model;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Lifecycle of a training session.
 * COMPLETED and CANCELLED are terminal.
 */
public enum SessionStatus {
    SCHEDULED,
    IN_PROGRESS,
    COMPLETED,
    CANCELLED;

    public Set<SessionStatus> allowedTargets() {
        return switch (this) {
            case SCHEDULED -> EnumSet.of(IN_PROGRESS, CANCELLED);
            case IN_PROGRESS -> EnumSet.of(COMPLETED, CANCELLED);
            case COMPLETED, CANCELLED -> EnumSet.noneOf(SessionStatus.class);
        };
    }

    public boolean canTransitionTo(SessionStatus target) {
        return target != null && allowedTargets().contains(target);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }

    /** Accepts both "in_progress" and "IN_PROGRESS". */
    public static SessionStatus fromValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return SessionStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
