package com.example.scheduling.security;

import java.util.Objects;

/**
 * Acting identity of a request. {@code id} is the trainer or member id for those roles,
 * and may be null for admins and anonymous callers.
 */
public record Principal(Role role, Long id) {

    private static final Principal ANONYMOUS = new Principal(Role.ANONYMOUS, null);

    public Principal {
        Objects.requireNonNull(role, "role");
    }

    public static Principal anonymous() {
        return ANONYMOUS;
    }

    public static Principal admin() {
        return new Principal(Role.ADMIN, null);
    }

    public static Principal trainer(Long trainerId) {
        return new Principal(Role.TRAINER, trainerId);
    }

    public static Principal member(Long memberId) {
        return new Principal(Role.MEMBER, memberId);
    }

    public boolean owns(Long ownerRef) {
        return id != null && id.equals(ownerRef);
    }
}
