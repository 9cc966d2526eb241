package com.example.scheduling.security;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AuthorizationGuardTest {

    private AuthorizationGuard guard;

    @BeforeEach
    void setUp() {
        guard = new AuthorizationGuard(CapabilityTable.standard());
    }

    @Test
    void adminMayDoAnything() {
        for (ResourceKind kind : ResourceKind.values()) {
            for (Operation operation : Operation.values()) {
                assertThat(guard.authorize(Principal.admin(), operation, kind, null).allowed())
                        .as("%s %s", operation, kind)
                        .isTrue();
            }
        }
    }

    @Test
    void trainerWritesSessionsAndBookingsOfAnyOwner() {
        Principal trainer = Principal.trainer(4L);

        assertThat(guard.authorize(trainer, Operation.WRITE, ResourceKind.SESSION, 99L).allowed()).isTrue();
        assertThat(guard.authorize(trainer, Operation.WRITE, ResourceKind.BOOKING, null).allowed()).isTrue();
    }

    @Test
    void trainerEditsOnlyOwnProfile() {
        Principal trainer = Principal.trainer(4L);

        assertThat(guard.authorize(trainer, Operation.WRITE, ResourceKind.TRAINER_PROFILE, 4L).allowed()).isTrue();
        AuthorizationDecision other = guard.authorize(trainer, Operation.WRITE, ResourceKind.TRAINER_PROFILE, 5L);
        assertThat(other.denied()).isTrue();
        assertThat(other.reason()).contains("own records");
    }

    @Test
    void trainerIsDeniedPayments() {
        assertThat(guard.authorize(Principal.trainer(4L), Operation.READ, ResourceKind.PAYMENT, null).denied()).isTrue();
    }

    @Test
    void memberReadsOnlyOwnBookings() {
        Principal member = Principal.member(11L);

        assertThat(guard.authorize(member, Operation.READ, ResourceKind.BOOKING, 11L).allowed()).isTrue();
        assertThat(guard.authorize(member, Operation.READ, ResourceKind.BOOKING, 12L).denied()).isTrue();
        assertThat(guard.authorize(member, Operation.WRITE, ResourceKind.BOOKING, 11L).denied()).isTrue();
        assertThat(guard.authorize(member, Operation.WRITE, ResourceKind.SESSION, null).denied()).isTrue();
        assertThat(guard.canReadSessions(member)).isFalse();
    }

    @Test
    void anonymousAndNullPrincipalAreDeniedEverything() {
        for (ResourceKind kind : ResourceKind.values()) {
            assertThat(guard.authorize(Principal.anonymous(), Operation.READ, kind, null).denied()).isTrue();
            assertThat(guard.authorize(null, Operation.WRITE, kind, null).denied()).isTrue();
        }
    }

    @Test
    void tableMissingARoleIsRejectedAtConstruction() {
        CapabilityTable incomplete = CapabilityTable.builder()
                .grant(Role.ADMIN, ResourceKind.SESSION, Operation.WRITE, Capability.ANY)
                .role(Role.TRAINER)
                .role(Role.MEMBER)
                .build();

        assertThatThrownBy(() -> new AuthorizationGuard(incomplete))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("ANONYMOUS");
    }
}
