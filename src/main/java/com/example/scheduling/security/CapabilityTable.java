package com.example.scheduling.security;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Closed table of role x resource kind x operation capabilities.
 * Anything not granted is {@link Capability#NONE}.
 */
public final class CapabilityTable {

    private final Map<Role, Map<ResourceKind, Map<Operation, Capability>>> grants;

    private CapabilityTable(Map<Role, Map<ResourceKind, Map<Operation, Capability>>> grants) {
        this.grants = grants;
    }

    public static CapabilityTable standard() {
        Builder b = builder();
        for (ResourceKind kind : ResourceKind.values()) {
            b.grant(Role.ADMIN, kind, Operation.READ, Capability.ANY);
            b.grant(Role.ADMIN, kind, Operation.WRITE, Capability.ANY);
        }

        b.grant(Role.TRAINER, ResourceKind.SESSION, Operation.READ, Capability.ANY);
        b.grant(Role.TRAINER, ResourceKind.SESSION, Operation.WRITE, Capability.ANY);
        b.grant(Role.TRAINER, ResourceKind.BOOKING, Operation.READ, Capability.ANY);
        b.grant(Role.TRAINER, ResourceKind.BOOKING, Operation.WRITE, Capability.ANY);
        b.grant(Role.TRAINER, ResourceKind.TRAINER_PROFILE, Operation.READ, Capability.ANY);
        b.grant(Role.TRAINER, ResourceKind.TRAINER_PROFILE, Operation.WRITE, Capability.OWN);
        b.grant(Role.TRAINER, ResourceKind.MEMBER_PROFILE, Operation.READ, Capability.ANY);

        b.grant(Role.MEMBER, ResourceKind.BOOKING, Operation.READ, Capability.OWN);

        b.role(Role.ANONYMOUS);
        return b.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean covers(Role role) {
        return grants.containsKey(role);
    }

    public Capability lookup(Role role, ResourceKind kind, Operation operation) {
        return grants.getOrDefault(role, Collections.emptyMap())
                .getOrDefault(kind, Collections.emptyMap())
                .getOrDefault(operation, Capability.NONE);
    }

    public static final class Builder {
        private final Map<Role, Map<ResourceKind, Map<Operation, Capability>>> grants = new EnumMap<>(Role.class);

        /** Registers a role with no capabilities yet. */
        public Builder role(Role role) {
            grants.computeIfAbsent(role, r -> new EnumMap<>(ResourceKind.class));
            return this;
        }

        public Builder grant(Role role, ResourceKind kind, Operation operation, Capability capability) {
            grants.computeIfAbsent(role, r -> new EnumMap<>(ResourceKind.class))
                    .computeIfAbsent(kind, k -> new EnumMap<>(Operation.class))
                    .put(operation, capability);
            return this;
        }

        public CapabilityTable build() {
            Map<Role, Map<ResourceKind, Map<Operation, Capability>>> copy = new EnumMap<>(Role.class);
            grants.forEach((role, byKind) -> {
                Map<ResourceKind, Map<Operation, Capability>> kinds = new EnumMap<>(ResourceKind.class);
                byKind.forEach((kind, ops) -> kinds.put(kind, Collections.unmodifiableMap(new EnumMap<>(ops))));
                copy.put(role, Collections.unmodifiableMap(kinds));
            });
            return new CapabilityTable(Collections.unmodifiableMap(copy));
        }
    }
}
