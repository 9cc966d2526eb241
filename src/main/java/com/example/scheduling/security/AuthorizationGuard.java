package com.example.scheduling.security;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Pure decision function over a {@link CapabilityTable}.
 * <p>
 * The table must cover every {@link Role}; a table that does not is rejected at construction,
 * so a missing role surfaces at startup rather than on a request.
 */
public class AuthorizationGuard {

    private final CapabilityTable table;

    public AuthorizationGuard(CapabilityTable table) {
        List<Role> missing = Arrays.stream(Role.values())
                .filter(role -> !table.covers(role))
                .toList();
        if (!missing.isEmpty()) {
            throw new IllegalStateException("Capability table has no entry for roles " + missing);
        }
        this.table = table;
    }

    /**
     * @param ownerRef trainer or member id that owns the record, or null when the record has no owner
     */
    public AuthorizationDecision authorize(Principal principal, Operation operation, ResourceKind kind, Long ownerRef) {
        if (principal == null) {
            principal = Principal.anonymous();
        }

        Capability capability = table.lookup(principal.role(), kind, operation);
        return switch (capability) {
            case ANY -> AuthorizationDecision.allow();
            case OWN -> principal.owns(ownerRef)
                    ? AuthorizationDecision.allow()
                    : AuthorizationDecision.deny(principal.role() + " may only " + describe(operation, kind) + " own records");
            case NONE -> AuthorizationDecision.deny(principal.role() + " may not " + describe(operation, kind));
        };
    }

    public boolean canReadSessions(Principal principal) {
        return authorize(principal, Operation.READ, ResourceKind.SESSION, null).allowed();
    }

    private static String describe(Operation operation, ResourceKind kind) {
        return operation.name().toLowerCase(Locale.ROOT) + " " + kind.name().toLowerCase(Locale.ROOT);
    }
}
