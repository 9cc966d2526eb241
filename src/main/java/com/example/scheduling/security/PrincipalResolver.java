package com.example.scheduling.security;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Builds the {@link Principal} from the headers set by the upstream authentication layer.
 * Unknown roles and malformed ids resolve to the anonymous principal.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PrincipalResolver {

    public static final String ROLE_HEADER = "X-Principal-Role";
    public static final String ID_HEADER = "X-Principal-Id";

    private final RoleAliases roleAliases;

    public Principal resolve(String roleHeader, String idHeader) {
        if (roleHeader == null || roleHeader.isBlank()) {
            return Principal.anonymous();
        }
        Role role = roleAliases.lookup(roleHeader).orElse(null);
        if (role == null) {
            log.debug("Unrecognized principal role '{}', treating as anonymous", roleHeader);
            return Principal.anonymous();
        }

        Long id = null;
        if (idHeader != null && !idHeader.isBlank()) {
            try {
                id = Long.valueOf(idHeader.trim());
            } catch (NumberFormatException e) {
                log.debug("Malformed principal id '{}', treating as anonymous", idHeader);
                return Principal.anonymous();
            }
        }
        if ((role == Role.TRAINER || role == Role.MEMBER) && id == null) {
            return Principal.anonymous();
        }
        return new Principal(role, id);
    }
}
