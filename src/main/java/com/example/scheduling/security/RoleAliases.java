package com.example.scheduling.security;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Maps identity-provider role names to engine roles. Engine role names always map to themselves.
 */
public final class RoleAliases {

    private final Map<String, Role> aliases;

    private RoleAliases(Map<String, Role> aliases) {
        this.aliases = Collections.unmodifiableMap(aliases);
    }

    /**
     * Parses "coach:TRAINER,owner:ADMIN".
     *
     * @throws IllegalStateException when a pair is malformed or names an unknown role
     */
    public static RoleAliases parse(String mappings) {
        Map<String, Role> map = new LinkedHashMap<>();
        for (Role role : Role.values()) {
            map.put(role.name().toLowerCase(Locale.ROOT), role);
        }
        if (mappings == null || mappings.isBlank()) {
            return new RoleAliases(map);
        }
        for (String pair : mappings.split(",")) {
            String[] parts = pair.split(":");
            if (parts.length != 2 || parts[0].isBlank()) {
                throw new IllegalStateException("Malformed role alias '" + pair.trim() + "', expected alias:ROLE");
            }
            String target = parts[1].trim().toUpperCase(Locale.ROOT);
            Role role;
            try {
                role = Role.valueOf(target);
            } catch (IllegalArgumentException e) {
                throw new IllegalStateException("Role alias '" + parts[0].trim() + "' points at unknown role " + target, e);
            }
            map.put(parts[0].trim().toLowerCase(Locale.ROOT), role);
        }
        return new RoleAliases(map);
    }

    public Optional<Role> lookup(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(aliases.get(name.trim().toLowerCase(Locale.ROOT)));
    }
}
