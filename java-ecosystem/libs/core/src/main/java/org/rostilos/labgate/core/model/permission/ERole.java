package org.rostilos.labgate.core.model.permission;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * GitLab membership roles, lowest to highest, with their {@code access_level}.
 */
public enum ERole {
    GUEST(10),
    REPORTER(20),
    DEVELOPER(30),
    MAINTAINER(40),
    OWNER(50);

    private final int accessLevel;

    ERole(int accessLevel) {
        this.accessLevel = accessLevel;
    }

    public int getAccessLevel() {
        return accessLevel;
    }

    @JsonValue
    public String getId() {
        return name().toLowerCase(Locale.ENGLISH);
    }

    /**
     * Case-insensitive lookup by role name.
     */
    public static Optional<ERole> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toUpperCase(Locale.ENGLISH);
        for (ERole role : values()) {
            if (role.name().equals(normalized)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }

    public static Optional<ERole> fromAccessLevel(int accessLevel) {
        return Arrays.stream(values()).filter(r -> r.accessLevel == accessLevel).findFirst();
    }

    public static String validNames() {
        return Arrays.stream(values()).map(ERole::getId).collect(Collectors.joining(", "));
    }
}
