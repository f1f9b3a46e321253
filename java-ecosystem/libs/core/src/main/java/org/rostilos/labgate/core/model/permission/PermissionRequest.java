package org.rostilos.labgate.core.model.permission;

/**
 * Caller input for a role change. The role stays a raw string until validated.
 */
public record PermissionRequest(
    String username,

    /**
     * Full path of a group or project, e.g. {@code platform-team} or {@code platform-team/api}.
     */
    String target,

    String role
) {
}
