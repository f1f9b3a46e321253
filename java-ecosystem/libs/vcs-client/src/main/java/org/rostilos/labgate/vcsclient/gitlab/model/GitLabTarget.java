package org.rostilos.labgate.vcsclient.gitlab.model;

/**
 * A group or project that memberships can be attached to.
 */
public record GitLabTarget(
    EMembershipScope scope,

    long id,

    /**
     * Full path including parent namespaces, e.g. {@code platform-team/backend}.
     */
    String fullPath,

    String name,

    String webUrl
) {
}
