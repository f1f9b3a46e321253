package org.rostilos.labgate.vcsclient.gitlab.model;

/**
 * A GitLab user as returned by {@code GET /users}.
 */
public record GitLabUser(
    long id,
    String username,
    String name,
    String state,
    String webUrl
) {
}
