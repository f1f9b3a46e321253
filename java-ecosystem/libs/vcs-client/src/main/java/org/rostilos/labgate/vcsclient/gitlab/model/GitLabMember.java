package org.rostilos.labgate.vcsclient.gitlab.model;

/**
 * A direct member of a group or project.
 */
public record GitLabMember(
    long userId,
    String username,
    int accessLevel
) {
}
