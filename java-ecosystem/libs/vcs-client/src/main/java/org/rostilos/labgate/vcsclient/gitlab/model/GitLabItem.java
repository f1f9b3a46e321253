package org.rostilos.labgate.vcsclient.gitlab.model;

import java.time.OffsetDateTime;

/**
 * An issue or merge request, reduced to the fields this service exposes.
 */
public record GitLabItem(
    /**
     * Instance-wide ID.
     */
    long id,

    /**
     * Project-local ID, the number shown in the UI.
     */
    long iid,

    Long projectId,

    String title,

    String state,

    OffsetDateTime createdAt,

    String webUrl,

    /**
     * Username of the author, or {@code null} if GitLab omitted it.
     */
    String author
) {
}
