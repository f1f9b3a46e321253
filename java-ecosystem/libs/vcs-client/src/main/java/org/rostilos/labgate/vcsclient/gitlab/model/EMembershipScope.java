package org.rostilos.labgate.vcsclient.gitlab.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * GitLab containers that own members: groups and projects.
 */
public enum EMembershipScope {
    GROUP("group", "groups"),
    PROJECT("project", "projects");

    private final String id;
    private final String apiCollection;

    EMembershipScope(String id, String apiCollection) {
        this.id = id;
        this.apiCollection = apiCollection;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    /**
     * Path segment of the REST collection, e.g. {@code groups} in {@code /groups/:id/members}.
     */
    public String getApiCollection() {
        return apiCollection;
    }
}
