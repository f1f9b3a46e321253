package org.rostilos.labgate.vcsclient.gitlab.model;

/**
 * Listable GitLab work items and their instance-wide endpoints.
 */
public enum EItemType {
    ISSUE("issues"),
    MERGE_REQUEST("merge_requests");

    private final String endpoint;

    EItemType(String endpoint) {
        this.endpoint = endpoint;
    }

    public String getEndpoint() {
        return endpoint;
    }
}
