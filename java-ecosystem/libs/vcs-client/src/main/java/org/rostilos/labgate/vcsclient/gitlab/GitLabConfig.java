package org.rostilos.labgate.vcsclient.gitlab;

/**
 * Configuration constants for GitLab API access.
 */
public final class GitLabConfig {

    public static final String DEFAULT_URL = "https://gitlab.com/";
    public static final String API_PATH = "/api/v4";
    public static final int DEFAULT_PAGE_SIZE = 100;
    public static final int MAX_PAGE_SIZE = 100;

    public static final String NEXT_PAGE_HEADER = "X-Next-Page";
    public static final String RETRY_AFTER_HEADER = "Retry-After";

    private GitLabConfig() {
        // Utility class
    }
}
