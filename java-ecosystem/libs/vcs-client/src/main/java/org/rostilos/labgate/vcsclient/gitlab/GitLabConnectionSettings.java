package org.rostilos.labgate.vcsclient.gitlab;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;

/**
 * Immutable connection settings for one GitLab instance.
 * Built once at start-up and handed to {@link GitLabClient} and the HTTP client factory.
 */
public record GitLabConnectionSettings(
    /**
     * API root, always ending in {@code /api/v4} and never in a slash.
     */
    String apiBaseUrl,

    /**
     * Access token sent as a bearer credential.
     */
    String token,

    Duration connectTimeout,

    Duration readTimeout,

    /**
     * Upper bound for a whole call, including redirects and body transfer.
     */
    Duration callTimeout,

    int pageSize
) {

    public static final String URL_ENV = "GITLAB_URL";
    public static final String TOKEN_ENV = "GITLAB_TOKEN";

    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_READ_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_CALL_TIMEOUT = Duration.ofSeconds(60);

    public GitLabConnectionSettings {
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException(TOKEN_ENV + " is not set");
        }
        if (pageSize < 1 || pageSize > GitLabConfig.MAX_PAGE_SIZE) {
            throw new IllegalArgumentException("Page size must be between 1 and " + GitLabConfig.MAX_PAGE_SIZE);
        }
        apiBaseUrl = normalizeApiBaseUrl(apiBaseUrl);
        connectTimeout = connectTimeout != null ? connectTimeout : DEFAULT_CONNECT_TIMEOUT;
        readTimeout = readTimeout != null ? readTimeout : DEFAULT_READ_TIMEOUT;
        callTimeout = callTimeout != null ? callTimeout : DEFAULT_CALL_TIMEOUT;
    }

    public static GitLabConnectionSettings of(String url, String token) {
        return new GitLabConnectionSettings(url, token, null, null, null, GitLabConfig.DEFAULT_PAGE_SIZE);
    }

    /**
     * Read {@code GITLAB_URL} and {@code GITLAB_TOKEN} from the given environment.
     */
    public static GitLabConnectionSettings fromEnvironment(Map<String, String> environment) {
        String url = environment.getOrDefault(URL_ENV, GitLabConfig.DEFAULT_URL);
        return of(url, environment.get(TOKEN_ENV));
    }

    /**
     * Accepts either the instance root ({@code https://gitlab.example.com/}) or the API root
     * ({@code https://gitlab.example.com/api/v4}) and returns the API root without a trailing slash.
     */
    static String normalizeApiBaseUrl(String url) {
        String base = url == null || url.isBlank() ? GitLabConfig.DEFAULT_URL : url.trim();
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        if (!base.toLowerCase(Locale.ROOT).startsWith("http://") && !base.toLowerCase(Locale.ROOT).startsWith("https://")) {
            throw new IllegalArgumentException("GitLab URL must start with http:// or https://, got '" + url + "'");
        }
        if (!base.endsWith(GitLabConfig.API_PATH)) {
            base = base + GitLabConfig.API_PATH;
        }
        return base;
    }

    @Override
    public String toString() {
        return "GitLabConnectionSettings[apiBaseUrl=" + apiBaseUrl + ", token=****, connectTimeout=" + connectTimeout
                + ", readTimeout=" + readTimeout + ", callTimeout=" + callTimeout + ", pageSize=" + pageSize + "]";
    }
}
