package org.rostilos.labgate.vcsclient.gitlab;

/**
 * Exception for GitLab API errors.
 * Carries the HTTP status and body GitLab answered with, plus the
 * {@code Retry-After} hint when the request was rate limited.
 */
public class GitLabException extends RuntimeException {

    private final int statusCode;
    private final String responseBody;
    private final Long retryAfterSeconds;

    public GitLabException(String operation, int statusCode, String responseBody) {
        this(operation, statusCode, responseBody, null);
    }

    public GitLabException(String operation, int statusCode, String responseBody, Long retryAfterSeconds) {
        super(String.format("GitLab %s failed: %d - %s", operation, statusCode, responseBody));
        this.statusCode = statusCode;
        this.responseBody = responseBody;
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public GitLabException(String message) {
        super(message);
        this.statusCode = -1;
        this.responseBody = null;
        this.retryAfterSeconds = null;
    }

    public GitLabException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
        this.responseBody = null;
        this.retryAfterSeconds = null;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getResponseBody() {
        return responseBody;
    }

    /**
     * @return seconds GitLab asked us to wait, or {@code null} if it sent no hint
     */
    public Long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }

    public boolean isConflict() {
        return statusCode == 409;
    }

    public boolean isRateLimited() {
        return statusCode == 429;
    }
}
