package org.rostilos.labgate.core.exception;

import org.rostilos.labgate.vcsclient.gitlab.GitLabException;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Any failure originating from GitLab or the network in between.
 * Upstream status and body are preserved where GitLab supplied them. Never retried here.
 */
public class UpstreamException extends LabGateException {

    public static final String ERROR_CODE = "UPSTREAM_ERROR";
    public static final int NO_STATUS = -1;

    private final int upstreamStatus;
    private final String upstreamBody;
    private final Long retryAfterSeconds;

    public UpstreamException(String message, Throwable cause, int upstreamStatus, String upstreamBody, Long retryAfterSeconds) {
        super(message, cause, ERROR_CODE);
        this.upstreamStatus = upstreamStatus;
        this.upstreamBody = upstreamBody;
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public static UpstreamException fromGitLab(GitLabException e) {
        return new UpstreamException(e.getMessage(), e, e.getStatusCode(), e.getResponseBody(), e.getRetryAfterSeconds());
    }

    public static UpstreamException fromNetwork(String operation, IOException e) {
        return new UpstreamException("Network error during " + operation + ": " + e.getMessage(), e, NO_STATUS, null, null);
    }

    public static UpstreamException fromNetwork(String operation, UncheckedIOException e) {
        return fromNetwork(operation, e.getCause());
    }

    /**
     * @return GitLab's HTTP status, or {@link #NO_STATUS} when no response was received
     */
    public int getUpstreamStatus() {
        return upstreamStatus;
    }

    public String getUpstreamBody() {
        return upstreamBody;
    }

    public Long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
