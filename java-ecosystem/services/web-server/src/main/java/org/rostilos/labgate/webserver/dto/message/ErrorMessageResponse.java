package org.rostilos.labgate.webserver.dto.message;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.http.HttpStatusCode;

import java.time.Instant;
import java.util.List;

/**
 * Error body shared by every failing route. Optional fields are omitted when absent.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorMessageResponse extends MessageResponse {
    private final String errorCode;
    private final int status;
    private final Instant timestamp;
    private List<String> details;
    private Integer upstreamStatus;
    private Long retryAfterSeconds;

    public ErrorMessageResponse(String errorCode, String message, HttpStatusCode status) {
        super(message);
        this.errorCode = errorCode;
        this.status = status.value();
        this.timestamp = Instant.now();
    }

    @JsonProperty("error_code")
    public String getErrorCode() {
        return errorCode;
    }

    public int getStatus() {
        return status;
    }

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    public Instant getTimestamp() {
        return timestamp;
    }

    public List<String> getDetails() {
        return details;
    }

    @JsonProperty("upstream_status")
    public Integer getUpstreamStatus() {
        return upstreamStatus;
    }

    @JsonProperty("retry_after_seconds")
    public Long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }

    public ErrorMessageResponse withDetails(List<String> details) {
        this.details = details == null || details.isEmpty() ? null : List.copyOf(details);
        return this;
    }

    public ErrorMessageResponse withUpstreamStatus(Integer upstreamStatus) {
        this.upstreamStatus = upstreamStatus;
        return this;
    }

    public ErrorMessageResponse withRetryAfterSeconds(Long retryAfterSeconds) {
        this.retryAfterSeconds = retryAfterSeconds;
        return this;
    }
}
