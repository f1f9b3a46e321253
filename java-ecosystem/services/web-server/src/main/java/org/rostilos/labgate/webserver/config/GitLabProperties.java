package org.rostilos.labgate.webserver.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.rostilos.labgate.vcsclient.gitlab.GitLabConfig;
import org.rostilos.labgate.vcsclient.gitlab.GitLabConnectionSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * GitLab connection settings bound from {@code labgate.gitlab.*}.
 * The token is required; the application refuses to start without it.
 */
@Configuration
@ConfigurationProperties(prefix = "labgate.gitlab")
@Validated
public class GitLabProperties {

    private String url = GitLabConfig.DEFAULT_URL;

    @NotBlank(message = "labgate.gitlab.token (GITLAB_TOKEN) must be set")
    private String token;

    private Duration connectTimeout = GitLabConnectionSettings.DEFAULT_CONNECT_TIMEOUT;
    private Duration readTimeout = GitLabConnectionSettings.DEFAULT_READ_TIMEOUT;
    private Duration callTimeout = GitLabConnectionSettings.DEFAULT_CALL_TIMEOUT;

    @Min(1)
    @Max(GitLabConfig.MAX_PAGE_SIZE)
    private int pageSize = GitLabConfig.DEFAULT_PAGE_SIZE;

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    public String getToken() {
        return token;
    }

    public void setToken(String token) {
        this.token = token;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    public Duration getReadTimeout() {
        return readTimeout;
    }

    public void setReadTimeout(Duration readTimeout) {
        this.readTimeout = readTimeout;
    }

    public Duration getCallTimeout() {
        return callTimeout;
    }

    public void setCallTimeout(Duration callTimeout) {
        this.callTimeout = callTimeout;
    }

    public int getPageSize() {
        return pageSize;
    }

    public void setPageSize(int pageSize) {
        this.pageSize = pageSize;
    }

    public GitLabConnectionSettings toConnectionSettings() {
        return new GitLabConnectionSettings(url, token, connectTimeout, readTimeout, callTimeout, pageSize);
    }
}
