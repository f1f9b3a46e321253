package org.rostilos.labgate.vcsclient;

import okhttp3.OkHttpClient;
import okhttp3.Request;
import org.rostilos.labgate.vcsclient.gitlab.GitLabConnectionSettings;

/**
 * Builds the single long-lived {@link OkHttpClient} used to talk to GitLab.
 */
public class HttpAuthorizedClientFactory {

    /**
     * Create an OkHttpClient that sends the configured token as a bearer credential
     * and enforces the configured timeouts.
     *
     * @param settings GitLab connection settings
     * @return configured OkHttpClient
     */
    public OkHttpClient createClient(GitLabConnectionSettings settings) {
        return createClientWithBearerToken(settings.token(), settings);
    }

    /**
     * Create an OkHttpClient that uses a bearer token for authentication.
     *
     * @param accessToken the personal, group or project access token
     * @param settings timeouts to apply
     * @return configured OkHttpClient with bearer token authentication
     */
    public OkHttpClient createClientWithBearerToken(String accessToken, GitLabConnectionSettings settings) {
        if (accessToken == null || accessToken.isBlank()) {
            throw new IllegalArgumentException("Access token cannot be null or empty");
        }

        return new OkHttpClient.Builder()
                .connectTimeout(settings.connectTimeout())
                .readTimeout(settings.readTimeout())
                .writeTimeout(settings.readTimeout())
                .callTimeout(settings.callTimeout())
                .addInterceptor(chain -> {
                    Request original = chain.request();
                    Request authorized = original.newBuilder()
                            .header("Authorization", "Bearer " + accessToken)
                            .build();
                    return chain.proceed(authorized);
                })
                .build();
    }
}
