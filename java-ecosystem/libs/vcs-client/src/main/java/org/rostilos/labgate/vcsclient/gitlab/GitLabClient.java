package org.rostilos.labgate.vcsclient.gitlab;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import okhttp3.*;
import org.rostilos.labgate.vcsclient.gitlab.model.*;
import org.rostilos.labgate.vcsclient.gitlab.pagination.GitLabItemPageIterator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Thin client for the parts of the GitLab REST API v4 this service needs:
 * user lookup, group/project lookup, direct membership management and
 * instance-wide issue and merge request listing.
 * <p>
 * Non-success answers are reported as {@link GitLabException}; network failures as {@link IOException}.
 * A 404 on a lookup is not an error and comes back as an empty result.
 */
public class GitLabClient {

    private static final Logger log = LoggerFactory.getLogger(GitLabClient.class);

    private static final MediaType JSON_MEDIA_TYPE = MediaType.parse("application/json");
    private static final String ACCEPT_HEADER = "Accept";
    private static final String GITLAB_ACCEPT_HEADER = "application/json";
    private static final DateTimeFormatter GITLAB_TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'");

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final int pageSize;

    public GitLabClient(OkHttpClient httpClient, GitLabConnectionSettings settings) {
        this(httpClient, settings.apiBaseUrl(), settings.pageSize());
    }

    public GitLabClient(OkHttpClient httpClient, String baseUrl, int pageSize) {
        this.httpClient = httpClient;
        this.objectMapper = new ObjectMapper();
        this.baseUrl = baseUrl;
        this.pageSize = pageSize;
    }

    /**
     * GitLab matches {@code username} case-insensitively and may return more than one user.
     */
    public List<GitLabUser> findUsersByUsername(String username) throws IOException {
        String url = baseUrl + "/users?username=" + encode(username);

        Request request = createGetRequest(url);
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw createException("find user", response);
            }

            JsonNode root = readBody(response);
            List<GitLabUser> users = new ArrayList<>();
            if (root.isArray()) {
                for (JsonNode node : root) {
                    users.add(parseUser(node));
                }
            }
            return users;
        }
    }

    public Optional<GitLabTarget> findGroup(String fullPath) throws IOException {
        return findTarget(EMembershipScope.GROUP, fullPath);
    }

    public Optional<GitLabTarget> findProject(String fullPath) throws IOException {
        return findTarget(EMembershipScope.PROJECT, fullPath);
    }

    private Optional<GitLabTarget> findTarget(EMembershipScope scope, String fullPath) throws IOException {
        String url = baseUrl + "/" + scope.getApiCollection() + "/" + encode(fullPath);

        Request request = createGetRequest(url);
        try (Response response = httpClient.newCall(request).execute()) {
            if (response.code() == 404) {
                log.debug("No {} found at path {}", scope.getId(), fullPath);
                return Optional.empty();
            }
            if (!response.isSuccessful()) {
                throw createException("get " + scope.getId(), response);
            }

            return Optional.of(parseTarget(scope, readBody(response)));
        }
    }

    /**
     * Direct membership only; members inherited from a parent group are not returned.
     */
    public Optional<GitLabMember> getMember(EMembershipScope scope, long targetId, long userId) throws IOException {
        String url = membersUrl(scope, targetId) + "/" + userId;

        Request request = createGetRequest(url);
        try (Response response = httpClient.newCall(request).execute()) {
            if (response.code() == 404) {
                return Optional.empty();
            }
            if (!response.isSuccessful()) {
                throw createException("get " + scope.getId() + " member", response);
            }

            return Optional.of(parseMember(readBody(response)));
        }
    }

    /**
     * @throws GitLabException with status 409 if the user is already a member
     */
    public GitLabMember addMember(EMembershipScope scope, long targetId, long userId, int accessLevel) throws IOException {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("user_id", userId);
        body.put("access_level", accessLevel);

        Request request = createPostRequest(membersUrl(scope, targetId), body.toString());
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw createException("add " + scope.getId() + " member", response);
            }

            return parseMember(readBody(response));
        }
    }

    public GitLabMember updateMember(EMembershipScope scope, long targetId, long userId, int accessLevel) throws IOException {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("access_level", accessLevel);

        Request request = createPutRequest(membersUrl(scope, targetId) + "/" + userId, body.toString());
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw createException("update " + scope.getId() + " member", response);
            }

            return parseMember(readBody(response));
        }
    }

    /**
     * Fetch a single page of items visible to the token, created within the given window.
     * GitLab treats both bounds as inclusive.
     */
    public GitLabItemPage fetchItemPage(EItemType type, OffsetDateTime createdAfter, OffsetDateTime createdBefore, int page)
            throws IOException {
        String url = baseUrl + "/" + type.getEndpoint()
                + "?scope=all"
                + "&created_after=" + encode(formatTimestamp(createdAfter))
                + "&created_before=" + encode(formatTimestamp(createdBefore))
                + "&per_page=" + pageSize
                + "&page=" + page;
        log.debug("Requesting page {} of {}", page, type.getEndpoint());

        Request request = createGetRequest(url);
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw createException("list " + type.getEndpoint(), response);
            }

            JsonNode root = readBody(response);
            if (!root.isArray()) {
                throw new GitLabException("GitLab list " + type.getEndpoint() + " returned a non-array body");
            }
            if (root.isEmpty()) {
                return GitLabItemPage.last(page);
            }

            List<GitLabItem> items = new ArrayList<>(root.size());
            for (JsonNode node : root) {
                items.add(parseItem(node));
            }
            return new GitLabItemPage(items, page, resolveNextPage(response.header(GitLabConfig.NEXT_PAGE_HEADER), page));
        }
    }

    /**
     * Lazily walk every page of {@link #fetchItemPage}. Each call starts a fresh traversal at page 1.
     */
    public Iterator<GitLabItem> iterateItems(EItemType type, OffsetDateTime createdAfter, OffsetDateTime createdBefore) {
        return new GitLabItemPageIterator(page -> fetchItemPage(type, createdAfter, createdBefore, page));
    }

    /**
     * A blank {@code X-Next-Page} marks the last page. Without the header we keep
     * going until an empty page comes back.
     */
    static Integer resolveNextPage(String nextPageHeader, int currentPage) {
        if (nextPageHeader == null) {
            return currentPage + 1;
        }
        if (nextPageHeader.isBlank()) {
            return null;
        }
        try {
            return Integer.parseInt(nextPageHeader.trim());
        } catch (NumberFormatException e) {
            throw new GitLabException("GitLab returned an invalid " + GitLabConfig.NEXT_PAGE_HEADER + " header: " + nextPageHeader);
        }
    }

    static Long parseRetryAfter(String retryAfterHeader) {
        if (retryAfterHeader == null || retryAfterHeader.isBlank()) {
            return null;
        }
        try {
            return Long.parseLong(retryAfterHeader.trim());
        } catch (NumberFormatException e) {
            // HTTP-date form, not used by GitLab
            return null;
        }
    }

    private String membersUrl(EMembershipScope scope, long targetId) {
        return baseUrl + "/" + scope.getApiCollection() + "/" + targetId + "/members";
    }

    private GitLabUser parseUser(JsonNode node) {
        return new GitLabUser(
                node.get("id").asLong(),
                getTextOrNull(node, "username"),
                getTextOrNull(node, "name"),
                getTextOrNull(node, "state"),
                getTextOrNull(node, "web_url")
        );
    }

    private GitLabTarget parseTarget(EMembershipScope scope, JsonNode node) {
        String fullPath = scope == EMembershipScope.GROUP
                ? getTextOrNull(node, "full_path")
                : getTextOrNull(node, "path_with_namespace");
        if (fullPath == null) {
            fullPath = getTextOrNull(node, "path");
        }
        return new GitLabTarget(
                scope,
                node.get("id").asLong(),
                fullPath,
                getTextOrNull(node, "name"),
                getTextOrNull(node, "web_url")
        );
    }

    private GitLabMember parseMember(JsonNode node) {
        return new GitLabMember(
                node.get("id").asLong(),
                getTextOrNull(node, "username"),
                node.has("access_level") ? node.get("access_level").asInt() : 0
        );
    }

    private GitLabItem parseItem(JsonNode node) {
        String author = null;
        JsonNode authorNode = node.get("author");
        if (authorNode != null && authorNode.isObject()) {
            author = getTextOrNull(authorNode, "username");
        }

        return new GitLabItem(
                node.get("id").asLong(),
                node.has("iid") ? node.get("iid").asLong() : 0L,
                node.has("project_id") && !node.get("project_id").isNull() ? node.get("project_id").asLong() : null,
                getTextOrNull(node, "title"),
                getTextOrNull(node, "state"),
                parseTimestamp(getTextOrNull(node, "created_at")),
                getTextOrNull(node, "web_url"),
                author
        );
    }

    private OffsetDateTime parseTimestamp(String value) {
        if (value == null) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value);
        } catch (DateTimeParseException e) {
            throw new GitLabException("GitLab returned an unparseable created_at: " + value, e);
        }
    }

    private static String formatTimestamp(OffsetDateTime value) {
        return value.withOffsetSameInstant(ZoneOffset.UTC).format(GITLAB_TIMESTAMP);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private String getTextOrNull(JsonNode node, String field) {
        return node.has(field) && !node.get(field).isNull() ? node.get(field).asText() : null;
    }

    private JsonNode readBody(Response response) throws IOException {
        ResponseBody body = response.body();
        if (body == null) {
            return objectMapper.missingNode();
        }
        return objectMapper.readTree(body.string());
    }

    private GitLabException createException(String operation, Response response) throws IOException {
        String body = response.body() != null ? response.body().string() : "";
        return new GitLabException(operation, response.code(), body,
                parseRetryAfter(response.header(GitLabConfig.RETRY_AFTER_HEADER)));
    }

    private Request createPostRequest(String url, String jsonBody) {
        return new Request.Builder()
                .url(url)
                .header(ACCEPT_HEADER, GITLAB_ACCEPT_HEADER)
                .post(RequestBody.create(jsonBody, JSON_MEDIA_TYPE))
                .build();
    }

    private Request createPutRequest(String url, String jsonBody) {
        return new Request.Builder()
                .url(url)
                .header(ACCEPT_HEADER, GITLAB_ACCEPT_HEADER)
                .put(RequestBody.create(jsonBody, JSON_MEDIA_TYPE))
                .build();
    }

    private Request createGetRequest(String url) {
        return new Request.Builder()
                .url(url)
                .header(ACCEPT_HEADER, GITLAB_ACCEPT_HEADER)
                .get()
                .build();
    }
}
