package org.rostilos.labgate.vcsclient.gitlab;

import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.rostilos.labgate.vcsclient.gitlab.model.*;

import java.io.IOException;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GitLabClientTest {

    private static final OffsetDateTime START_2023 = OffsetDateTime.of(2023, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC);
    private static final OffsetDateTime START_2024 = OffsetDateTime.of(2024, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC);

    private MockWebServer mockWebServer;
    private GitLabClient client;

    @BeforeEach
    void setUp() throws IOException {
        mockWebServer = new MockWebServer();
        mockWebServer.start();

        GitLabConnectionSettings settings = GitLabConnectionSettings.of(mockWebServer.url("/").toString(), "test-token");
        client = new GitLabClient(new OkHttpClient(), settings);
    }

    @AfterEach
    void tearDown() throws IOException {
        mockWebServer.shutdown();
    }

    @Test
    void testFindUsersByUsername_ReturnsUsers() throws Exception {
        mockWebServer.enqueue(json("""
            [{"id": 123, "username": "alice", "name": "Alice", "state": "active", "web_url": "https://gitlab.com/alice"}]
            """));

        List<GitLabUser> users = client.findUsersByUsername("alice");

        assertThat(users).containsExactly(new GitLabUser(123, "alice", "Alice", "active", "https://gitlab.com/alice"));
        RecordedRequest request = mockWebServer.takeRequest();
        assertThat(request.getMethod()).isEqualTo("GET");
        assertThat(request.getPath()).isEqualTo("/api/v4/users?username=alice");
    }

    @Test
    void testFindUsersByUsername_EmptyArray_ReturnsEmptyList() throws Exception {
        mockWebServer.enqueue(json("[]"));

        assertThat(client.findUsersByUsername("ghost")).isEmpty();
    }

    @Test
    void testFindUsersByUsername_Unauthorized_ThrowsGitLabException() {
        mockWebServer.enqueue(new MockResponse().setResponseCode(401).setBody("{\"message\":\"401 Unauthorized\"}"));

        assertThatThrownBy(() -> client.findUsersByUsername("alice"))
                .isInstanceOf(GitLabException.class)
                .hasMessageContaining("401")
                .satisfies(e -> assertThat(((GitLabException) e).getStatusCode()).isEqualTo(401));
    }

    @Test
    void testFindGroup_Found_ReturnsTarget() throws Exception {
        mockWebServer.enqueue(json("""
            {"id": 42, "path": "platform-team", "full_path": "platform-team", "name": "Platform Team",
             "web_url": "https://gitlab.com/groups/platform-team"}
            """));

        Optional<GitLabTarget> group = client.findGroup("platform-team");

        assertThat(group).contains(new GitLabTarget(EMembershipScope.GROUP, 42, "platform-team", "Platform Team",
                "https://gitlab.com/groups/platform-team"));
        assertThat(mockWebServer.takeRequest().getPath()).isEqualTo("/api/v4/groups/platform-team");
    }

    @Test
    void testFindGroup_NotFound_ReturnsEmpty() throws Exception {
        mockWebServer.enqueue(new MockResponse().setResponseCode(404).setBody("{\"message\":\"404 Group Not Found\"}"));

        assertThat(client.findGroup("missing")).isEmpty();
    }

    @Test
    void testFindProject_EncodesNestedPath() throws Exception {
        mockWebServer.enqueue(json("""
            {"id": 7, "path": "api", "path_with_namespace": "platform-team/api", "name": "API"}
            """));

        Optional<GitLabTarget> project = client.findProject("platform-team/api");

        assertThat(project).isPresent();
        assertThat(project.get().scope()).isEqualTo(EMembershipScope.PROJECT);
        assertThat(project.get().fullPath()).isEqualTo("platform-team/api");
        assertThat(mockWebServer.takeRequest().getPath()).isEqualTo("/api/v4/projects/platform-team%2Fapi");
    }

    @Test
    void testFindProject_ServerError_ThrowsGitLabException() {
        mockWebServer.enqueue(new MockResponse().setResponseCode(500).setBody("boom"));

        assertThatThrownBy(() -> client.findProject("platform-team/api"))
                .isInstanceOf(GitLabException.class)
                .hasMessageContaining("500")
                .hasMessageContaining("boom");
    }

    @Test
    void testGetMember_Absent_ReturnsEmpty() throws Exception {
        mockWebServer.enqueue(new MockResponse().setResponseCode(404));

        assertThat(client.getMember(EMembershipScope.GROUP, 42, 123)).isEmpty();
        assertThat(mockWebServer.takeRequest().getPath()).isEqualTo("/api/v4/groups/42/members/123");
    }

    @Test
    void testGetMember_Present_ReturnsAccessLevel() throws Exception {
        mockWebServer.enqueue(json("{\"id\": 123, \"username\": \"alice\", \"access_level\": 20}"));

        Optional<GitLabMember> member = client.getMember(EMembershipScope.PROJECT, 7, 123);

        assertThat(member).contains(new GitLabMember(123, "alice", 20));
        assertThat(mockWebServer.takeRequest().getPath()).isEqualTo("/api/v4/projects/7/members/123");
    }

    @Test
    void testAddMember_PostsUserAndAccessLevel() throws Exception {
        mockWebServer.enqueue(json("{\"id\": 123, \"username\": \"alice\", \"access_level\": 30}").setResponseCode(201));

        GitLabMember member = client.addMember(EMembershipScope.GROUP, 42, 123, 30);

        assertThat(member.accessLevel()).isEqualTo(30);
        RecordedRequest request = mockWebServer.takeRequest();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getPath()).isEqualTo("/api/v4/groups/42/members");
        assertThat(request.getBody().readUtf8()).isEqualTo("{\"user_id\":123,\"access_level\":30}");
    }

    @Test
    void testAddMember_Conflict_ThrowsConflictException() {
        mockWebServer.enqueue(new MockResponse().setResponseCode(409).setBody("{\"message\":\"Member already exists\"}"));

        assertThatThrownBy(() -> client.addMember(EMembershipScope.GROUP, 42, 123, 30))
                .isInstanceOf(GitLabException.class)
                .satisfies(e -> assertThat(((GitLabException) e).isConflict()).isTrue());
    }

    @Test
    void testUpdateMember_PutsAccessLevel() throws Exception {
        mockWebServer.enqueue(json("{\"id\": 123, \"username\": \"alice\", \"access_level\": 40}"));

        GitLabMember member = client.updateMember(EMembershipScope.PROJECT, 7, 123, 40);

        assertThat(member.accessLevel()).isEqualTo(40);
        RecordedRequest request = mockWebServer.takeRequest();
        assertThat(request.getMethod()).isEqualTo("PUT");
        assertThat(request.getPath()).isEqualTo("/api/v4/projects/7/members/123");
        assertThat(request.getBody().readUtf8()).isEqualTo("{\"access_level\":40}");
    }

    @Test
    void testFetchItemPage_SendsDateWindowAndParsesItems() throws Exception {
        mockWebServer.enqueue(json("""
            [{"id": 1, "iid": 101, "project_id": 7, "title": "First", "state": "opened",
              "created_at": "2023-01-01T10:00:00.000Z", "web_url": "https://gitlab.com/g/p/-/issues/101",
              "author": {"id": 123, "username": "alice"}}]
            """).addHeader("X-Next-Page", "2"));

        GitLabItemPage page = client.fetchItemPage(EItemType.ISSUE, START_2023, START_2024, 1);

        assertThat(page.items()).hasSize(1);
        GitLabItem item = page.items().get(0);
        assertThat(item.id()).isEqualTo(1);
        assertThat(item.iid()).isEqualTo(101);
        assertThat(item.projectId()).isEqualTo(7L);
        assertThat(item.author()).isEqualTo("alice");
        assertThat(item.createdAt()).isEqualTo(OffsetDateTime.of(2023, 1, 1, 10, 0, 0, 0, ZoneOffset.UTC));
        assertThat(page.nextPage()).isEqualTo(2);

        RecordedRequest request = mockWebServer.takeRequest();
        assertThat(request.getRequestUrl().encodedPath()).isEqualTo("/api/v4/issues");
        assertThat(request.getRequestUrl().queryParameter("scope")).isEqualTo("all");
        assertThat(request.getRequestUrl().queryParameter("created_after")).isEqualTo("2023-01-01T00:00:00Z");
        assertThat(request.getRequestUrl().queryParameter("created_before")).isEqualTo("2024-01-01T00:00:00Z");
        assertThat(request.getRequestUrl().queryParameter("per_page")).isEqualTo("100");
        assertThat(request.getRequestUrl().queryParameter("page")).isEqualTo("1");
    }

    @Test
    void testFetchItemPage_BlankNextPageHeader_IsLastPage() throws Exception {
        mockWebServer.enqueue(json("[{\"id\": 1, \"title\": \"Only\", \"created_at\": \"2023-05-01T00:00:00Z\"}]")
                .addHeader("X-Next-Page", ""));

        GitLabItemPage page = client.fetchItemPage(EItemType.MERGE_REQUEST, START_2023, START_2024, 1);

        assertThat(page.hasNext()).isFalse();
        assertThat(mockWebServer.takeRequest().getRequestUrl().encodedPath()).isEqualTo("/api/v4/merge_requests");
    }

    @Test
    void testFetchItemPage_RateLimited_CarriesRetryAfter() {
        mockWebServer.enqueue(new MockResponse().setResponseCode(429).addHeader("Retry-After", "30").setBody("Retry later"));

        assertThatThrownBy(() -> client.fetchItemPage(EItemType.ISSUE, START_2023, START_2024, 1))
                .isInstanceOf(GitLabException.class)
                .satisfies(e -> {
                    GitLabException ex = (GitLabException) e;
                    assertThat(ex.isRateLimited()).isTrue();
                    assertThat(ex.getRetryAfterSeconds()).isEqualTo(30L);
                });
    }

    @Test
    void testIterateItems_WalksAllPagesLazily() throws Exception {
        mockWebServer.enqueue(json("[{\"id\": 1, \"created_at\": \"2023-01-02T00:00:00Z\"}]").addHeader("X-Next-Page", "2"));
        mockWebServer.enqueue(json("[{\"id\": 2, \"created_at\": \"2023-03-02T00:00:00Z\"}]").addHeader("X-Next-Page", ""));

        Iterator<GitLabItem> items = client.iterateItems(EItemType.ISSUE, START_2023, START_2024);
        assertThat(mockWebServer.getRequestCount()).isZero();

        List<Long> ids = new ArrayList<>();
        items.forEachRemaining(item -> ids.add(item.id()));

        assertThat(ids).containsExactly(1L, 2L);
        assertThat(mockWebServer.getRequestCount()).isEqualTo(2);
    }

    @Test
    void testResolveNextPage() {
        assertThat(GitLabClient.resolveNextPage(null, 3)).isEqualTo(4);
        assertThat(GitLabClient.resolveNextPage("", 3)).isNull();
        assertThat(GitLabClient.resolveNextPage(" 5 ", 3)).isEqualTo(5);
        assertThatThrownBy(() -> GitLabClient.resolveNextPage("next", 3)).isInstanceOf(GitLabException.class);
    }

    @Test
    void testParseRetryAfter() {
        assertThat(GitLabClient.parseRetryAfter("12")).isEqualTo(12L);
        assertThat(GitLabClient.parseRetryAfter(null)).isNull();
        assertThat(GitLabClient.parseRetryAfter("Wed, 21 Oct 2015 07:28:00 GMT")).isNull();
    }

    private static MockResponse json(String body) {
        return new MockResponse()
                .setBody(body)
                .addHeader("Content-Type", "application/json");
    }
}
