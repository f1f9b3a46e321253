package org.rostilos.labgate.core.model.item;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.rostilos.labgate.vcsclient.gitlab.model.GitLabItem;

import java.time.OffsetDateTime;

public record ItemSummary(
    @JsonProperty("id")
    long id,

    @JsonProperty("iid")
    long iid,

    @JsonProperty("project_id")
    Long projectId,

    @JsonProperty("title")
    String title,

    @JsonProperty("state")
    String state,

    @JsonProperty("created_at")
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    OffsetDateTime createdAt,

    @JsonProperty("web_url")
    String webUrl,

    @JsonProperty("author")
    String author
) {

    public static ItemSummary fromGitLabItem(GitLabItem item) {
        return new ItemSummary(
                item.id(),
                item.iid(),
                item.projectId(),
                item.title(),
                item.state(),
                item.createdAt(),
                item.webUrl(),
                item.author()
        );
    }
}
