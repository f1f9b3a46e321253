package org.rostilos.labgate.vcsclient.gitlab.model;

import java.util.List;

/**
 * One page of a paginated issue or merge request listing.
 */
public record GitLabItemPage(
    List<GitLabItem> items,

    /**
     * Page number this page was requested with (1-based).
     */
    int page,

    /**
     * Page to request next, or {@code null} when this is the last page.
     */
    Integer nextPage
) {

    public boolean hasNext() {
        return nextPage != null;
    }

    public static GitLabItemPage last(int page) {
        return new GitLabItemPage(List.of(), page, null);
    }
}
