package org.rostilos.labgate.vcsclient.gitlab.pagination;

import org.rostilos.labgate.vcsclient.gitlab.model.GitLabItemPage;

import java.io.IOException;

/**
 * Fetches one page of a paginated listing.
 */
@FunctionalInterface
public interface PageFetcher {

    GitLabItemPage fetch(int page) throws IOException;
}
