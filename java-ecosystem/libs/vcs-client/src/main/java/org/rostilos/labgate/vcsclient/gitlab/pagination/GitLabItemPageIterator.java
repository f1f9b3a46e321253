package org.rostilos.labgate.vcsclient.gitlab.pagination;

import org.rostilos.labgate.vcsclient.gitlab.model.GitLabItem;
import org.rostilos.labgate.vcsclient.gitlab.model.GitLabItemPage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Walks a paginated listing one page at a time, requesting the next page only
 * once every item of the current one has been consumed.
 * <p>
 * Single use: once exhausted (or failed) it stays that way. Network failures are
 * rethrown as {@link UncheckedIOException}, API failures as the fetcher threw them.
 */
public class GitLabItemPageIterator implements Iterator<GitLabItem> {

    private static final Logger log = LoggerFactory.getLogger(GitLabItemPageIterator.class);

    private final PageFetcher fetcher;
    private Iterator<GitLabItem> current = Collections.emptyIterator();
    private Integer nextPage = 1;
    private int pagesFetched;
    private boolean failed;

    public GitLabItemPageIterator(PageFetcher fetcher) {
        this.fetcher = fetcher;
    }

    @Override
    public boolean hasNext() {
        while (!current.hasNext()) {
            if (nextPage == null || failed) {
                return false;
            }
            fetchNextPage();
        }
        return true;
    }

    @Override
    public GitLabItem next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more items");
        }
        return current.next();
    }

    public int getPagesFetched() {
        return pagesFetched;
    }

    private void fetchNextPage() {
        int page = nextPage;
        GitLabItemPage result;
        try {
            result = fetcher.fetch(page);
        } catch (IOException e) {
            failed = true;
            throw new UncheckedIOException("Failed to fetch page " + page + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            failed = true;
            throw e;
        }
        pagesFetched++;

        if (result.nextPage() != null && result.nextPage() <= page) {
            // cursor must advance
            log.warn("Ignoring non-advancing next page {} after page {}", result.nextPage(), page);
            nextPage = null;
        } else {
            nextPage = result.nextPage();
        }
        current = result.items().iterator();
        log.debug("Fetched page {} with {} items, next page: {}", page, result.items().size(), nextPage);
    }
}
