package org.rostilos.labgate.core.service;

import org.rostilos.labgate.core.exception.UpstreamException;
import org.rostilos.labgate.core.exception.ValidationException;
import org.rostilos.labgate.core.model.item.ItemQuery;
import org.rostilos.labgate.core.model.item.ItemSummary;
import org.rostilos.labgate.core.validation.RequestValidator;
import org.rostilos.labgate.vcsclient.gitlab.GitLabClient;
import org.rostilos.labgate.vcsclient.gitlab.GitLabException;
import org.rostilos.labgate.vcsclient.gitlab.model.GitLabItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lists the issues or merge requests created in one calendar year, across everything
 * the service token can see.
 */
public class ItemService {

    private static final Logger log = LoggerFactory.getLogger(ItemService.class);

    private final GitLabClient gitLabClient;

    public ItemService(GitLabClient gitLabClient) {
        this.gitLabClient = gitLabClient;
    }

    /**
     * Validate the raw parameters, then fetch and collect every matching item.
     * A failure on any page fails the whole call; partial results are never returned.
     *
     * @throws ValidationException if {@code type} or {@code year} is missing or malformed
     * @throws UpstreamException   if GitLab or the network fails on any page
     */
    public List<ItemSummary> getItemsByYear(String type, String year) {
        ItemQuery query = RequestValidator.validateItemQuery(type, year);
        List<ItemSummary> items;
        try (Stream<ItemSummary> stream = listItems(query)) {
            items = stream.toList();
        }
        log.info("Retrieved {} {} from {}", items.size(), query.kind().getId(), query.year());
        return items;
    }

    /**
     * Lazily list matching items. Pages are requested as the stream is consumed; the
     * stream can be consumed once, a new query is needed to start over.
     * Items are restricted to {@code [year-01-01, (year+1)-01-01)} UTC and deduplicated by id.
     */
    public Stream<ItemSummary> listItems(ItemQuery query) {
        log.info("Retrieving {} created between {} and {}", query.kind().getId(), query.rangeStart(), query.rangeEnd());

        Iterator<GitLabItem> pages = new UpstreamGuardedIterator(
                gitLabClient.iterateItems(query.kind().getItemType(), query.rangeStart(), query.rangeEnd()),
                query
        );
        Set<Long> seenIds = new HashSet<>();

        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(pages, Spliterator.ORDERED | Spliterator.NONNULL), false)
                .filter(item -> query.contains(item.createdAt()))
                .filter(item -> seenIds.add(item.id()))
                .map(ItemSummary::fromGitLabItem);
    }

    /**
     * Translates client failures raised mid-iteration into {@link UpstreamException}.
     */
    private static final class UpstreamGuardedIterator implements Iterator<GitLabItem> {

        private final Iterator<GitLabItem> delegate;
        private final ItemQuery query;

        private UpstreamGuardedIterator(Iterator<GitLabItem> delegate, ItemQuery query) {
            this.delegate = delegate;
            this.query = query;
        }

        @Override
        public boolean hasNext() {
            try {
                return delegate.hasNext();
            } catch (GitLabException e) {
                log.warn("GitLab failed while listing {} for {}: {}", query.kind().getId(), query.year(), e.getMessage());
                throw UpstreamException.fromGitLab(e);
            } catch (UncheckedIOException e) {
                log.warn("Network error while listing {} for {}: {}", query.kind().getId(), query.year(), e.getMessage());
                throw UpstreamException.fromNetwork("item listing", e);
            }
        }

        @Override
        public GitLabItem next() {
            hasNext();
            return delegate.next();
        }
    }
}
