package in.worldsync.application.service;

import in.worldsync.application.port.output.WorldsGateway;
import in.worldsync.domain.model.Page;
import in.worldsync.domain.model.PageInfo;
import in.worldsync.domain.model.TraversalOutcome;
import in.worldsync.infrastructure.metrics.IngestMetrics;
import in.worldsync.infrastructure.worlds.WorldsApiException;
import in.worldsync.infrastructure.worlds.WorldsPayloads;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;

/**
 * Lazy walk over a cursor-paginated connection.
 *
 * Each {@link #next()} issues exactly one request, carrying the cursor of the previous
 * page (none on the first). The walk always terminates: it stops when the remote side
 * reports no next page, when the next page has no cursor, when a cursor recurs, or when
 * {@code maxPages} pages have been fetched.
 *
 * A failed request is rethrown from {@link #next()} and ends the walk; pages already
 * returned stay valid. Single use, single thread.
 */
public final class PageCursorTraversal implements Iterator<Page> {
    private static final Logger log = LoggerFactory.getLogger(PageCursorTraversal.class);

    private final WorldsGateway gateway;
    private final String queryName;
    private final Map<String, Object> filter;
    private final int pageSize;
    private final int maxPages;
    private final IngestMetrics metrics;

    private final Set<String> seenCursors = new HashSet<>();
    private String cursor;
    private int pagesFetched;
    private TraversalOutcome outcome;

    public PageCursorTraversal(WorldsGateway gateway, String queryName, Map<String, Object> filter,
                               int pageSize, int maxPages, IngestMetrics metrics) {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("Page size must be positive");
        }
        if (maxPages <= 0) {
            throw new IllegalArgumentException("Max pages must be positive");
        }
        this.gateway = gateway;
        this.queryName = queryName;
        this.filter = filter == null ? Map.of() : filter;
        this.pageSize = pageSize;
        this.maxPages = maxPages;
        this.metrics = metrics;
    }

    @Override
    public boolean hasNext() {
        return outcome == null;
    }

    /**
     * Fetch the next page.
     *
     * @throws WorldsApiException if the request fails; the traversal is finished afterwards
     */
    @Override
    public Page next() {
        if (outcome != null) {
            throw new NoSuchElementException("Traversal finished: " + outcome);
        }

        Page page;
        try {
            page = WorldsPayloads.decodePage(queryName, gateway.query(queryName, variables()));
        } catch (WorldsApiException e) {
            outcome = TraversalOutcome.FETCH_FAILED;
            metrics.recordFetchFailure(queryName, e.failureType());
            throw e;
        }

        pagesFetched++;
        metrics.recordPageFetched(queryName, page.size());
        advance(page.pageInfo());
        return page;
    }

    private Map<String, Object> variables() {
        Map<String, Object> variables = new LinkedHashMap<>();
        variables.put("filter", filter);
        variables.put("first", pageSize);
        if (cursor != null) {
            variables.put("after", cursor);
        }
        variables.put("sort", List.of());
        return variables;
    }

    private void advance(PageInfo info) {
        if (!info.hasNext()) {
            outcome = TraversalOutcome.EXHAUSTED;
            return;
        }

        String endCursor = info.endCursor();
        if (endCursor == null || endCursor.isEmpty()) {
            log.warn("[TRAVERSAL] {} reported a next page without a cursor after {} pages", queryName, pagesFetched);
            outcome = TraversalOutcome.END_CURSOR_MISSING;
            return;
        }

        if (!seenCursors.add(endCursor)) {
            log.warn("[TRAVERSAL] {} returned repeated cursor '{}' after {} pages, stopping",
                queryName, endCursor, pagesFetched);
            outcome = TraversalOutcome.CYCLE_DETECTED;
            return;
        }

        if (pagesFetched >= maxPages) {
            log.warn("[TRAVERSAL] {} reached the page limit ({}), stopping", queryName, maxPages);
            outcome = TraversalOutcome.PAGE_LIMIT_REACHED;
            return;
        }

        cursor = endCursor;
    }

    /**
     * Why the traversal stopped, or null while it can still continue.
     */
    public TraversalOutcome outcome() {
        return outcome;
    }

    public int pagesFetched() {
        return pagesFetched;
    }
}
