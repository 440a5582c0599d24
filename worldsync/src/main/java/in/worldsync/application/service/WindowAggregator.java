package in.worldsync.application.service;

import com.fasterxml.jackson.databind.JsonNode;
import in.worldsync.application.port.output.WorldsGateway;
import in.worldsync.domain.model.Page;
import in.worldsync.domain.model.TraversalOutcome;
import in.worldsync.domain.model.WindowSummary;
import in.worldsync.infrastructure.metrics.IngestMetrics;
import in.worldsync.infrastructure.worlds.WorldsApiException;
import in.worldsync.infrastructure.worlds.WorldsPayloads;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;

/**
 * Aggregates the tracks of one device over one window.
 *
 * Pages are folded into a {@link WindowAccumulator} as they arrive; nothing beyond the
 * current page and the per-track summaries is held in memory. A failure partway through
 * yields a summary with {@link TraversalOutcome#FETCH_FAILED} and whatever was gathered
 * before it.
 */
public final class WindowAggregator {
    private static final Logger log = LoggerFactory.getLogger(WindowAggregator.class);

    static final String TRACKS_QUERY = "tracks";

    private static final DateTimeFormatter WINDOW_BOUND =
        DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    private final WorldsGateway gateway;
    private final IngestMetrics metrics;
    private final int pageSize;
    private final int maxPages;

    public WindowAggregator(WorldsGateway gateway, IngestMetrics metrics, int pageSize, int maxPages) {
        this.gateway = gateway;
        this.metrics = metrics;
        this.pageSize = pageSize;
        this.maxPages = maxPages;
    }

    public WindowSummary aggregate(String deviceId, Instant windowStart, Instant windowEnd, int maxTopTracks) {
        Instant timestamp = windowEnd.truncatedTo(ChronoUnit.SECONDS);
        WindowAccumulator accumulator = new WindowAccumulator(deviceId, windowStart, windowEnd, timestamp);
        PageCursorTraversal traversal = new PageCursorTraversal(
            gateway, TRACKS_QUERY, trackFilter(deviceId, windowStart, windowEnd), pageSize, maxPages, metrics);

        String failureMessage = null;
        try {
            while (traversal.hasNext()) {
                Page page = traversal.next();
                for (JsonNode node : page.nodes()) {
                    accumulator.add(WorldsPayloads.decodeTrack(node));
                }
            }
        } catch (WorldsApiException e) {
            failureMessage = e.getMessage();
            log.error("[WINDOW] Fetch failed for {} after {} pages, keeping {} tracks: {}",
                deviceId, traversal.pagesFetched(), accumulator.tracksProcessed(), e.getMessage());
        }

        metrics.recordTracksAggregated(accumulator.tracksProcessed());
        return accumulator.toSummary(maxTopTracks, traversal.outcome(), traversal.pagesFetched(), failureMessage);
    }

    /**
     * {@code {dataSourceId: {eq: id}, time: {between: [start, end]}}} with millisecond UTC bounds.
     */
    static Map<String, Object> trackFilter(String deviceId, Instant windowStart, Instant windowEnd) {
        return Map.of(
            "dataSourceId", Map.of("eq", deviceId),
            "time", Map.of("between", List.of(WINDOW_BOUND.format(windowStart), WINDOW_BOUND.format(windowEnd))));
    }
}
