package in.worldsync.domain.model;

import java.time.Instant;
import java.util.List;

/**
 * Result of aggregating one device over one time window.
 *
 * A summary with an outcome other than {@link TraversalOutcome#EXHAUSTED} holds
 * partial results; it is still persisted.
 */
public record WindowSummary(
    String deviceId,
    Instant windowStart,
    Instant windowEnd,
    Instant timestamp,
    List<TagCount> tagCounts,
    List<TrackSummary> topTracks,
    List<String> zones,
    int tracksProcessed,
    int pagesFetched,
    TraversalOutcome outcome,
    String failureMessage
) {
    public WindowSummary {
        tagCounts = List.copyOf(tagCounts);
        topTracks = List.copyOf(topTracks);
        zones = List.copyOf(zones);
    }

    public boolean complete() {
        return outcome.isComplete();
    }
}
