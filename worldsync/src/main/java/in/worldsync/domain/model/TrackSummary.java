package in.worldsync.domain.model;

import java.time.Instant;
import java.util.List;

/**
 * Per-track figures derived during one aggregation cycle.
 *
 * @param meanConfidence arithmetic mean of the detections' confidence values, null when none carried one
 * @param zones          sorted, de-duplicated zone names across the track's detections
 */
public record TrackSummary(
    String id,
    String deviceId,
    Instant windowTimestamp,
    double durationSeconds,
    int detectionCount,
    String tag,
    String thumbnailUrl,
    Double meanConfidence,
    List<String> zones
) {
    public TrackSummary {
        zones = zones == null ? List.of() : List.copyOf(zones);
    }
}
