package in.worldsync.domain.model;

import java.time.Instant;

/**
 * Storage-ready detection-activity row.
 */
public record DetectionActivityRecord(
    Instant timestamp,
    String sourceId,
    String sourceName,
    String tag,
    int eventCount
) {
    public DetectionActivityRecord withEventCount(int count) {
        return new DetectionActivityRecord(timestamp, sourceId, sourceName, tag, count);
    }
}
