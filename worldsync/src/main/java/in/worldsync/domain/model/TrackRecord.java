package in.worldsync.domain.model;

import java.util.List;

/**
 * Interval-bounded activity ("track") decoded from a tracks page.
 *
 * Timestamps are kept as the raw strings the API sent; a track with an
 * unparsable or missing timestamp is still a valid record (its duration is 0).
 */
public record TrackRecord(
    String id,
    String tag,
    String startTime,
    String endTime,
    List<Detection> detections,
    String thumbnailUrl
) {
    public static final String UNKNOWN_TAG = "unknown";

    public TrackRecord {
        if (tag == null) {
            tag = UNKNOWN_TAG;
        }
        detections = detections == null ? List.of() : List.copyOf(detections);
    }
}
