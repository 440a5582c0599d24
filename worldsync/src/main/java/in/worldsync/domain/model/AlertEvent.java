package in.worldsync.domain.model;

import java.time.Instant;
import java.util.Map;

/**
 * Standalone event raised for a high-priority activity tag.
 */
public record AlertEvent(
    String id,
    String producerId,
    String type,
    String subType,
    Instant startTime,
    Instant endTime,
    Map<String, Object> metadata,
    boolean draft,
    String priority
) {
    public static final String TYPE_OBJECT_OF_INTEREST = "object-of-interest";
    public static final String PRIORITY_HIGH = "high";

    public AlertEvent {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
