package in.worldsync.domain.model;

/**
 * Detection-activity event as delivered by the live subscription.
 *
 * All fields are optional at this point; required-field checks happen when the
 * event is prepared for storage.
 */
public record DetectionActivityEvent(
    String timestamp,
    String tag,
    String sourceId,
    String sourceName
) {}
