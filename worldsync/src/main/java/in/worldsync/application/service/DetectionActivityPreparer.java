package in.worldsync.application.service;

import in.worldsync.domain.model.DetectionActivityEvent;
import in.worldsync.domain.model.DetectionActivityRecord;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;

/**
 * Turns a raw detection-activity event into a storage row.
 */
public final class DetectionActivityPreparer {

    static final String MISSING_SOURCE = "missing_source";
    static final String BAD_TIMESTAMP = "bad_timestamp";

    private final Clock clock;

    public DetectionActivityPreparer(Clock clock) {
        this.clock = clock;
    }

    /**
     * @throws RecordValidationException when the source id or name is missing, or the
     *                                   timestamp is present but unparsable
     */
    public DetectionActivityRecord prepare(DetectionActivityEvent event) {
        if (isBlank(event.sourceId()) || isBlank(event.sourceName())) {
            throw new RecordValidationException(MISSING_SOURCE,
                "Event has no source id/name (id=" + event.sourceId() + ", name=" + event.sourceName() + ")");
        }
        return new DetectionActivityRecord(
            timestampOf(event),
            event.sourceId(),
            event.sourceName(),
            event.tag(),
            1);
    }

    /**
     * Activity timestamp, or the current time when the event carries none.
     *
     * @throws RecordValidationException when the timestamp cannot be parsed
     */
    Instant timestampOf(DetectionActivityEvent event) {
        String raw = event.timestamp();
        if (isBlank(raw)) {
            return clock.instant();
        }
        try {
            return OffsetDateTime.parse(raw.trim()).toInstant();
        } catch (DateTimeParseException e) {
            throw new RecordValidationException(BAD_TIMESTAMP, "Unparsable timestamp: " + raw);
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
