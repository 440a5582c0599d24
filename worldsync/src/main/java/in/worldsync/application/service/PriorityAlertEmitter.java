package in.worldsync.application.service;

import in.worldsync.application.port.output.ActivityStore;
import in.worldsync.domain.model.AlertEvent;
import in.worldsync.domain.model.DetectionActivityEvent;
import in.worldsync.infrastructure.metrics.IngestMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Writes a standalone alert event for activity carrying a high-priority tag.
 *
 * Runs on the subscription callback, ahead of the queue hand-off and independent of it,
 * so an alert is written even when the queue is full.
 */
public final class PriorityAlertEmitter {
    private static final Logger log = LoggerFactory.getLogger(PriorityAlertEmitter.class);

    private final ActivityStore store;
    private final IngestMetrics metrics;
    private final Set<String> priorityTags;
    private final String producerId;
    private final Clock clock;

    public PriorityAlertEmitter(ActivityStore store, IngestMetrics metrics, Set<String> priorityTags,
                                String producerId, Clock clock) {
        this.store = store;
        this.metrics = metrics;
        this.priorityTags = priorityTags == null ? Set.of() : Set.copyOf(priorityTags);
        this.producerId = producerId;
        this.clock = clock;
    }

    public boolean isPriority(DetectionActivityEvent event) {
        return event.tag() != null && priorityTags.contains(event.tag());
    }

    /**
     * Write an alert if the event's tag is a priority tag.
     *
     * @return the alert written, or null when none was due or the write failed
     */
    public AlertEvent emitIfPriority(DetectionActivityEvent event) {
        if (!isPriority(event)) {
            return null;
        }

        AlertEvent alert = toAlert(event);
        try {
            store.upsertEvent(alert);
            metrics.recordAlertEmitted(event.tag());
            log.info("[ALERT] ✓ {} alert {} for source {}", event.tag(), alert.id(), event.sourceId());
            return alert;
        } catch (RuntimeException e) {
            metrics.recordPersistenceFailure("upsert_event");
            log.error("[ALERT] Failed to store {} alert for source {}: {}",
                event.tag(), event.sourceId(), e.getMessage(), e);
            return null;
        }
    }

    AlertEvent toAlert(DetectionActivityEvent event) {
        Instant at = parseOrNow(event.timestamp());

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("notes", "Detected " + event.tag()
            + (event.sourceName() != null ? " on " + event.sourceName() : ""));
        if (event.sourceId() != null) {
            metadata.put("source_id", event.sourceId());
        }
        if (event.sourceName() != null) {
            metadata.put("source_name", event.sourceName());
        }

        return new AlertEvent(
            UUID.randomUUID().toString(),
            producerId,
            AlertEvent.TYPE_OBJECT_OF_INTEREST,
            event.tag(),
            at,
            at,
            metadata,
            false,
            AlertEvent.PRIORITY_HIGH);
    }

    private Instant parseOrNow(String timestamp) {
        if (timestamp == null || timestamp.isBlank()) {
            return clock.instant();
        }
        try {
            return OffsetDateTime.parse(timestamp.trim()).toInstant();
        } catch (DateTimeParseException e) {
            return clock.instant();
        }
    }
}
