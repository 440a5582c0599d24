package in.worldsync.application.service;

import in.worldsync.domain.model.Detection;
import in.worldsync.domain.model.TagCount;
import in.worldsync.domain.model.TrackRecord;
import in.worldsync.domain.model.TrackSummary;
import in.worldsync.domain.model.TraversalOutcome;
import in.worldsync.domain.model.WindowSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Aggregation state for one device over one window.
 *
 * Created at the start of a cycle, fed track by track, consumed once by
 * {@link #toSummary}. Not thread-safe; owned by the cycle that created it.
 */
public final class WindowAccumulator {
    private static final Logger log = LoggerFactory.getLogger(WindowAccumulator.class);

    private static final Comparator<TrackSummary> LONGEST_FIRST =
        Comparator.comparingDouble(TrackSummary::durationSeconds).reversed();

    private final String deviceId;
    private final Instant windowStart;
    private final Instant windowEnd;
    private final Instant timestamp;

    private final Map<String, Integer> tagCounts = new HashMap<>();
    // insertion-ordered so equal durations keep first-seen order
    private final Map<String, TrackSummary> tracks = new LinkedHashMap<>();
    private final Set<String> zones = new TreeSet<>();
    private int tracksProcessed;
    private boolean consumed;

    public WindowAccumulator(String deviceId, Instant windowStart, Instant windowEnd, Instant timestamp) {
        this.deviceId = deviceId;
        this.windowStart = windowStart;
        this.windowEnd = windowEnd;
        this.timestamp = timestamp;
    }

    public void add(TrackRecord track) {
        if (consumed) {
            throw new IllegalStateException("Window for " + deviceId + " already summarized");
        }

        Set<String> trackZones = new TreeSet<>();
        double confidenceSum = 0.0;
        int confidenceCount = 0;
        for (Detection d : track.detections()) {
            trackZones.addAll(d.zoneNames());
            if (d.confidence() != null) {
                confidenceSum += d.confidence();
                confidenceCount++;
            }
        }
        Double meanConfidence = confidenceCount == 0 ? null : confidenceSum / confidenceCount;

        zones.addAll(trackZones);
        tagCounts.merge(track.tag(), 1, Integer::sum);
        tracksProcessed++;

        if (track.id() == null) {
            log.debug("[WINDOW] Track without id for {} counted but not ranked", deviceId);
            return;
        }

        tracks.put(track.id(), new TrackSummary(
            track.id(),
            deviceId,
            timestamp,
            durationSeconds(track),
            track.detections().size(),
            track.tag(),
            track.thumbnailUrl(),
            meanConfidence,
            List.copyOf(trackZones)));
    }

    /**
     * Reduce the accumulated state. May be called once.
     */
    public WindowSummary toSummary(int maxTopTracks, TraversalOutcome outcome, int pagesFetched, String failureMessage) {
        if (consumed) {
            throw new IllegalStateException("Window for " + deviceId + " already summarized");
        }
        consumed = true;

        List<TagCount> counts = new ArrayList<>(tagCounts.size());
        tagCounts.forEach((tag, count) -> counts.add(new TagCount(tag, count)));
        counts.sort(TagCount.BY_COUNT_DESC);

        // List.sort is stable: ties keep insertion order
        List<TrackSummary> ranked = new ArrayList<>(tracks.values());
        ranked.sort(LONGEST_FIRST);
        List<TrackSummary> top = ranked.subList(0, Math.min(Math.max(maxTopTracks, 0), ranked.size()));

        return new WindowSummary(
            deviceId,
            windowStart,
            windowEnd,
            timestamp,
            counts,
            top,
            List.copyOf(zones),
            tracksProcessed,
            pagesFetched,
            outcome,
            failureMessage);
    }

    public int tracksProcessed() {
        return tracksProcessed;
    }

    /**
     * End minus start in seconds; 0.0 when either timestamp is missing or unparsable.
     */
    static double durationSeconds(TrackRecord track) {
        Instant start = parseInstant(track.startTime());
        Instant end = parseInstant(track.endTime());
        if (start == null || end == null) {
            return 0.0;
        }
        return Duration.between(start, end).toNanos() / 1_000_000_000.0;
    }

    static Instant parseInstant(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value.trim()).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
