package in.worldsync.application.port.output;

import in.worldsync.domain.model.AlertEvent;
import in.worldsync.domain.model.DetectionActivityRecord;
import in.worldsync.domain.model.Device;
import in.worldsync.domain.model.TrackSummary;
import in.worldsync.domain.model.WindowSummary;

import java.time.Instant;
import java.util.List;

/**
 * Persistence gateway for aggregated and raw activity.
 *
 * All writes are upserts or replace-by-key, so repeating one is harmless.
 * Implementations throw {@link in.worldsync.infrastructure.persistence.PersistenceException}
 * on failure; callers decide whether to swallow it.
 */
public interface ActivityStore {

    /**
     * Store the tag histogram of one window, keyed by device and window timestamp.
     */
    void upsertWindowTags(WindowSummary summary);

    /**
     * Replace the device's top tracks with the given list.
     */
    void replaceTopTracks(String deviceId, List<TrackSummary> tracks);

    /**
     * Replace the device's zone set.
     */
    void upsertZones(String deviceId, List<String> zones, Instant timestamp);

    /**
     * Append prepared detection-activity rows.
     */
    void insertDetectionBatch(List<DetectionActivityRecord> records);

    /**
     * Insert or update an alert event by id.
     */
    void upsertEvent(AlertEvent event);

    /**
     * Replace the stored device list.
     */
    void replaceDeviceList(List<Device> devices);
}
