package in.worldsync.infrastructure.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import in.worldsync.application.port.output.ActivityStore;
import in.worldsync.domain.model.AlertEvent;
import in.worldsync.domain.model.DetectionActivityRecord;
import in.worldsync.domain.model.Device;
import in.worldsync.domain.model.TagCount;
import in.worldsync.domain.model.TrackSummary;
import in.worldsync.domain.model.WindowSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.List;

/**
 * PostgreSQL implementation of ActivityStore.
 *
 * JSON columns (tag histograms, zone lists, alert metadata) are written as text
 * and cast to jsonb. Replace operations run in one transaction each.
 */
public final class PostgresActivityStore implements ActivityStore {
    private static final Logger log = LoggerFactory.getLogger(PostgresActivityStore.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final int BATCH_CHUNK = 500;

    private final DataSource dataSource;

    public PostgresActivityStore(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public void upsertWindowTags(WindowSummary summary) {
        String sql = """
                INSERT INTO tags_series (device_id, window_ts, window_start, tags, tracks_processed, outcome)
                VALUES (?, ?, ?, ?::jsonb, ?, ?)
                ON CONFLICT (device_id, window_ts) DO UPDATE SET
                    window_start = EXCLUDED.window_start,
                    tags = EXCLUDED.tags,
                    tracks_processed = EXCLUDED.tracks_processed,
                    outcome = EXCLUDED.outcome,
                    updated_at = NOW()
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, summary.deviceId());
            ps.setTimestamp(2, Timestamp.from(summary.timestamp()));
            ps.setTimestamp(3, Timestamp.from(summary.windowStart()));
            ps.setString(4, tagsJson(summary.tagCounts()));
            ps.setInt(5, summary.tracksProcessed());
            ps.setString(6, summary.outcome().name());
            ps.executeUpdate();

        } catch (Exception e) {
            log.error("Failed to upsert tags for {}: {}", summary.deviceId(), e.getMessage(), e);
            throw new PersistenceException("upsert_window_tags", e);
        }
    }

    @Override
    public void replaceTopTracks(String deviceId, List<TrackSummary> tracks) {
        String deleteSql = "DELETE FROM top_tracks WHERE device_id = ?";
        String insertSql = """
                INSERT INTO top_tracks (
                    device_id, track_id, window_ts, duration_seconds, detections,
                    tag, thumbnail_url, confidence_avg, zones, rank
                ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?::jsonb, ?)
                """;

        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try (PreparedStatement delete = conn.prepareStatement(deleteSql);
                    PreparedStatement insert = conn.prepareStatement(insertSql)) {

                delete.setString(1, deviceId);
                delete.executeUpdate();

                int rank = 1;
                for (TrackSummary t : tracks) {
                    insert.setString(1, deviceId);
                    insert.setString(2, t.id());
                    insert.setTimestamp(3, Timestamp.from(t.windowTimestamp()));
                    insert.setDouble(4, t.durationSeconds());
                    insert.setInt(5, t.detectionCount());
                    insert.setString(6, t.tag());
                    insert.setString(7, t.thumbnailUrl());
                    if (t.meanConfidence() != null) {
                        insert.setDouble(8, t.meanConfidence());
                    } else {
                        insert.setNull(8, Types.DOUBLE);
                    }
                    insert.setString(9, MAPPER.writeValueAsString(t.zones()));
                    insert.setInt(10, rank++);
                    insert.addBatch();
                }
                insert.executeBatch();
                conn.commit();
            } catch (Exception e) {
                conn.rollback();
                throw e;
            }
            log.debug("Replaced {} top tracks for {}", tracks.size(), deviceId);

        } catch (Exception e) {
            log.error("Failed to replace top tracks for {}: {}", deviceId, e.getMessage(), e);
            throw new PersistenceException("replace_top_tracks", e);
        }
    }

    @Override
    public void upsertZones(String deviceId, List<String> zones, Instant timestamp) {
        String sql = """
                INSERT INTO zones (device_id, window_ts, zones)
                VALUES (?, ?, ?::jsonb)
                ON CONFLICT (device_id) DO UPDATE SET
                    window_ts = EXCLUDED.window_ts,
                    zones = EXCLUDED.zones,
                    updated_at = NOW()
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, deviceId);
            ps.setTimestamp(2, Timestamp.from(timestamp));
            ps.setString(3, MAPPER.writeValueAsString(zones));
            ps.executeUpdate();

        } catch (Exception e) {
            log.error("Failed to upsert zones for {}: {}", deviceId, e.getMessage(), e);
            throw new PersistenceException("upsert_zones", e);
        }
    }

    @Override
    public void insertDetectionBatch(List<DetectionActivityRecord> records) {
        if (records.isEmpty()) {
            return;
        }
        String sql = """
                INSERT INTO detection_activity (event_ts, source_id, source_name, tag, event_count)
                VALUES (?, ?, ?, ?, ?)
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            conn.setAutoCommit(false);
            try {
                int count = 0;
                for (DetectionActivityRecord r : records) {
                    ps.setTimestamp(1, Timestamp.from(r.timestamp()));
                    ps.setString(2, r.sourceId());
                    ps.setString(3, r.sourceName());
                    ps.setString(4, r.tag());
                    ps.setInt(5, r.eventCount());
                    ps.addBatch();
                    count++;

                    if (count % BATCH_CHUNK == 0) {
                        ps.executeBatch();
                    }
                }
                ps.executeBatch();
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }

        } catch (Exception e) {
            log.error("Failed to insert {} detection rows: {}", records.size(), e.getMessage(), e);
            throw new PersistenceException("insert_detection_batch", e);
        }
    }

    @Override
    public void upsertEvent(AlertEvent event) {
        String sql = """
                INSERT INTO events (
                    id, producer_id, type, sub_type, start_time, end_time, metadata, draft, priority
                ) VALUES (?, ?, ?, ?, ?, ?, ?::jsonb, ?, ?)
                ON CONFLICT (id) DO UPDATE SET
                    producer_id = EXCLUDED.producer_id,
                    type = EXCLUDED.type,
                    sub_type = EXCLUDED.sub_type,
                    start_time = EXCLUDED.start_time,
                    end_time = EXCLUDED.end_time,
                    metadata = EXCLUDED.metadata,
                    draft = EXCLUDED.draft,
                    priority = EXCLUDED.priority
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, event.id());
            ps.setString(2, event.producerId());
            ps.setString(3, event.type());
            ps.setString(4, event.subType());
            ps.setTimestamp(5, Timestamp.from(event.startTime()));
            ps.setTimestamp(6, Timestamp.from(event.endTime()));
            ps.setString(7, MAPPER.writeValueAsString(event.metadata()));
            ps.setBoolean(8, event.draft());
            ps.setString(9, event.priority());
            ps.executeUpdate();

        } catch (Exception e) {
            log.error("Failed to upsert event {}: {}", event.id(), e.getMessage(), e);
            throw new PersistenceException("upsert_event", e);
        }
    }

    @Override
    public void replaceDeviceList(List<Device> devices) {
        String deleteSql = "DELETE FROM devices";
        String insertSql = """
                INSERT INTO devices (id, name, address, data_source_id, data_source_name)
                VALUES (?, ?, ?, ?, ?)
                ON CONFLICT (id) DO UPDATE SET
                    name = EXCLUDED.name,
                    address = EXCLUDED.address,
                    data_source_id = EXCLUDED.data_source_id,
                    data_source_name = EXCLUDED.data_source_name,
                    updated_at = NOW()
                """;

        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try (PreparedStatement delete = conn.prepareStatement(deleteSql);
                    PreparedStatement insert = conn.prepareStatement(insertSql)) {

                delete.executeUpdate();
                for (Device d : devices) {
                    if (d.id() == null) {
                        log.warn("Skipping device without id: {}", d);
                        continue;
                    }
                    insert.setString(1, d.id());
                    insert.setString(2, d.name());
                    insert.setString(3, d.address());
                    insert.setString(4, d.dataSourceId());
                    insert.setString(5, d.dataSourceName());
                    insert.addBatch();
                }
                insert.executeBatch();
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }

        } catch (Exception e) {
            log.error("Failed to replace device list: {}", e.getMessage(), e);
            throw new PersistenceException("replace_device_list", e);
        }
    }

    /**
     * Tag histogram as an ordered JSON array of {@code {tag, count}} objects.
     */
    static String tagsJson(List<TagCount> counts) throws JsonProcessingException {
        ArrayNode array = MAPPER.createArrayNode();
        for (TagCount c : counts) {
            array.addObject().put("tag", c.tag()).put("count", c.count());
        }
        return MAPPER.writeValueAsString(array);
    }
}
