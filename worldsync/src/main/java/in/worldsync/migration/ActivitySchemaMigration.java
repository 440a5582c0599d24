package in.worldsync.migration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.Statement;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Activity Schema Migration - Creates the storage tables on startup.
 *
 * Tables:
 * - tags_series: tag histogram per device and window
 * - top_tracks: current longest tracks per device
 * - zones: current zone set per device
 * - detection_activity: raw live-feed rows
 * - events: high-priority alert events
 * - devices: device list with flattened data source
 */
public final class ActivitySchemaMigration {
    private static final Logger log = LoggerFactory.getLogger(ActivitySchemaMigration.class);

    private static final Map<String, String> TABLES = new LinkedHashMap<>();

    static {
        TABLES.put("tags_series", """
            CREATE TABLE tags_series (
                device_id VARCHAR(100) NOT NULL,
                window_ts TIMESTAMPTZ NOT NULL,
                window_start TIMESTAMPTZ NOT NULL,
                tags JSONB NOT NULL,
                tracks_processed INT NOT NULL DEFAULT 0,
                outcome VARCHAR(30) NOT NULL,
                updated_at TIMESTAMPTZ NOT NULL DEFAULT NOW(),
                PRIMARY KEY (device_id, window_ts)
            )
            """);

        TABLES.put("top_tracks", """
            CREATE TABLE top_tracks (
                device_id VARCHAR(100) NOT NULL,
                track_id VARCHAR(100) NOT NULL,
                window_ts TIMESTAMPTZ NOT NULL,
                duration_seconds DOUBLE PRECISION NOT NULL,
                detections INT NOT NULL,
                tag VARCHAR(100),
                thumbnail_url TEXT,
                confidence_avg DOUBLE PRECISION,
                zones JSONB NOT NULL DEFAULT '[]',
                rank INT NOT NULL,
                PRIMARY KEY (device_id, track_id)
            )
            """);

        TABLES.put("zones", """
            CREATE TABLE zones (
                device_id VARCHAR(100) PRIMARY KEY,
                window_ts TIMESTAMPTZ NOT NULL,
                zones JSONB NOT NULL DEFAULT '[]',
                updated_at TIMESTAMPTZ NOT NULL DEFAULT NOW()
            )
            """);

        TABLES.put("detection_activity", """
            CREATE TABLE detection_activity (
                id BIGSERIAL PRIMARY KEY,
                event_ts TIMESTAMPTZ NOT NULL,
                source_id VARCHAR(100) NOT NULL,
                source_name VARCHAR(255) NOT NULL,
                tag VARCHAR(100),
                event_count INT NOT NULL DEFAULT 1,
                created_at TIMESTAMPTZ NOT NULL DEFAULT NOW()
            )
            """);

        TABLES.put("events", """
            CREATE TABLE events (
                id VARCHAR(64) PRIMARY KEY,
                producer_id VARCHAR(64) NOT NULL,
                type VARCHAR(50) NOT NULL,
                sub_type VARCHAR(100),
                start_time TIMESTAMPTZ NOT NULL,
                end_time TIMESTAMPTZ NOT NULL,
                metadata JSONB NOT NULL DEFAULT '{}',
                draft BOOLEAN NOT NULL DEFAULT FALSE,
                priority VARCHAR(20) NOT NULL,
                created_at TIMESTAMPTZ NOT NULL DEFAULT NOW()
            )
            """);

        TABLES.put("devices", """
            CREATE TABLE devices (
                id VARCHAR(100) PRIMARY KEY,
                name VARCHAR(255),
                address TEXT,
                data_source_id VARCHAR(100),
                data_source_name VARCHAR(255),
                updated_at TIMESTAMPTZ NOT NULL DEFAULT NOW()
            )
            """);
    }

    private final DataSource dataSource;

    public ActivitySchemaMigration(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /**
     * Create any missing table. Existing tables are left as they are.
     *
     * @return number of tables created
     */
    public int migrate() {
        log.info("[MIGRATION] Checking activity tables");
        int created = 0;

        try (Connection conn = dataSource.getConnection()) {
            for (Map.Entry<String, String> table : TABLES.entrySet()) {
                if (tableExists(conn, table.getKey())) {
                    log.info("[MIGRATION] {} already exists", table.getKey());
                    continue;
                }
                try (Statement stmt = conn.createStatement()) {
                    stmt.execute(table.getValue());
                }
                created++;
                log.info("[MIGRATION] ✓ {} created", table.getKey());
            }

            createIndexes(conn);
            log.info("[MIGRATION] Done, {} tables created", created);
            return created;

        } catch (Exception e) {
            log.error("[MIGRATION] Failed: {}", e.getMessage(), e);
            throw new RuntimeException("Activity schema migration failed", e);
        }
    }

    private boolean tableExists(Connection conn, String tableName) throws Exception {
        DatabaseMetaData metadata = conn.getMetaData();
        try (ResultSet rs = metadata.getTables(null, null, tableName, new String[]{"TABLE"})) {
            return rs.next();
        }
    }

    private void createIndexes(Connection conn) throws Exception {
        try (Statement stmt = conn.createStatement()) {
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_detection_activity_source_ts "
                + "ON detection_activity (source_id, event_ts)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_events_sub_type "
                + "ON events (sub_type, start_time)");
        }
    }

    static Iterable<String> tableNames() {
        return TABLES.keySet();
    }
}
