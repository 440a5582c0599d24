package in.worldsync.config;

import in.worldsync.util.Env;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Runtime configuration for both pipelines.
 *
 * Built once at startup from the environment (see {@link #fromEnv()}) and passed
 * down explicitly; nothing below bootstrap reads the environment itself.
 */
public record WorldsSyncConfig(
    RunMode runMode,

    // Remote data service
    String apiUrl,
    String wsUrl,
    String tokenId,
    String tokenValue,

    // Poll cycle
    Duration pollInterval,
    Duration windowLength,
    int topTracks,
    int pageSize,
    int maxPages,
    List<String> deviceIds,
    String deviceAddressFilter,

    // Ingestion pipeline
    int queueCapacity,
    int batchMaxSize,
    Duration batchIdleTimeout,
    boolean collapseByTag,
    Duration reconnectBackoff,
    Set<String> priorityTags,
    String alertProducerId,

    // Ambient
    int httpPort
) {
    public static final String DEFAULT_ALERT_PRODUCER_ID = "1514aad2-bd89-42ab-8831-3ec75866a929";

    public WorldsSyncConfig {
        deviceIds = deviceIds == null ? List.of() : List.copyOf(deviceIds);
        priorityTags = priorityTags == null ? Set.of() : Set.copyOf(priorityTags);
    }

    /**
     * Which daemons this process runs.
     */
    public enum RunMode {
        FULL,
        DASHBOARD,
        SUBSCRIPTION;

        public boolean runsPollCycle() {
            return this != SUBSCRIPTION;
        }

        public boolean runsIngestion() {
            return this != DASHBOARD;
        }

        static RunMode parse(String value) {
            try {
                return RunMode.valueOf(value.trim().toUpperCase());
            } catch (IllegalArgumentException e) {
                throw new IllegalStateException("Unknown RUN_MODE: " + value);
            }
        }
    }

    public static WorldsSyncConfig fromEnv() {
        return new WorldsSyncConfig(
            RunMode.parse(Env.get("RUN_MODE", "FULL")),
            Env.get("WORLDS_API_URL", null),
            Env.get("WORLDS_WS_URL", null),
            Env.get("WORLDS_TOKEN_ID", null),
            Env.get("WORLDS_TOKEN_VALUE", null),
            Duration.ofSeconds(Env.getLong("POLL_INTERVAL_SECONDS", 3600)),
            Duration.ofMinutes(Env.getLong("WINDOW_MINUTES", 60)),
            Env.getInt("TOP_TRACKS", 5),
            Env.getInt("PAGE_SIZE", 50),
            Env.getInt("MAX_PAGES", 1000),
            Env.getList("DEVICE_IDS", ""),
            Env.get("DEVICE_ADDRESS_FILTER", "earthcam"),
            Env.getInt("QUEUE_CAPACITY", 10_000),
            Env.getInt("BATCH_MAX_SIZE", 300),
            Duration.ofSeconds(Env.getLong("BATCH_IDLE_TIMEOUT_SECONDS", 30)),
            Env.getBool("BATCH_COLLAPSE_BY_TAG", false),
            Duration.ofSeconds(Env.getLong("RECONNECT_BACKOFF_SECONDS", 15)),
            new LinkedHashSet<>(Env.getList("PRIORITY_TAGS", "yellow_vest")),
            Env.get("ALERT_PRODUCER_ID", DEFAULT_ALERT_PRODUCER_ID),
            Env.getInt("HTTP_PORT", 9090)
        );
    }

    /**
     * Problems that prevent startup. Empty when the configuration is usable.
     */
    public List<String> problems() {
        List<String> problems = new ArrayList<>();
        if (isBlank(apiUrl) && runMode.runsPollCycle()) {
            problems.add("WORLDS_API_URL is required");
        }
        if (isBlank(wsUrl) && runMode.runsIngestion()) {
            problems.add("WORLDS_WS_URL is required");
        }
        if (isBlank(tokenId) || isBlank(tokenValue)) {
            problems.add("WORLDS_TOKEN_ID and WORLDS_TOKEN_VALUE are required");
        }
        if (!isPositive(pollInterval)) problems.add("POLL_INTERVAL_SECONDS must be positive");
        if (!isPositive(windowLength)) problems.add("WINDOW_MINUTES must be positive");
        if (topTracks <= 0) problems.add("TOP_TRACKS must be positive");
        if (pageSize <= 0) problems.add("PAGE_SIZE must be positive");
        if (maxPages <= 0) problems.add("MAX_PAGES must be positive");
        if (queueCapacity <= 0) problems.add("QUEUE_CAPACITY must be positive");
        if (batchMaxSize <= 0) problems.add("BATCH_MAX_SIZE must be positive");
        if (!isPositive(batchIdleTimeout)) problems.add("BATCH_IDLE_TIMEOUT_SECONDS must be positive");
        if (!isPositive(reconnectBackoff)) problems.add("RECONNECT_BACKOFF_SECONDS must be positive");
        if (httpPort < 0 || httpPort > 65535) problems.add("HTTP_PORT must be between 0 and 65535");
        return problems;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private static boolean isPositive(Duration d) {
        return d != null && !d.isNegative() && !d.isZero();
    }
}
