package in.worldsync.application.service;

import in.worldsync.application.port.output.ActivityStore;
import in.worldsync.domain.model.Device;
import in.worldsync.domain.model.WindowSummary;
import in.worldsync.infrastructure.metrics.IngestMetrics;
import in.worldsync.infrastructure.persistence.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodic poll cycle: refresh devices, aggregate each target over the trailing
 * window, persist the results.
 *
 * Cycles never overlap (fixed delay on a single thread). Each of the three writes
 * per device is attempted independently; a failed write is logged and counted and
 * does not stop the others or the next device.
 */
public final class WindowAggregationService {
    private static final Logger log = LoggerFactory.getLogger(WindowAggregationService.class);

    private final DeviceCatalogService deviceCatalog;
    private final WindowAggregator aggregator;
    private final ActivityStore store;
    private final IngestMetrics metrics;
    private final Clock clock;
    private final List<String> configuredDeviceIds;
    private final Duration windowLength;
    private final int topTracks;
    private final ScheduledExecutorService scheduler;

    public WindowAggregationService(DeviceCatalogService deviceCatalog,
                                    WindowAggregator aggregator,
                                    ActivityStore store,
                                    IngestMetrics metrics,
                                    Clock clock,
                                    List<String> configuredDeviceIds,
                                    Duration windowLength,
                                    int topTracks) {
        this.deviceCatalog = deviceCatalog;
        this.aggregator = aggregator;
        this.store = store;
        this.metrics = metrics;
        this.clock = clock;
        this.configuredDeviceIds = configuredDeviceIds == null ? List.of() : List.copyOf(configuredDeviceIds);
        this.windowLength = windowLength;
        this.topTracks = topTracks;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "window-aggregator");
            t.setDaemon(true);
            return t;
        });
    }

    public void start(Duration pollInterval) {
        scheduler.scheduleWithFixedDelay(() -> {
            try {
                runCycle();
            } catch (Exception e) {
                log.error("[WINDOW] Poll cycle failed", e);
            }
        }, 0, pollInterval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("[WINDOW] Poll cycle started: interval={}s, window={}m, top={}",
            pollInterval.toSeconds(), windowLength.toMinutes(), topTracks);
    }

    /**
     * Stop scheduling; a cycle already running is allowed to finish.
     */
    public void stop(Duration timeout) {
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("[WINDOW] Cycle still running after {}s, interrupting", timeout.toSeconds());
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Run one full cycle on the calling thread.
     *
     * @return the summaries produced, one per target device
     */
    public List<WindowSummary> runCycle() {
        long cycleStart = System.nanoTime();
        List<Device> discovered = deviceCatalog.refresh();
        List<String> targets = resolveTargets(discovered);

        if (targets.isEmpty()) {
            log.warn("[WINDOW] No devices to aggregate, skipping cycle");
            metrics.recordWindowCycle("skipped", Duration.ofNanos(System.nanoTime() - cycleStart));
            return List.of();
        }

        Instant windowEnd = clock.instant();
        Instant windowStart = windowEnd.minus(windowLength);

        List<WindowSummary> summaries = new ArrayList<>(targets.size());
        for (String deviceId : targets) {
            long deviceStart = System.nanoTime();
            WindowSummary summary = aggregator.aggregate(deviceId, windowStart, windowEnd, topTracks);
            persist(summary);
            summaries.add(summary);

            Duration elapsed = Duration.ofNanos(System.nanoTime() - deviceStart);
            metrics.recordWindowCycle(summary.outcome().name(), elapsed);
            if (summary.complete()) {
                log.info("[WINDOW] ✓ {}: {} tracks over {} pages, {} tags, {} zones ({}ms)",
                    deviceId, summary.tracksProcessed(), summary.pagesFetched(),
                    summary.tagCounts().size(), summary.zones().size(), elapsed.toMillis());
            } else {
                log.warn("[WINDOW] {} partial ({}): {} tracks over {} pages ({}ms)",
                    deviceId, summary.outcome(), summary.tracksProcessed(), summary.pagesFetched(),
                    elapsed.toMillis());
            }
        }
        return summaries;
    }

    private List<String> resolveTargets(List<Device> discovered) {
        if (!configuredDeviceIds.isEmpty()) {
            return configuredDeviceIds;
        }
        Set<String> ids = new LinkedHashSet<>();
        for (Device device : discovered) {
            String id = device.dataSourceId() != null ? device.dataSourceId() : device.id();
            if (id != null) {
                ids.add(id);
            }
        }
        return new ArrayList<>(ids);
    }

    private void persist(WindowSummary summary) {
        String deviceId = summary.deviceId();
        try {
            store.upsertWindowTags(summary);
        } catch (PersistenceException e) {
            metrics.recordPersistenceFailure(e.getOperation());
            log.error("[WINDOW] Failed to store tags for {}: {}", deviceId, e.getMessage());
        }
        try {
            store.replaceTopTracks(deviceId, summary.topTracks());
        } catch (PersistenceException e) {
            metrics.recordPersistenceFailure(e.getOperation());
            log.error("[WINDOW] Failed to store top tracks for {}: {}", deviceId, e.getMessage());
        }
        try {
            store.upsertZones(deviceId, summary.zones(), summary.timestamp());
        } catch (PersistenceException e) {
            metrics.recordPersistenceFailure(e.getOperation());
            log.error("[WINDOW] Failed to store zones for {}: {}", deviceId, e.getMessage());
        }
    }
}
