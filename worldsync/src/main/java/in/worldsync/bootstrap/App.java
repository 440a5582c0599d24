package in.worldsync.bootstrap;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import in.worldsync.application.port.output.ActivityStore;
import in.worldsync.application.service.BatchFlusher;
import in.worldsync.application.service.DetectionActivityPreparer;
import in.worldsync.application.service.DeviceCatalogService;
import in.worldsync.application.service.IngestionQueue;
import in.worldsync.application.service.PriorityAlertEmitter;
import in.worldsync.application.service.SubscriptionSupervisor;
import in.worldsync.application.service.WindowAggregationService;
import in.worldsync.application.service.WindowAggregator;
import in.worldsync.config.WorldsSyncConfig;
import in.worldsync.domain.model.DetectionActivityEvent;
import in.worldsync.infrastructure.metrics.PrometheusIngestMetrics;
import in.worldsync.infrastructure.metrics.PrometheusMetricsHandler;
import in.worldsync.infrastructure.persistence.PostgresActivityStore;
import in.worldsync.infrastructure.worlds.WorldsApiClient;
import in.worldsync.migration.ActivitySchemaMigration;
import in.worldsync.transport.http.HealthHandler;
import in.worldsync.util.Env;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.RoutingHandler;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;

/**
 * Core Java entry point (NO Spring).
 *
 * Wires the two pipelines against one Worlds client and one datastore:
 * - poll cycle: device discovery, windowed track aggregation, summary writes
 * - ingestion: live detection-activity feed, bounded queue, batch flusher, alerts
 *
 * RUN_MODE selects FULL (both), DASHBOARD (poll cycle only) or SUBSCRIPTION
 * (ingestion only). /metrics and /health are served in every mode unless HTTP_PORT is 0.
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(30);

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== WorldSync Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        WorldsSyncConfig config = WorldsSyncConfig.fromEnv();
        StartupConfigValidator.validate(config);
        Clock clock = Clock.systemUTC();

        // ═══════════════════════════════════════════════════════════════
        // Database
        // ═══════════════════════════════════════════════════════════════
        HikariDataSource dataSource = createDataSource();
        if (Env.getBool("DB_MIGRATE", true)) {
            new ActivitySchemaMigration(dataSource).migrate();
        }
        ActivityStore store = new PostgresActivityStore(dataSource);

        // ═══════════════════════════════════════════════════════════════
        // Prometheus Metrics
        // ═══════════════════════════════════════════════════════════════
        PrometheusIngestMetrics metrics = new PrometheusIngestMetrics();
        log.info("✓ Prometheus metrics initialized");

        // ═══════════════════════════════════════════════════════════════
        // Worlds API client
        // ═══════════════════════════════════════════════════════════════
        WorldsApiClient worlds = new WorldsApiClient(
            config.apiUrl(), config.wsUrl(), config.tokenId(), config.tokenValue());

        // ═══════════════════════════════════════════════════════════════
        // Poll cycle
        // ═══════════════════════════════════════════════════════════════
        WindowAggregationService aggregation = null;
        if (config.runMode().runsPollCycle()) {
            DeviceCatalogService devices = new DeviceCatalogService(
                worlds, store, metrics, config.deviceAddressFilter(), config.pageSize(), config.maxPages());
            WindowAggregator aggregator = new WindowAggregator(
                worlds, metrics, config.pageSize(), config.maxPages());
            aggregation = new WindowAggregationService(
                devices, aggregator, store, metrics, clock,
                config.deviceIds(), config.windowLength(), config.topTracks());
            aggregation.start(config.pollInterval());
            log.info("✓ Poll cycle started");
        } else {
            log.info("[POLL] ⏭️ Skipping poll cycle ({} mode)", config.runMode());
        }

        // ═══════════════════════════════════════════════════════════════
        // Ingestion pipeline
        // ═══════════════════════════════════════════════════════════════
        IngestionQueue<DetectionActivityEvent> queue = null;
        BatchFlusher flusher = null;
        SubscriptionSupervisor supervisor = null;
        if (config.runMode().runsIngestion()) {
            queue = new IngestionQueue<>("detection_activity", config.queueCapacity(), metrics);
            flusher = new BatchFlusher(
                queue, new DetectionActivityPreparer(clock), store, metrics,
                config.batchMaxSize(), config.batchIdleTimeout(), config.collapseByTag());
            PriorityAlertEmitter alerts = new PriorityAlertEmitter(
                store, metrics, config.priorityTags(), config.alertProducerId(), clock);
            supervisor = new SubscriptionSupervisor(
                worlds, queue, alerts, metrics, config.reconnectBackoff());

            flusher.start();
            supervisor.start();
            log.info("✓ Ingestion pipeline started");
        } else {
            log.info("[INGEST] ⏭️ Skipping ingestion pipeline ({} mode)", config.runMode());
        }

        // ═══════════════════════════════════════════════════════════════
        // HTTP: /metrics, /health
        // ═══════════════════════════════════════════════════════════════
        PrometheusMetricsHandler metricsHandler = new PrometheusMetricsHandler(metrics.getRegistry());
        HealthHandler healthHandler = new HealthHandler(config.runMode(), supervisor, queue, flusher, clock);

        RoutingHandler routes = Handlers.routing()
            .get("/metrics", metricsHandler)
            .get("/health", healthHandler)
            .setFallbackHandler(exchange -> {
                exchange.setStatusCode(404);
                exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=utf-8");
                exchange.getResponseSender().send("WorldSync\n\nGET /health, /metrics\n");
            });

        final Undertow server;
        if (config.httpPort() > 0) {
            server = Undertow.builder()
                .addHttpListener(config.httpPort(), "0.0.0.0")
                .setHandler(routes)
                .build();
            server.start();
            log.info("✓ HTTP server started on port {}", config.httpPort());
        } else {
            server = null;
            log.info("⏭️ HTTP server disabled (HTTP_PORT=0)");
        }

        // ═══════════════════════════════════════════════════════════════
        // Shutdown: feed first, then flush, then finish the cycle in flight
        // ═══════════════════════════════════════════════════════════════
        ShutdownSequence shutdown = new ShutdownSequence();
        if (supervisor != null) {
            SubscriptionSupervisor supervisorRef = supervisor;
            shutdown.then("supervisor", () -> supervisorRef.stop(SHUTDOWN_TIMEOUT));
        }
        if (flusher != null) {
            BatchFlusher flusherRef = flusher;
            shutdown.then("flusher", () -> flusherRef.stop(SHUTDOWN_TIMEOUT));
        }
        if (aggregation != null) {
            WindowAggregationService aggregationRef = aggregation;
            shutdown.then("poll cycle", () -> aggregationRef.stop(SHUTDOWN_TIMEOUT));
        }
        if (server != null) {
            shutdown.then("http", server::stop);
        }
        shutdown.then("datasource", dataSource::close);
        Runtime.getRuntime().addShutdownHook(new Thread(shutdown, "shutdown-hook"));

        log.info("=== WorldSync started ({} mode) ===", config.runMode());

        // workers are daemon threads; main stays parked until the hook has run
        try {
            shutdown.awaitShutdown();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[SHUTDOWN] Main thread interrupted, stopping");
            shutdown.run();
        }
    }

    private static HikariDataSource createDataSource() {
        String url = Env.get("DB_URL", "jdbc:postgresql://localhost:5432/worldsync");
        String user = Env.get("DB_USER", "postgres");
        String pass = Env.get("DB_PASS", "postgres");
        int maxPool = Env.getInt("DB_POOL_SIZE", 10);

        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(url);
        config.setUsername(user);
        config.setPassword(pass);
        config.setMaximumPoolSize(maxPool);
        config.setMinimumIdle(2);
        config.setConnectionTimeout(5000);
        config.setPoolName("worldsync-hikari");

        log.info("DB: url={}, user={}, pool={}", url, user, maxPool);
        return new HikariDataSource(config);
    }

    private App() {}
}
