package in.worldsync.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Prometheus implementation of IngestMetrics.
 *
 * Key Metrics:
 * - worldsync_pages_fetched_total{query} - Pages received from the query API
 * - worldsync_fetch_failures_total{query, type} - Failed remote calls
 * - worldsync_window_cycles_total{outcome} - Poll cycles per device by outcome
 * - worldsync_queue_dropped_total{queue} - Records dropped on a full queue
 * - worldsync_batches_flushed_total{trigger} - Batch flushes by trigger
 * - worldsync_persistence_failures_total{operation} - Swallowed write failures
 * - worldsync_subscription_connected - 1 while the live feed is streaming
 *
 * Usage:
 * <pre>
 * PrometheusIngestMetrics metrics = new PrometheusIngestMetrics();
 * Handlers.path().addPrefixPath("/metrics", new PrometheusMetricsHandler(metrics.getRegistry()));
 * </pre>
 */
public class PrometheusIngestMetrics implements IngestMetrics {
    private static final Logger log = LoggerFactory.getLogger(PrometheusIngestMetrics.class);

    private final CollectorRegistry registry;

    // Poll cycle metrics
    private final Counter pagesFetched;
    private final Counter nodesFetched;
    private final Counter fetchFailures;
    private final Counter windowCycles;
    private final Histogram windowCycleDuration;
    private final Counter tracksAggregated;

    // Queue metrics
    private final Counter queueDropped;
    private final Gauge queueDepth;

    // Batch metrics
    private final Counter validationFailures;
    private final Counter batchesFlushed;
    private final Histogram batchSize;
    private final Histogram batchLatency;
    private final Counter persistenceFailures;

    // Subscription metrics
    private final Counter subscriptionEvents;
    private final Gauge subscriptionConnected;
    private final Counter alertsEmitted;

    public PrometheusIngestMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusIngestMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.pagesFetched = Counter.build()
            .name("worldsync_pages_fetched_total")
            .help("Total number of pages received from the query API")
            .labelNames("query")
            .register(registry);

        this.nodesFetched = Counter.build()
            .name("worldsync_nodes_fetched_total")
            .help("Total number of raw records received from the query API")
            .labelNames("query")
            .register(registry);

        this.fetchFailures = Counter.build()
            .name("worldsync_fetch_failures_total")
            .help("Total number of failed remote calls")
            .labelNames("query", "type")
            .register(registry);

        this.windowCycles = Counter.build()
            .name("worldsync_window_cycles_total")
            .help("Total number of window aggregations by outcome")
            .labelNames("outcome")
            .register(registry);

        this.windowCycleDuration = Histogram.build()
            .name("worldsync_window_cycle_duration_seconds")
            .help("Window aggregation duration in seconds")
            .buckets(0.1, 0.5, 1.0, 5.0, 15.0, 60.0, 300.0)
            .register(registry);

        this.tracksAggregated = Counter.build()
            .name("worldsync_tracks_aggregated_total")
            .help("Total number of track records aggregated")
            .register(registry);

        this.queueDropped = Counter.build()
            .name("worldsync_queue_dropped_total")
            .help("Total number of records dropped because the queue was full")
            .labelNames("queue")
            .register(registry);

        this.queueDepth = Gauge.build()
            .name("worldsync_queue_depth")
            .help("Current number of records waiting in the queue")
            .labelNames("queue")
            .register(registry);

        this.validationFailures = Counter.build()
            .name("worldsync_validation_failures_total")
            .help("Total number of records excluded from a batch by validation")
            .labelNames("reason")
            .register(registry);

        this.batchesFlushed = Counter.build()
            .name("worldsync_batches_flushed_total")
            .help("Total number of batch flushes")
            .labelNames("trigger")
            .register(registry);

        this.batchSize = Histogram.build()
            .name("worldsync_batch_size")
            .help("Number of records per flushed batch")
            .buckets(1, 10, 50, 100, 200, 300, 500, 1000)
            .register(registry);

        this.batchLatency = Histogram.build()
            .name("worldsync_batch_flush_latency_seconds")
            .help("Batch flush latency in seconds")
            .buckets(0.005, 0.01, 0.05, 0.1, 0.5, 1.0, 5.0)
            .register(registry);

        this.persistenceFailures = Counter.build()
            .name("worldsync_persistence_failures_total")
            .help("Total number of failed datastore writes")
            .labelNames("operation")
            .register(registry);

        this.subscriptionEvents = Counter.build()
            .name("worldsync_subscription_events_total")
            .help("Total number of subscription lifecycle events")
            .labelNames("event")
            .register(registry);

        this.subscriptionConnected = Gauge.build()
            .name("worldsync_subscription_connected")
            .help("Live feed status (1=streaming, 0=not streaming)")
            .register(registry);

        this.alertsEmitted = Counter.build()
            .name("worldsync_alerts_emitted_total")
            .help("Total number of priority alerts emitted")
            .labelNames("tag")
            .register(registry);

        log.info("[METRICS] Prometheus ingest metrics registered");
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }

    @Override
    public void recordPageFetched(String query, int nodes) {
        pagesFetched.labels(query).inc();
        nodesFetched.labels(query).inc(nodes);
    }

    @Override
    public void recordFetchFailure(String query, String failureType) {
        fetchFailures.labels(query, failureType).inc();
    }

    @Override
    public void recordWindowCycle(String outcome, Duration duration) {
        windowCycles.labels(outcome.toLowerCase()).inc();
        windowCycleDuration.observe(seconds(duration));
    }

    @Override
    public void recordTracksAggregated(int count) {
        tracksAggregated.inc(count);
    }

    @Override
    public void recordQueueDrop(String queue) {
        queueDropped.labels(queue).inc();
    }

    @Override
    public void recordQueueDepth(String queue, int depth) {
        queueDepth.labels(queue).set(depth);
    }

    @Override
    public void recordValidationFailure(String reason) {
        validationFailures.labels(reason).inc();
    }

    @Override
    public void recordBatchFlush(String trigger, int size, Duration latency) {
        batchesFlushed.labels(trigger).inc();
        batchSize.observe(size);
        batchLatency.observe(seconds(latency));
    }

    @Override
    public void recordPersistenceFailure(String operation) {
        persistenceFailures.labels(operation).inc();
    }

    @Override
    public void recordSubscriptionEvent(String event) {
        subscriptionEvents.labels(event).inc();
        if ("streaming".equals(event)) {
            subscriptionConnected.set(1);
        } else {
            subscriptionConnected.set(0);
        }
    }

    @Override
    public void recordAlertEmitted(String tag) {
        alertsEmitted.labels(tag).inc();
    }

    private static double seconds(Duration duration) {
        return duration.toNanos() / 1_000_000_000.0;
    }
}
