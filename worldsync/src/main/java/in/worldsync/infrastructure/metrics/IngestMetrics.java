package in.worldsync.infrastructure.metrics;

import java.time.Duration;

/**
 * Metrics for the poll cycle and the ingestion pipeline.
 *
 * Every swallowed failure in either pipeline is counted here so that dropped data
 * is visible from outside the process.
 */
public interface IngestMetrics {

    // ---- poll cycle ----

    void recordPageFetched(String query, int nodes);

    /**
     * @param failureType "transport", "protocol" or "unknown"
     */
    void recordFetchFailure(String query, String failureType);

    /**
     * @param outcome traversal outcome name, or "skipped"
     */
    void recordWindowCycle(String outcome, Duration duration);

    void recordTracksAggregated(int count);

    // ---- ingestion ----

    void recordQueueDrop(String queue);

    void recordQueueDepth(String queue, int depth);

    void recordValidationFailure(String reason);

    /**
     * @param trigger "size", "idle" or "shutdown"
     */
    void recordBatchFlush(String trigger, int size, Duration latency);

    void recordPersistenceFailure(String operation);

    /**
     * @param event supervisor state entered: "connecting", "streaming", "disconnected", "errored" or "backoff"
     */
    void recordSubscriptionEvent(String event);

    void recordAlertEmitted(String tag);
}
