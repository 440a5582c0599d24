package in.worldsync.transport.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.worldsync.application.service.BatchFlusher;
import in.worldsync.application.service.IngestionQueue;
import in.worldsync.application.service.SubscriptionSupervisor;
import in.worldsync.config.WorldsSyncConfig.RunMode;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * GET /health - liveness plus a snapshot of the ingestion pipeline.
 *
 * Components not running in the current mode are passed as null and omitted.
 */
public final class HealthHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(HealthHandler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final RunMode runMode;
    private final SubscriptionSupervisor supervisor;
    private final IngestionQueue<?> queue;
    private final BatchFlusher flusher;
    private final Clock clock;

    public HealthHandler(RunMode runMode, SubscriptionSupervisor supervisor, IngestionQueue<?> queue,
                         BatchFlusher flusher, Clock clock) {
        this.runMode = runMode;
        this.supervisor = supervisor;
        this.queue = queue;
        this.flusher = flusher;
        this.clock = clock;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");

        try {
            exchange.setStatusCode(200);
            exchange.getResponseSender().send(MAPPER.writeValueAsString(snapshot()));
        } catch (Exception e) {
            log.error("[HEALTH] Failed to render health: {}", e.getMessage(), e);
            exchange.setStatusCode(500);
            exchange.getResponseSender().send("{\"status\":\"error\"}");
        }
    }

    ObjectNode snapshot() {
        ObjectNode health = MAPPER.createObjectNode();
        health.put("status", "ok");
        health.put("ts", clock.instant().toString());
        health.put("runMode", runMode.name());

        if (supervisor != null) {
            ObjectNode sub = health.putObject("subscription");
            sub.put("state", supervisor.state().name());
            sub.put("connections", supervisor.connectionsOpened());
            sub.put("events", supervisor.eventsReceived());
        }
        if (queue != null) {
            ObjectNode q = health.putObject("queue");
            q.put("size", queue.size());
            q.put("capacity", queue.capacity());
            q.put("dropped", queue.droppedCount());
        }
        if (flusher != null) {
            ObjectNode f = health.putObject("flusher");
            f.put("running", flusher.isRunning());
            f.put("batches", flusher.batchesFlushed());
            f.put("records", flusher.recordsFlushed());
            f.put("rejected", flusher.recordsRejected());
        }
        return health;
    }
}
