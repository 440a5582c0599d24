package in.worldsync.application.service;

import com.fasterxml.jackson.databind.JsonNode;
import in.worldsync.application.port.output.WorldsGateway;
import in.worldsync.application.port.output.WorldsGateway.SubscriptionHandle;
import in.worldsync.domain.model.DetectionActivityEvent;
import in.worldsync.infrastructure.metrics.IngestMetrics;
import in.worldsync.infrastructure.worlds.WorldsPayloads;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Keeps the detection-activity subscription alive.
 *
 * State machine, looping until {@link #stop}:
 * <pre>
 * CONNECTING -> STREAMING -> DISCONNECTED | ERRORED -> BACKOFF -> CONNECTING ...
 * </pre>
 * A graceful end and an error are treated alike: wait the fixed backoff, then connect
 * again, with no attempt limit. At most one subscription is open at any time; the previous handle is cancelled
 * before the backoff starts.
 *
 * Each received event first goes through the priority alert path, then is offered to
 * the ingestion queue.
 */
public final class SubscriptionSupervisor {
    private static final Logger log = LoggerFactory.getLogger(SubscriptionSupervisor.class);

    static final String SUBSCRIPTION = "detectionActivity";

    public enum State {
        IDLE,
        CONNECTING,
        STREAMING,
        DISCONNECTED,
        ERRORED,
        BACKOFF,
        STOPPED
    }

    private final WorldsGateway gateway;
    private final IngestionQueue<DetectionActivityEvent> queue;
    private final PriorityAlertEmitter alertEmitter;
    private final IngestMetrics metrics;
    private final Duration backoff;
    private final ExecutorService loop;

    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private final AtomicReference<SubscriptionHandle> current = new AtomicReference<>();
    private final AtomicLong connectionsOpened = new AtomicLong();
    private final AtomicLong eventsReceived = new AtomicLong();
    private volatile State state = State.IDLE;
    private volatile boolean running = false;

    public SubscriptionSupervisor(WorldsGateway gateway,
                                  IngestionQueue<DetectionActivityEvent> queue,
                                  PriorityAlertEmitter alertEmitter,
                                  IngestMetrics metrics,
                                  Duration backoff) {
        if (backoff.isNegative() || backoff.isZero()) {
            throw new IllegalArgumentException("Reconnect backoff must be positive");
        }
        this.gateway = gateway;
        this.queue = queue;
        this.alertEmitter = alertEmitter;
        this.metrics = metrics;
        this.backoff = backoff;
        this.loop = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "subscription-supervisor");
            t.setDaemon(true);
            return t;
        });
    }

    public synchronized void start() {
        if (running) {
            log.warn("[SUPERVISOR] Already running");
            return;
        }
        running = true;
        loop.submit(this::superviseLoop);
        log.info("[SUPERVISOR] Started, backoff {}ms", backoff.toMillis());
    }

    /**
     * Cancel the live subscription, cut any backoff short, and wait for the loop to exit.
     */
    public void stop(Duration timeout) {
        synchronized (this) {
            if (!running) {
                return;
            }
            running = false;
        }
        stopSignal.countDown();
        SubscriptionHandle handle = current.get();
        if (handle != null) {
            handle.cancel();
        }
        loop.shutdown();
        try {
            if (!loop.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("[SUPERVISOR] Loop did not exit within {}ms, interrupting", timeout.toMillis());
                loop.shutdownNow();
            }
        } catch (InterruptedException e) {
            loop.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("[SUPERVISOR] Stopped after {} connections, {} events",
            connectionsOpened.get(), eventsReceived.get());
    }

    private void superviseLoop() {
        try {
            while (running) {
                runOneConnection();
                if (!running) {
                    break;
                }

                transition(State.BACKOFF);
                log.info("[SUPERVISOR] Reconnecting in {}ms", backoff.toMillis());
                if (stopSignal.await(backoff.toMillis(), TimeUnit.MILLISECONDS)) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("[SUPERVISOR] Interrupted");
        } finally {
            state = State.STOPPED;
        }
    }

    private void runOneConnection() throws InterruptedException {
        transition(State.CONNECTING);
        SubscriptionHandle handle = null;
        try {
            handle = gateway.subscribe(SUBSCRIPTION, Map.of("filter", Map.of()), this::onEvent);
            current.set(handle);
            connectionsOpened.incrementAndGet();
            if (!running) {
                return;
            }
            transition(State.STREAMING);

            handle.termination().get();
            transition(State.DISCONNECTED);
            log.info("[SUPERVISOR] Stream ended gracefully");
        } catch (ExecutionException e) {
            transition(State.ERRORED);
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("[SUPERVISOR] Stream failed: {}", cause.getMessage());
        } catch (RuntimeException e) {
            transition(State.ERRORED);
            log.error("[SUPERVISOR] Could not subscribe: {}", e.getMessage(), e);
        } finally {
            if (handle != null) {
                handle.cancel();
            }
            current.set(null);
        }
    }

    void onEvent(JsonNode data) {
        try {
            DetectionActivityEvent event = WorldsPayloads.decodeDetectionActivity(data);
            eventsReceived.incrementAndGet();
            alertEmitter.emitIfPriority(event);
            queue.offer(event);
        } catch (RuntimeException e) {
            log.error("[SUPERVISOR] Failed to handle event: {}", e.getMessage(), e);
        }
    }

    private void transition(State next) {
        state = next;
        metrics.recordSubscriptionEvent(next.name().toLowerCase());
    }

    public State state() {
        return state;
    }

    public boolean isRunning() {
        return running;
    }

    public long connectionsOpened() {
        return connectionsOpened.get();
    }

    public long eventsReceived() {
        return eventsReceived.get();
    }
}
