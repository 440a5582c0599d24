package in.worldsync.infrastructure.worlds;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Keepalive for one subscription socket.
 *
 * Every {@code pingInterval} the heartbeat either sends a ping or, when nothing has
 * arrived from the server for {@code idleTimeout}, reports the silence once and stops.
 * Any inbound frame (data, pong, protocol ping) counts as a sign of life.
 *
 * Usage:
 * <pre>
 * SubscriptionHeartbeat heartbeat = new SubscriptionHeartbeat(
 *     "detectionActivity",
 *     Duration.ofSeconds(30),  // ping every 30 seconds
 *     Duration.ofSeconds(60),  // give up after 60 seconds of silence
 *     () -> sendPing(),
 *     silence -> failConnection(silence));
 *
 * heartbeat.start();
 * // on every inbound frame:
 * heartbeat.recordFrame();
 * heartbeat.stop();
 * </pre>
 */
final class SubscriptionHeartbeat {
    private static final Logger log = LoggerFactory.getLogger(SubscriptionHeartbeat.class);

    private final String name;
    private final Duration pingInterval;
    private final Duration idleTimeout;
    private final Runnable pingFunction;
    private final Consumer<Duration> onSilence;
    private final ScheduledExecutorService scheduler;

    private volatile long lastFrameNanos;
    private volatile boolean running = false;

    SubscriptionHeartbeat(String name, Duration pingInterval, Duration idleTimeout,
                          Runnable pingFunction, Consumer<Duration> onSilence) {
        if (pingInterval.isNegative() || pingInterval.isZero()) {
            throw new IllegalArgumentException("Ping interval must be positive");
        }
        if (idleTimeout.compareTo(pingInterval) < 0) {
            throw new IllegalArgumentException("Idle timeout must not be shorter than the ping interval");
        }
        this.name = name;
        this.pingInterval = pingInterval;
        this.idleTimeout = idleTimeout;
        this.pingFunction = pingFunction;
        this.onSilence = onSilence;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "heartbeat-" + name);
            t.setDaemon(true);
            return t;
        });
    }

    synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        lastFrameNanos = System.nanoTime();
        scheduler.scheduleAtFixedRate(this::tick,
            pingInterval.toMillis(), pingInterval.toMillis(), TimeUnit.MILLISECONDS);
        log.debug("[HEARTBEAT] {} started (ping {}ms, idle timeout {}ms)",
            name, pingInterval.toMillis(), idleTimeout.toMillis());
    }

    void recordFrame() {
        lastFrameNanos = System.nanoTime();
    }

    /**
     * Cancel the periodic check. Safe to call from the silence callback.
     */
    synchronized void stop() {
        running = false;
        scheduler.shutdown();
    }

    boolean isRunning() {
        return running;
    }

    Duration silence() {
        return Duration.ofNanos(System.nanoTime() - lastFrameNanos);
    }

    private void tick() {
        if (!running) {
            return;
        }

        Duration silent = silence();
        if (silent.compareTo(idleTimeout) >= 0) {
            stop();
            log.warn("[HEARTBEAT] {} silent for {}ms, giving up on the connection", name, silent.toMillis());
            try {
                onSilence.accept(silent);
            } catch (Exception e) {
                log.error("[HEARTBEAT] Silence callback threw for {}", name, e);
            }
            return;
        }

        try {
            pingFunction.run();
        } catch (Exception e) {
            log.error("[HEARTBEAT] Failed to send ping for {}", name, e);
        }
    }
}
