package in.worldsync.application.service;

import com.fasterxml.jackson.databind.JsonNode;
import in.worldsync.application.port.output.ActivityStore;
import in.worldsync.application.port.output.WorldsGateway;
import in.worldsync.application.port.output.WorldsGateway.SubscriptionHandle;
import in.worldsync.domain.model.AlertEvent;
import in.worldsync.domain.model.DetectionActivityEvent;
import in.worldsync.infrastructure.metrics.IngestMetrics;
import in.worldsync.infrastructure.worlds.WorldsConnectionException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

import static in.worldsync.application.service.PageFixtures.activity;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for SubscriptionSupervisor.
 *
 * Tests:
 * - Reconnect after error and after graceful end, after the backoff
 * - Never more than one open subscription
 * - Event hand-off to queue and alert path
 * - Stop cutting the backoff short
 * - Backoff validation
 */
@ExtendWith(MockitoExtension.class)
class SubscriptionSupervisorTest {

    @Mock
    private WorldsGateway gateway;
    @Mock
    private ActivityStore store;
    @Mock
    private IngestMetrics metrics;

    private final List<FakeHandle> handles = new CopyOnWriteArrayList<>();
    private final List<Long> subscribeTimes = new CopyOnWriteArrayList<>();
    private final AtomicInteger open = new AtomicInteger();
    private final AtomicInteger maxOpen = new AtomicInteger();

    private IngestionQueue<DetectionActivityEvent> queue;
    private SubscriptionSupervisor supervisor;

    /** Handle whose termination the test completes by hand. */
    private final class FakeHandle implements SubscriptionHandle {
        final CompletableFuture<Void> termination = new CompletableFuture<>();
        final Consumer<JsonNode> onEvent;
        volatile long terminatedAt;
        private boolean closed;

        FakeHandle(Consumer<JsonNode> onEvent) {
            this.onEvent = onEvent;
        }

        void fail() {
            terminatedAt = System.nanoTime();
            termination.completeExceptionally(new WorldsConnectionException("detectionActivity", "dropped", null));
        }

        void end() {
            terminatedAt = System.nanoTime();
            termination.complete(null);
        }

        @Override
        public CompletableFuture<Void> termination() {
            return termination;
        }

        @Override
        public synchronized void cancel() {
            termination.complete(null);
            if (!closed) {
                closed = true;
                open.decrementAndGet();
            }
        }
    }

    @BeforeEach
    void setUp() {
        queue = new IngestionQueue<>("test", 100, metrics);
    }

    @AfterEach
    void tearDown() {
        if (supervisor != null) {
            supervisor.stop(Duration.ofSeconds(2));
        }
    }

    private void fakeSubscriptions() {
        when(gateway.subscribe(eq("detectionActivity"), anyMap(), any())).thenAnswer(inv -> {
            subscribeTimes.add(System.nanoTime());
            int now = open.incrementAndGet();
            maxOpen.accumulateAndGet(now, Math::max);
            FakeHandle handle = new FakeHandle(inv.getArgument(2));
            handles.add(handle);
            return handle;
        });
    }

    private SubscriptionSupervisor supervisor(Duration backoff, Set<String> priorityTags) {
        PriorityAlertEmitter alerts = new PriorityAlertEmitter(store, metrics, priorityTags, "producer",
            Clock.systemUTC());
        supervisor = new SubscriptionSupervisor(gateway, queue, alerts, metrics, backoff);
        return supervisor;
    }

    private static void awaitCondition(BooleanSupplier condition, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("Condition not met within " + timeout.toMillis() + "ms");
            }
            Thread.sleep(5);
        }
    }

    @Test
    void errorMidStreamReconnectsOnceAfterBackoff() throws InterruptedException {
        fakeSubscriptions();
        Duration backoff = Duration.ofMillis(300);
        supervisor(backoff, Set.of()).start();

        awaitCondition(() -> handles.size() == 1, Duration.ofSeconds(2));
        awaitCondition(() -> supervisor.state() == SubscriptionSupervisor.State.STREAMING, Duration.ofSeconds(2));
        handles.get(0).onEvent.accept(activity(null, "car", "ds-1", "Gate"));
        handles.get(0).fail();

        awaitCondition(() -> handles.size() == 2, Duration.ofSeconds(3));
        long waitedMs = TimeUnit.NANOSECONDS.toMillis(subscribeTimes.get(1) - handles.get(0).terminatedAt);
        assertTrue(waitedMs >= 280, "Reconnected after " + waitedMs + "ms");

        Thread.sleep(500);
        assertEquals(2, handles.size(), "Exactly one reconnect while the new stream is up");
        assertEquals(1, maxOpen.get(), "Never two subscriptions at once");
        verify(metrics).recordSubscriptionEvent("errored");
        verify(metrics).recordSubscriptionEvent("backoff");
    }

    @Test
    void gracefulEndAlsoReconnects() throws InterruptedException {
        fakeSubscriptions();
        supervisor(Duration.ofMillis(50), Set.of()).start();

        awaitCondition(() -> handles.size() == 1, Duration.ofSeconds(2));
        handles.get(0).end();
        awaitCondition(() -> handles.size() == 2, Duration.ofSeconds(2));
        handles.get(1).end();
        awaitCondition(() -> handles.size() == 3, Duration.ofSeconds(2));

        assertEquals(1, maxOpen.get());
        verify(metrics, atLeast(2)).recordSubscriptionEvent("disconnected");
    }

    @Test
    void failedSubscribeCallIsRetried() throws InterruptedException {
        AtomicInteger attempts = new AtomicInteger();
        when(gateway.subscribe(eq("detectionActivity"), anyMap(), any())).thenAnswer(inv -> {
            if (attempts.incrementAndGet() < 3) {
                throw new IllegalStateException("handshake refused");
            }
            return new FakeHandle(inv.getArgument(2));
        });

        supervisor(Duration.ofMillis(30), Set.of()).start();

        awaitCondition(() -> supervisor.state() == SubscriptionSupervisor.State.STREAMING, Duration.ofSeconds(3));
        assertEquals(3, attempts.get());
    }

    @Test
    void eventsAreQueuedAndPriorityTagsAlerted() throws InterruptedException {
        fakeSubscriptions();
        supervisor(Duration.ofSeconds(10), Set.of("yellow_vest")).start();
        awaitCondition(() -> handles.size() == 1, Duration.ofSeconds(2));

        Consumer<JsonNode> onEvent = handles.get(0).onEvent;
        onEvent.accept(activity("2024-05-01T10:00:00Z", "car", "ds-1", "Gate"));
        onEvent.accept(activity("2024-05-01T10:00:01Z", "yellow_vest", "ds-1", "Gate"));

        assertEquals(2, queue.size());
        DetectionActivityEvent first = queue.poll(Duration.ofMillis(10));
        assertEquals(new DetectionActivityEvent("2024-05-01T10:00:00Z", "car", "ds-1", "Gate"), first);
        verify(store, times(1)).upsertEvent(any(AlertEvent.class));
        assertEquals(2, supervisor.eventsReceived());
    }

    @Test
    void alertIsWrittenEvenWhenQueueIsFull() throws InterruptedException {
        queue = new IngestionQueue<>("tiny", 1, metrics);
        fakeSubscriptions();
        supervisor(Duration.ofSeconds(10), Set.of("yellow_vest")).start();
        awaitCondition(() -> handles.size() == 1, Duration.ofSeconds(2));

        Consumer<JsonNode> onEvent = handles.get(0).onEvent;
        onEvent.accept(activity(null, "car", "ds-1", "Gate"));
        onEvent.accept(activity(null, "yellow_vest", "ds-1", "Gate"));

        assertEquals(1, queue.size());
        assertEquals(1, queue.droppedCount());
        verify(store).upsertEvent(any(AlertEvent.class));
    }

    @Test
    void stopCutsBackoffShort() throws InterruptedException {
        when(gateway.subscribe(eq("detectionActivity"), anyMap(), any()))
            .thenThrow(new IllegalStateException("offline"));
        supervisor(Duration.ofSeconds(30), Set.of()).start();
        awaitCondition(() -> supervisor.state() == SubscriptionSupervisor.State.BACKOFF, Duration.ofSeconds(2));

        long start = System.nanoTime();
        supervisor.stop(Duration.ofSeconds(5));
        long tookMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertTrue(tookMs < 2000, "Stop took " + tookMs + "ms");
        assertEquals(SubscriptionSupervisor.State.STOPPED, supervisor.state());
        verify(gateway, times(1)).subscribe(any(), anyMap(), any());
    }

    @Test
    void stopCancelsLiveSubscription() throws InterruptedException {
        fakeSubscriptions();
        supervisor(Duration.ofSeconds(30), Set.of()).start();
        awaitCondition(() -> supervisor.state() == SubscriptionSupervisor.State.STREAMING, Duration.ofSeconds(2));

        supervisor.stop(Duration.ofSeconds(5));

        assertTrue(handles.get(0).termination.isDone());
        assertEquals(0, open.get());
        assertEquals(SubscriptionSupervisor.State.STOPPED, supervisor.state());
        assertEquals(1, handles.size(), "No reconnect after stop");
    }

    @Test
    void subscribesWithEmptyFilter() throws InterruptedException {
        fakeSubscriptions();
        supervisor(Duration.ofSeconds(10), Set.of()).start();
        awaitCondition(() -> handles.size() == 1, Duration.ofSeconds(2));

        verify(gateway).subscribe(eq("detectionActivity"), eq(Map.of("filter", Map.of())), any());
    }

    @Test
    void backoffMustBePositive() {
        PriorityAlertEmitter alerts = new PriorityAlertEmitter(store, metrics, Set.of(), "producer",
            Clock.systemUTC());

        assertThrows(IllegalArgumentException.class,
            () -> new SubscriptionSupervisor(gateway, queue, alerts, metrics, Duration.ZERO));
        assertThrows(IllegalArgumentException.class,
            () -> new SubscriptionSupervisor(gateway, queue, alerts, metrics, Duration.ofSeconds(-1)));
    }
}
