package in.worldsync.application.service;

import in.worldsync.application.port.output.ActivityStore;
import in.worldsync.domain.model.Device;
import in.worldsync.domain.model.TagCount;
import in.worldsync.domain.model.TrackSummary;
import in.worldsync.domain.model.TraversalOutcome;
import in.worldsync.domain.model.WindowSummary;
import in.worldsync.infrastructure.metrics.IngestMetrics;
import in.worldsync.infrastructure.persistence.PersistenceException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class WindowAggregationServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T11:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    @Mock
    private DeviceCatalogService deviceCatalog;
    @Mock
    private WindowAggregator aggregator;
    @Mock
    private ActivityStore store;
    @Mock
    private IngestMetrics metrics;

    private WindowAggregationService service;

    @AfterEach
    void tearDown() {
        if (service != null) {
            service.stop(Duration.ofSeconds(2));
        }
    }

    private WindowAggregationService service(List<String> configuredIds) {
        service = new WindowAggregationService(deviceCatalog, aggregator, store, metrics, CLOCK,
            configuredIds, Duration.ofMinutes(60), 5);
        return service;
    }

    private static WindowSummary summary(String deviceId, TraversalOutcome outcome) {
        TrackSummary top = new TrackSummary("t1", deviceId, NOW, 12.0, 3, "car", null, 0.5, List.of("gate"));
        return new WindowSummary(deviceId, NOW.minusSeconds(3600), NOW, NOW,
            List.of(new TagCount("car", 1)), List.of(top), List.of("gate"), 1, 1, outcome, null);
    }

    @Test
    void aggregatesDiscoveredDataSourcesOverTheTrailingWindow() {
        when(deviceCatalog.refresh()).thenReturn(List.of(
            new Device("d1", "Cam 1", "earthcam/1", "ds-1", "Source 1"),
            new Device("d2", "Cam 2", "earthcam/2", null, null)));
        when(aggregator.aggregate(anyString(), any(), any(), anyInt()))
            .thenAnswer(inv -> summary(inv.getArgument(0), TraversalOutcome.EXHAUSTED));

        List<WindowSummary> result = service(List.of()).runCycle();

        assertEquals(2, result.size());
        verify(aggregator).aggregate("ds-1", NOW.minus(Duration.ofMinutes(60)), NOW, 5);
        verify(aggregator).aggregate("d2", NOW.minus(Duration.ofMinutes(60)), NOW, 5);
        verify(store).upsertWindowTags(result.get(0));
        verify(store).replaceTopTracks("ds-1", result.get(0).topTracks());
        verify(store).upsertZones("ds-1", List.of("gate"), NOW);
        verify(metrics, times(2)).recordWindowCycle(eq("EXHAUSTED"), any());
    }

    @Test
    void configuredDevicesTakePrecedence() {
        when(deviceCatalog.refresh()).thenReturn(List.of(new Device("d1", "Cam", "a", "ds-1", "S")));
        when(aggregator.aggregate(anyString(), any(), any(), anyInt()))
            .thenAnswer(inv -> summary(inv.getArgument(0), TraversalOutcome.EXHAUSTED));

        service(List.of("fixed-1")).runCycle();

        verify(aggregator).aggregate(eq("fixed-1"), any(), any(), eq(5));
        verify(aggregator, never()).aggregate(eq("ds-1"), any(), any(), anyInt());
    }

    @Test
    void noTargetsSkipsTheCycle() {
        when(deviceCatalog.refresh()).thenReturn(List.of());

        List<WindowSummary> result = service(List.of()).runCycle();

        assertTrue(result.isEmpty());
        verifyNoInteractions(aggregator, store);
        verify(metrics).recordWindowCycle(eq("skipped"), any());
    }

    @Test
    void partialSummaryIsStillPersisted() {
        when(deviceCatalog.refresh()).thenReturn(List.of());
        when(aggregator.aggregate(anyString(), any(), any(), anyInt()))
            .thenReturn(summary("dev-1", TraversalOutcome.FETCH_FAILED));

        service(List.of("dev-1")).runCycle();

        verify(store).upsertWindowTags(any());
        verify(store).replaceTopTracks(eq("dev-1"), any());
        verify(store).upsertZones(eq("dev-1"), any(), any());
        verify(metrics).recordWindowCycle(eq("FETCH_FAILED"), any());
    }

    @Test
    void failedWriteDoesNotStopTheOthers() {
        when(deviceCatalog.refresh()).thenReturn(List.of());
        when(aggregator.aggregate(anyString(), any(), any(), anyInt()))
            .thenAnswer(inv -> summary(inv.getArgument(0), TraversalOutcome.EXHAUSTED));
        doThrow(new PersistenceException("upsert_window_tags", new SQLException("down")))
            .when(store).upsertWindowTags(any());

        service(List.of("a", "b")).runCycle();

        verify(store, times(2)).replaceTopTracks(anyString(), any());
        verify(store, times(2)).upsertZones(anyString(), any(), any());
        verify(metrics, times(2)).recordPersistenceFailure("upsert_window_tags");
    }

    @Test
    void scheduledCycleSurvivesUnexpectedFailure() throws InterruptedException {
        AtomicInteger calls = new AtomicInteger();
        CountDownLatch secondCycle = new CountDownLatch(2);
        when(deviceCatalog.refresh()).thenAnswer(inv -> {
            secondCycle.countDown();
            if (calls.incrementAndGet() == 1) {
                throw new IllegalStateException("unexpected");
            }
            return List.of();
        });

        service(List.of()).start(Duration.ofMillis(50));

        assertTrue(secondCycle.await(5, TimeUnit.SECONDS), "Next cycle runs after a failed one");
    }
}
