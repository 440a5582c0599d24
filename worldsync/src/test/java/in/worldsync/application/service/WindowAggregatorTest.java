package in.worldsync.application.service;

import in.worldsync.application.port.output.WorldsGateway;
import in.worldsync.domain.model.TagCount;
import in.worldsync.domain.model.TraversalOutcome;
import in.worldsync.domain.model.WindowSummary;
import in.worldsync.infrastructure.metrics.IngestMetrics;
import in.worldsync.infrastructure.worlds.WorldsConnectionException;
import in.worldsync.infrastructure.worlds.WorldsProtocolException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static in.worldsync.application.service.PageFixtures.track;
import static in.worldsync.application.service.PageFixtures.tracks;
import static in.worldsync.application.service.PageFixtures.withDetection;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class WindowAggregatorTest {

    private static final Instant END = Instant.parse("2024-05-01T11:00:00.987Z");
    private static final Instant START = Instant.parse("2024-05-01T10:00:00.987Z");

    @Mock
    private WorldsGateway gateway;
    @Mock
    private IngestMetrics metrics;
    @Captor
    private ArgumentCaptor<Map<String, Object>> variablesCaptor;

    private WindowAggregator aggregator;

    @BeforeEach
    void setUp() {
        aggregator = new WindowAggregator(gateway, metrics, 50, 100);
    }

    @Test
    void aggregatesAcrossPages() {
        when(gateway.query(eq("tracks"), anyMap())).thenReturn(
            tracks(true, "c1",
                withDetection(track("t1", "car", 10.0), 0.9, "gate"),
                withDetection(track("t2", "car", 25.0), 0.7, "lot", "gate")),
            tracks(false, null,
                withDetection(track("t3", "person", 5.0), null, "entrance")));

        WindowSummary summary = aggregator.aggregate("dev-1", START, END, 2);

        assertEquals(List.of(new TagCount("car", 2), new TagCount("person", 1)), summary.tagCounts());
        assertEquals(List.of("t2", "t1"), summary.topTracks().stream().map(t -> t.id()).toList());
        assertEquals(List.of("entrance", "gate", "lot"), summary.zones());
        assertEquals(TraversalOutcome.EXHAUSTED, summary.outcome());
        assertEquals(2, summary.pagesFetched());
        assertEquals(Instant.parse("2024-05-01T11:00:00Z"), summary.timestamp(), "Truncated to seconds");
        assertNull(summary.failureMessage());
        verify(metrics).recordTracksAggregated(3);
    }

    @Test
    @SuppressWarnings("unchecked")
    void requestsTheDeviceWindow() {
        when(gateway.query(eq("tracks"), anyMap())).thenReturn(tracks(false, null));

        aggregator.aggregate("dev-9", START, END, 5);

        verify(gateway).query(eq("tracks"), variablesCaptor.capture());
        Map<String, Object> filter = (Map<String, Object>) variablesCaptor.getValue().get("filter");
        assertEquals(Map.of("eq", "dev-9"), filter.get("dataSourceId"));
        assertEquals(Map.of("between", List.of("2024-05-01T10:00:00.987Z", "2024-05-01T11:00:00.987Z")),
            filter.get("time"));
        assertEquals(50, variablesCaptor.getValue().get("first"));
    }

    @Test
    void emptyWindowYieldsEmptySummary() {
        when(gateway.query(eq("tracks"), anyMap())).thenReturn(tracks(false, null));

        WindowSummary summary = aggregator.aggregate("dev-1", START, END, 5);

        assertTrue(summary.tagCounts().isEmpty());
        assertTrue(summary.topTracks().isEmpty());
        assertTrue(summary.zones().isEmpty());
        assertTrue(summary.complete());
    }

    @Test
    void failureMidWayKeepsPartialResults() {
        when(gateway.query(eq("tracks"), anyMap()))
            .thenReturn(tracks(true, "c1", withDetection(track("t1", "car", 10.0), 0.5, "gate")))
            .thenThrow(new WorldsConnectionException("tracks", "Request failed: reset", new IOException("reset")));

        WindowSummary summary = aggregator.aggregate("dev-1", START, END, 5);

        assertEquals(TraversalOutcome.FETCH_FAILED, summary.outcome());
        assertFalse(summary.complete());
        assertEquals(List.of(new TagCount("car", 1)), summary.tagCounts());
        assertEquals(1, summary.topTracks().size());
        assertEquals(List.of("gate"), summary.zones());
        assertEquals(1, summary.pagesFetched());
        assertNotNull(summary.failureMessage());
        verify(metrics).recordFetchFailure("tracks", "transport");
    }

    @Test
    void failureOnFirstPageYieldsEmptyPartialSummary() {
        when(gateway.query(eq("tracks"), anyMap()))
            .thenThrow(new WorldsProtocolException("tracks", "GraphQL errors: [boom]"));

        WindowSummary summary = aggregator.aggregate("dev-1", START, END, 5);

        assertEquals(TraversalOutcome.FETCH_FAILED, summary.outcome());
        assertEquals(0, summary.tracksProcessed());
        verify(metrics).recordFetchFailure("tracks", "protocol");
    }

    @Test
    void repeatedCursorStopsWithPartialResults() {
        when(gateway.query(eq("tracks"), anyMap()))
            .thenAnswer(inv -> tracks(true, "same", track("t1", "car", 10.0)));

        WindowSummary summary = aggregator.aggregate("dev-1", START, END, 5);

        assertEquals(TraversalOutcome.CYCLE_DETECTED, summary.outcome());
        assertEquals(2, summary.pagesFetched());
        assertEquals(List.of(new TagCount("car", 2)), summary.tagCounts());
        assertEquals(1, summary.topTracks().size(), "Same id on both pages overwrites");
    }
}
