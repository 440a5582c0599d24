package in.worldsync.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.undertow.Handlers;
import io.undertow.Undertow;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test for the Prometheus /metrics endpoint.
 *
 * Tests:
 * - Text format by default, OpenMetrics when the scraper asks for it
 * - Ingest metrics exported with their labels
 * - name[] filter
 */
public class MetricsEndpointTest {

    private static final int TEST_PORT = 19191;
    private Undertow server;
    private PrometheusIngestMetrics metrics;
    private HttpClient httpClient;

    @BeforeEach
    public void setUp() {
        // Own registry so tests do not collide on the default one
        CollectorRegistry registry = new CollectorRegistry();
        metrics = new PrometheusIngestMetrics(registry);

        server = Undertow.builder()
            .addHttpListener(TEST_PORT, "localhost")
            .setHandler(
                Handlers.path()
                    .addPrefixPath("/metrics", new PrometheusMetricsHandler(metrics.getRegistry()))
            )
            .build();
        server.start();

        httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(5))
            .build();
    }

    @AfterEach
    public void tearDown() {
        if (server != null) {
            server.stop();
        }
    }

    private HttpResponse<String> scrape() throws Exception {
        return scrape("", "*/*");
    }

    private HttpResponse<String> scrape(String query, String accept) throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create("http://localhost:" + TEST_PORT + "/metrics" + query))
            .header("Accept", accept)
            .GET()
            .build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    public void testMetricsEndpointReturns200() throws Exception {
        HttpResponse<String> response = scrape();

        assertEquals(200, response.statusCode(), "Metrics endpoint should return HTTP 200");
        assertTrue(response.headers().firstValue("Content-Type").orElse("").contains("text/plain"),
            "Content-Type should be text/plain");
        assertTrue(response.body().contains("# HELP"), "Should contain HELP declarations");
        assertTrue(response.body().contains("# TYPE"), "Should contain TYPE declarations");
    }

    @Test
    public void testIngestMetricsAreExported() throws Exception {
        metrics.recordPageFetched("tracks", 50);
        metrics.recordPageFetched("tracks", 20);
        metrics.recordFetchFailure("devices", "transport");
        metrics.recordWindowCycle("COMPLETE", Duration.ofMillis(800));
        metrics.recordQueueDrop("detection_activity");
        metrics.recordBatchFlush("size", 300, Duration.ofMillis(40));
        metrics.recordBatchFlush("idle", 12, Duration.ofMillis(5));
        metrics.recordPersistenceFailure("upsert_zones");
        metrics.recordAlertEmitted("yellow_vest");

        String body = scrape().body();

        assertTrue(body.contains("worldsync_pages_fetched_total{query=\"tracks\",} 2.0"));
        assertTrue(body.contains("worldsync_nodes_fetched_total{query=\"tracks\",} 70.0"));
        assertTrue(body.contains("worldsync_fetch_failures_total{query=\"devices\",type=\"transport\",} 1.0"));
        assertTrue(body.contains("worldsync_window_cycles_total{outcome=\"complete\",} 1.0"),
            "Outcome labels are lower-cased");
        assertTrue(body.contains("worldsync_queue_dropped_total{queue=\"detection_activity\",} 1.0"));
        assertTrue(body.contains("trigger=\"size\""));
        assertTrue(body.contains("trigger=\"idle\""));
        assertTrue(body.contains("worldsync_persistence_failures_total{operation=\"upsert_zones\",} 1.0"));
        assertTrue(body.contains("worldsync_alerts_emitted_total{tag=\"yellow_vest\",} 1.0"));
        assertTrue(body.contains("worldsync_batch_flush_latency_seconds_bucket"), "Should contain histogram buckets");
    }

    @Test
    public void testSubscriptionGaugeFollowsState() throws Exception {
        metrics.recordSubscriptionEvent("connecting");
        metrics.recordSubscriptionEvent("streaming");
        assertTrue(scrape().body().contains("worldsync_subscription_connected 1.0"));

        metrics.recordSubscriptionEvent("errored");
        String body = scrape().body();
        assertTrue(body.contains("worldsync_subscription_connected 0.0"));
        assertTrue(body.contains("worldsync_subscription_events_total{event=\"streaming\",} 1.0"));
    }

    @Test
    public void testNameFilterRestrictsOutput() throws Exception {
        metrics.recordQueueDrop("detection_activity");
        metrics.recordAlertEmitted("yellow_vest");

        String body = scrape("?name%5B%5D=worldsync_queue_dropped_total", "*/*").body();

        assertTrue(body.contains("worldsync_queue_dropped_total{queue=\"detection_activity\",} 1.0"));
        assertFalse(body.contains("worldsync_alerts_emitted_total"), "Unrequested families are left out");
    }

    @Test
    public void testOpenMetricsNegotiated() throws Exception {
        metrics.recordQueueDrop("detection_activity");

        HttpResponse<String> response = scrape("", "application/openmetrics-text; version=1.0.0");

        assertEquals(200, response.statusCode());
        assertTrue(response.headers().firstValue("Content-Type").orElse("").startsWith("application/openmetrics-text"));
        assertTrue(response.body().trim().endsWith("# EOF"), "OpenMetrics output ends with the EOF marker");
    }
}
