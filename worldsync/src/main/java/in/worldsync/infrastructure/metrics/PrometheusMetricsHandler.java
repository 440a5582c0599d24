package in.worldsync.infrastructure.metrics;

import io.prometheus.client.Collector.MetricFamilySamples;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Deque;
import java.util.Enumeration;
import java.util.HashSet;
import java.util.Set;

/**
 * GET /metrics for Prometheus scrapes.
 *
 * The exposition format follows the Accept header (OpenMetrics when asked for,
 * text 0.0.4 otherwise). Repeated {@code name[]} query parameters restrict the
 * output to those sample names.
 *
 * <pre>
 * curl 'localhost:9090/metrics?name[]=worldsync_batches_flushed_total'
 * # HELP worldsync_batches_flushed_total Total number of batch flushes
 * # TYPE worldsync_batches_flushed_total counter
 * worldsync_batches_flushed_total{trigger="size",} 12.0
 * worldsync_batches_flushed_total{trigger="idle",} 3.0
 * </pre>
 */
public class PrometheusMetricsHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsHandler.class);

    static final String NAME_PARAM = "name[]";

    private final CollectorRegistry registry;

    public PrometheusMetricsHandler(CollectorRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) throws Exception {
        String contentType = TextFormat.chooseContentType(
            exchange.getRequestHeaders().getFirst(Headers.ACCEPT));
        Set<String> names = requestedNames(exchange);

        Enumeration<MetricFamilySamples> samples = names.isEmpty()
            ? registry.metricFamilySamples()
            : registry.filteredMetricFamilySamples(names);

        StringWriter body = new StringWriter();
        try {
            TextFormat.writeFormat(contentType, body, samples);
        } catch (IOException e) {
            log.error("[METRICS] Scrape failed: {}", e.getMessage(), e);
            exchange.setStatusCode(500);
            exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=utf-8");
            exchange.getResponseSender().send("Scrape failed: " + e.getMessage());
            return;
        }

        exchange.setStatusCode(200);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, contentType);
        exchange.getResponseSender().send(body.toString());
        log.debug("[METRICS] Scrape served: {} chars, {} name filter(s)", body.getBuffer().length(), names.size());
    }

    private static Set<String> requestedNames(HttpServerExchange exchange) {
        Deque<String> values = exchange.getQueryParameters().get(NAME_PARAM);
        Set<String> names = new HashSet<>();
        if (values != null) {
            for (String value : values) {
                if (!value.isBlank()) {
                    names.add(value.trim());
                }
            }
        }
        return names;
    }
}
