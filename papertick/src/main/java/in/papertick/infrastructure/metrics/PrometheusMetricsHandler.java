package in.papertick.infrastructure.metrics;

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
import java.util.HashSet;
import java.util.Set;

/**
 * {@code GET /metrics}. Honours the scraper's Accept header (text 0.0.4 or OpenMetrics)
 * and {@code ?name[]=} filters, like the Prometheus client's own HTTP exporter.
 */
public class PrometheusMetricsHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsHandler.class);

    private final CollectorRegistry registry;

    public PrometheusMetricsHandler(CollectorRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        String contentType = TextFormat.chooseContentType(exchange.getRequestHeaders().getFirst(Headers.ACCEPT));
        Set<String> names = requestedNames(exchange);

        StringWriter body = new StringWriter();
        try {
            TextFormat.writeFormat(contentType, body,
                names.isEmpty() ? registry.metricFamilySamples() : registry.filteredMetricFamilySamples(names));
        } catch (IOException e) {
            log.error("[METRICS] Export failed: {}", e.getMessage(), e);
            exchange.setStatusCode(500);
            exchange.getResponseSender().send("metrics export failed");
            return;
        }

        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, contentType);
        exchange.setStatusCode(200);
        exchange.getResponseSender().send(body.toString());
        log.debug("[METRICS] Scrape served ({} filter names, {} chars)", names.size(), body.getBuffer().length());
    }

    private static Set<String> requestedNames(HttpServerExchange exchange) {
        Set<String> names = new HashSet<>();
        Deque<String> values = exchange.getQueryParameters().get("name[]");
        if (values != null) {
            names.addAll(values);
        }
        return names;
    }
}
