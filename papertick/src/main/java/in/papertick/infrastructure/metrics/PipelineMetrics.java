package in.papertick.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;

/**
 * Prometheus metrics for the tick pipeline and broadcast hub.
 *
 * Key Metrics:
 * - papertick_ticks_total{symbol} - ticks fully processed
 * - papertick_provider_errors_total{symbol} - provider error events
 * - papertick_signals_total{symbol, kind} - BUY/SELL signals emitted
 * - papertick_orders_total{side, status} - paper orders filled or rejected
 * - papertick_tick_latency_seconds - provider return to broadcast enqueue
 * - papertick_ws_sessions - open live sessions
 * - papertick_ws_dropped_messages_total - messages evicted from full session queues
 */
public class PipelineMetrics {

    private final CollectorRegistry registry;

    private final Counter ticks;
    private final Counter providerErrors;
    private final Counter signals;
    private final Counter orders;
    private final Histogram tickLatency;
    private final Gauge wsSessions;
    private final Counter wsDropped;

    public PipelineMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PipelineMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.ticks = Counter.build()
            .name("papertick_ticks_total")
            .help("Ticks processed through every pipeline stage")
            .labelNames("symbol")
            .register(registry);

        this.providerErrors = Counter.build()
            .name("papertick_provider_errors_total")
            .help("Provider failures reported as error events")
            .labelNames("symbol")
            .register(registry);

        this.signals = Counter.build()
            .name("papertick_signals_total")
            .help("Actionable signals emitted by the strategy")
            .labelNames("symbol", "kind")
            .register(registry);

        this.orders = Counter.build()
            .name("papertick_orders_total")
            .help("Paper orders by side and outcome")
            .labelNames("side", "status")
            .register(registry);

        this.tickLatency = Histogram.build()
            .name("papertick_tick_latency_seconds")
            .help("Time from tick arrival to broadcast enqueue")
            .buckets(0.0005, 0.001, 0.005, 0.01, 0.05, 0.1, 0.5)
            .register(registry);

        this.wsSessions = Gauge.build()
            .name("papertick_ws_sessions")
            .help("Open live channel sessions")
            .register(registry);

        this.wsDropped = Counter.build()
            .name("papertick_ws_dropped_messages_total")
            .help("Messages dropped from full session queues")
            .register(registry);
    }

    public void recordTick(String symbol, long latencyNanos) {
        ticks.labels(symbol).inc();
        tickLatency.observe(latencyNanos / 1_000_000_000.0);
    }

    public void recordProviderError(String symbol) {
        providerErrors.labels(symbol).inc();
    }

    public void recordSignal(String symbol, String kind) {
        signals.labels(symbol, kind).inc();
    }

    public void recordOrder(String side, String status) {
        orders.labels(side, status).inc();
    }

    public void sessionOpened() {
        wsSessions.inc();
    }

    public void sessionClosed() {
        wsSessions.dec();
    }

    public void recordDropped(long count) {
        if (count > 0) {
            wsDropped.inc(count);
        }
    }

    public double ticksProcessed(String symbol) {
        return ticks.labels(symbol).get();
    }

    public double droppedMessages() {
        return wsDropped.get();
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
