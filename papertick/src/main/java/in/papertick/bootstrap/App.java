package in.papertick.bootstrap;

import in.papertick.config.BrokerConfig;
import in.papertick.config.HubConfig;
import in.papertick.config.ProviderConfig;
import in.papertick.config.SessionConfig;
import in.papertick.config.StrategyConfig;
import in.papertick.infrastructure.metrics.PipelineMetrics;
import in.papertick.infrastructure.metrics.PrometheusMetricsHandler;
import in.papertick.service.pipeline.TradingSession;
import in.papertick.transport.http.ApiHandlers;
import in.papertick.util.Env;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.RoutingHandler;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * PaperTick bootstrap.
 *
 * Reads configuration from the environment, starts one trading session and serves:
 * - GET /ws            live channel
 * - GET /api/snapshot  pull fallback
 * - GET /api/health
 * - GET /api/ws_clients
 * - GET /metrics       Prometheus
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        log.info("=== PaperTick starting ===");

        int port = Env.getInt("PORT", 8080);
        SessionConfig cfg = configFromEnv();

        PipelineMetrics metrics = new PipelineMetrics();
        TradingSession session = TradingSession.create(cfg, metrics);
        Undertow server = buildServer(port, session, metrics);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown requested");
            session.close();
            server.stop();
        }, "shutdown"));

        session.start();
        server.start();
        log.info("PaperTick started on http://localhost:{}/ (ws://localhost:{}/ws)", port, port);
    }

    static Undertow buildServer(int port, TradingSession session, PipelineMetrics metrics) {
        ApiHandlers api = new ApiHandlers(session);
        PrometheusMetricsHandler metricsHandler = new PrometheusMetricsHandler(metrics.getRegistry());

        RoutingHandler routes = Handlers.routing()
            .get("/ws", session.hub().websocketHandler())
            .get("/api/snapshot", api::snapshot)
            .get("/api/health", api::health)
            .get("/api/ws_clients", api::wsClients)
            .get("/metrics", metricsHandler)
            .setFallbackHandler(exchange -> {
                exchange.setStatusCode(404);
                exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=utf-8");
                exchange.getResponseSender().send(
                    "PaperTick\n\n" +
                    "API: GET /api/snapshot, /api/health, /api/ws_clients, /metrics\n" +
                    "WS:  /ws\n"
                );
            });

        HttpHandler corsHandler = exchange -> {
            exchange.getResponseHeaders()
                .put(io.undertow.util.HttpString.tryFromString("Access-Control-Allow-Origin"), "*")
                .put(io.undertow.util.HttpString.tryFromString("Access-Control-Allow-Methods"), "GET, OPTIONS");
            if (exchange.getRequestMethod().toString().equals("OPTIONS")) {
                exchange.setStatusCode(200);
                exchange.endExchange();
            } else {
                routes.handleRequest(exchange);
            }
        };

        return Undertow.builder()
            .addHttpListener(port, "0.0.0.0")
            .setHandler(corsHandler)
            .build();
    }

    static SessionConfig configFromEnv() {
        ProviderConfig provider = switch (Env.getEnum("PROVIDER", ProviderConfig.ProviderType.class,
                ProviderConfig.ProviderType.SIMULATED)) {
            case SIMULATED -> {
                String seed = Env.get("SIM_SEED", null);
                yield ProviderConfig.simulated(new ProviderConfig.Simulated(
                    Env.getDecimal("SIM_START_PRICE", "100.00"),
                    Env.getDouble("SIM_DRIFT", 0.0),
                    Env.getDouble("SIM_VOLATILITY", 0.01),
                    seed == null ? null : Long.valueOf(seed.trim())));
            }
            case POLLED_HTTP -> {
                ProviderConfig.PolledHttp d = ProviderConfig.PolledHttp.defaults(
                    Env.get("HTTP_BASE_URL", "https://push2.eastmoney.com"));
                yield ProviderConfig.polledHttp(new ProviderConfig.PolledHttp(
                    d.baseUrl(),
                    Duration.ofMillis(Env.getLong("HTTP_TIMEOUT_MS", d.timeout().toMillis())),
                    Duration.ofMillis(Env.getLong("HTTP_MIN_SPACING_MS", d.minSpacing().toMillis())),
                    Env.getInt("HTTP_MAX_RETRIES", d.maxRetries()),
                    d.retryInitialDelay(),
                    d.retryMaxDelay(),
                    Env.get("HTTP_API_KEY", null)));
            }
        };

        StrategyConfig strategy = new StrategyConfig(
            Env.getEnum("STRATEGY", StrategyConfig.StrategyType.class, StrategyConfig.StrategyType.MA_CROSSOVER),
            Env.getInt("MA_SHORT", 5),
            Env.getInt("MA_LONG", 20),
            Env.getInt("RSI_PERIOD", 14),
            Env.getDouble("RSI_OVERSOLD", 30.0),
            Env.getDouble("RSI_OVERBOUGHT", 70.0));

        BrokerConfig broker = new BrokerConfig(
            Env.getDecimal("STARTING_CASH", "100000"),
            Env.getEnum("SIZING", BrokerConfig.SizingType.class, BrokerConfig.SizingType.CASH_FRACTION),
            Env.getDecimal("CASH_FRACTION", "0.5"),
            Env.getLong("ORDER_QTY", 0),
            Env.getLong("LOT_SIZE", 1),
            Env.getBool("ALLOW_AVERAGING", false));

        HubConfig hub = new HubConfig(
            Env.getInt("WS_QUEUE_CAPACITY", 256),
            Duration.ofMillis(Env.getLong("WS_KEEPALIVE_TIMEOUT_MS", 60_000)));

        return new SessionConfig(
            Env.getList("SYMBOLS", "AAPL"),
            Duration.ofMillis(Env.getLong("INTERVAL_MS", 1000)),
            provider, strategy, broker, hub);
    }

    private App() {}
}
