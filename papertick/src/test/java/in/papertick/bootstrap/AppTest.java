package in.papertick.bootstrap;

import in.papertick.config.BrokerConfig;
import in.papertick.config.ProviderConfig;
import in.papertick.config.SessionConfig;
import in.papertick.config.StrategyConfig;
import in.papertick.infrastructure.metrics.PipelineMetrics;
import in.papertick.service.pipeline.TradingSession;
import io.prometheus.client.CollectorRegistry;
import io.undertow.Undertow;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Environment-driven configuration (read through system properties here) and the HTTP routing table.
 */
class AppTest {

    private static final int TEST_PORT = 19271;
    private static final List<String> KEYS = List.of("SYMBOLS", "INTERVAL_MS", "PROVIDER", "HTTP_BASE_URL",
        "HTTP_TIMEOUT_MS", "HTTP_MAX_RETRIES", "HTTP_API_KEY", "STRATEGY", "RSI_PERIOD", "SIZING", "ORDER_QTY",
        "LOT_SIZE", "STARTING_CASH", "SIM_SEED", "WS_QUEUE_CAPACITY", "MA_SHORT");

    private Undertow server;
    private TradingSession session;

    @AfterEach
    void tearDown() {
        KEYS.forEach(System::clearProperty);
        if (session != null) {
            session.close();
        }
        if (server != null) {
            server.stop();
        }
    }

    @Test
    void testDefaults() {
        SessionConfig cfg = App.configFromEnv();

        assertEquals(List.of("AAPL"), cfg.symbols());
        assertEquals(Duration.ofSeconds(1), cfg.interval());
        assertEquals(ProviderConfig.ProviderType.SIMULATED, cfg.provider().type());
        assertEquals(StrategyConfig.StrategyType.MA_CROSSOVER, cfg.strategy().type());
        assertEquals(5, cfg.strategy().shortPeriod());
        assertEquals(20, cfg.strategy().longPeriod());
        assertEquals(BrokerConfig.SizingType.CASH_FRACTION, cfg.broker().sizing());
        assertEquals(0, new BigDecimal("100000").compareTo(cfg.broker().startingCash()));
        assertEquals(256, cfg.hub().queueCapacity());
    }

    @Test
    void testOverrides() {
        System.setProperty("SYMBOLS", " 600519, AAPL ,,");
        System.setProperty("INTERVAL_MS", "250");
        System.setProperty("PROVIDER", "polled_http");
        System.setProperty("HTTP_BASE_URL", "http://localhost:9999");
        System.setProperty("HTTP_TIMEOUT_MS", "1500");
        System.setProperty("HTTP_MAX_RETRIES", "4");
        System.setProperty("HTTP_API_KEY", "secret");
        System.setProperty("STRATEGY", "RSI_THRESHOLD");
        System.setProperty("RSI_PERIOD", "7");
        System.setProperty("SIZING", "FIXED_QTY");
        System.setProperty("ORDER_QTY", "10");
        System.setProperty("LOT_SIZE", "100");
        System.setProperty("STARTING_CASH", "5000.50");
        System.setProperty("WS_QUEUE_CAPACITY", "8");

        SessionConfig cfg = App.configFromEnv();

        assertEquals(List.of("600519", "AAPL"), cfg.symbols());
        assertEquals(Duration.ofMillis(250), cfg.interval());
        ProviderConfig.PolledHttp http = cfg.provider().polledHttp();
        assertEquals("http://localhost:9999", http.baseUrl());
        assertEquals(Duration.ofMillis(1500), http.timeout());
        assertEquals(4, http.maxRetries());
        assertEquals("secret", http.apiKey());
        assertEquals(StrategyConfig.StrategyType.RSI_THRESHOLD, cfg.strategy().type());
        assertEquals(7, cfg.strategy().rsiPeriod());
        assertEquals(BrokerConfig.SizingType.FIXED_QTY, cfg.broker().sizing());
        assertEquals(10, cfg.broker().fixedQty());
        assertEquals(100, cfg.broker().lotSize());
        assertEquals(0, new BigDecimal("5000.50").compareTo(cfg.broker().startingCash()));
        assertEquals(8, cfg.hub().queueCapacity());
    }

    @Test
    void testSeedIsParsed() {
        System.setProperty("SIM_SEED", "42");

        assertEquals(42L, App.configFromEnv().provider().simulated().seed());
    }

    @Test
    void testInvalidValuesFailFast() {
        System.setProperty("INTERVAL_MS", "soon");
        assertThrows(IllegalArgumentException.class, App::configFromEnv);

        System.clearProperty("INTERVAL_MS");
        System.setProperty("STRATEGY", "MOMENTUM");
        assertThrows(IllegalArgumentException.class, App::configFromEnv);

        System.clearProperty("STRATEGY");
        System.setProperty("MA_SHORT", "30");
        assertThrows(IllegalArgumentException.class, App::configFromEnv, "Short period above long period");
    }

    @Test
    void testRoutes() throws Exception {
        System.setProperty("SYMBOLS", "AAA");
        PipelineMetrics metrics = new PipelineMetrics(new CollectorRegistry());
        session = TradingSession.create(App.configFromEnv(), metrics);
        server = App.buildServer(TEST_PORT, session, metrics);
        server.start();
        session.start();
        HttpClient client = HttpClient.newHttpClient();

        HttpResponse<String> snapshot = client.send(request("/api/snapshot", "GET"), HttpResponse.BodyHandlers.ofString());
        assertEquals(200, snapshot.statusCode());
        assertEquals("*", snapshot.headers().firstValue("Access-Control-Allow-Origin").orElse(""));

        assertEquals(200, client.send(request("/api/health", "GET"), HttpResponse.BodyHandlers.ofString()).statusCode());
        assertEquals(200, client.send(request("/metrics", "GET"), HttpResponse.BodyHandlers.ofString()).statusCode());

        HttpResponse<String> unknown = client.send(request("/nope", "GET"), HttpResponse.BodyHandlers.ofString());
        assertEquals(404, unknown.statusCode());
        assertTrue(unknown.body().contains("/api/snapshot"));

        HttpResponse<String> preflight = client.send(request("/api/snapshot", "OPTIONS"), HttpResponse.BodyHandlers.ofString());
        assertEquals(200, preflight.statusCode());
        assertTrue(preflight.headers().firstValue("Access-Control-Allow-Methods").orElse("").contains("GET"));
    }

    private static HttpRequest request(String path, String method) {
        return HttpRequest.newBuilder()
            .uri(URI.create("http://localhost:" + TEST_PORT + path))
            .method(method, HttpRequest.BodyPublishers.noBody())
            .build();
    }
}
