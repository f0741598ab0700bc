package in.papertick.transport.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.papertick.config.BrokerConfig;
import in.papertick.config.HubConfig;
import in.papertick.config.ProviderConfig;
import in.papertick.config.SessionConfig;
import in.papertick.config.StrategyConfig;
import in.papertick.domain.data.ProviderEvent;
import in.papertick.infrastructure.metrics.PipelineMetrics;
import in.papertick.infrastructure.provider.MarketDataProvider;
import in.papertick.service.pipeline.TradingSession;
import io.prometheus.client.CollectorRegistry;
import io.undertow.Handlers;
import io.undertow.Undertow;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
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
 * Pull endpoints against a session whose provider always fails, so the state is deterministic.
 */
class ApiHandlersTest {

    private static final int TEST_PORT = 19281;
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private TradingSession session;
    private Undertow server;
    private HttpClient httpClient;

    @BeforeEach
    void setUp() {
        MarketDataProvider failing = new MarketDataProvider() {
            @Override
            public String name() {
                return "failing";
            }

            @Override
            public ProviderEvent nextTick(String symbol) {
                return ProviderEvent.ofError(symbol, "Empty quote data");
            }
        };
        SessionConfig cfg = new SessionConfig(List.of("AAA", "BBB"), Duration.ofMillis(20),
            ProviderConfig.simulated(ProviderConfig.Simulated.defaults()),
            StrategyConfig.maCrossover(2, 4),
            new BrokerConfig(new BigDecimal("10000"), BrokerConfig.SizingType.CASH_FRACTION,
                new BigDecimal("0.5"), 0, 1, false),
            HubConfig.defaults());
        session = new TradingSession(cfg, failing, new PipelineMetrics(new CollectorRegistry()));

        ApiHandlers api = new ApiHandlers(session);
        server = Undertow.builder()
            .addHttpListener(TEST_PORT, "localhost")
            .setHandler(Handlers.routing()
                .get("/api/snapshot", api::snapshot)
                .get("/api/health", api::health)
                .get("/api/ws_clients", api::wsClients))
            .build();
        server.start();

        httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(5))
            .build();
    }

    @AfterEach
    void tearDown() {
        session.close();
        if (server != null) {
            server.stop();
        }
    }

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create("http://localhost:" + TEST_PORT + path))
            .GET()
            .build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    void testHealthIsUnavailableBeforeStart() throws Exception {
        HttpResponse<String> response = get("/api/health");

        assertEquals(503, response.statusCode());
        JsonNode body = MAPPER.readTree(response.body());
        assertFalse(body.get("running").asBoolean());
        assertFalse(body.has("halted"));
    }

    @Test
    void testHealthReportsProviderErrors() throws Exception {
        session.start();
        long deadline = System.currentTimeMillis() + 3000;
        while (session.store().state("BBB").lastError() == null && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }

        HttpResponse<String> response = get("/api/health");

        assertEquals(200, response.statusCode());
        assertTrue(response.headers().firstValue("Content-Type").orElse("").contains("application/json"));
        JsonNode body = MAPPER.readTree(response.body());
        assertTrue(body.get("running").asBoolean());
        assertEquals("AAA", body.at("/symbols/0").asText());
        assertEquals("Empty quote data", body.at("/last_error/BBB").asText());
        assertTrue(body.at("/last_ok_ts/AAA").isNull());
        assertEquals(0, body.at("/tick_count/AAA").asLong());
        assertEquals(0, body.get("clients").asInt());
    }

    @Test
    void testSnapshotPayload() throws Exception {
        session.start();

        HttpResponse<String> response = get("/api/snapshot");

        assertEquals(200, response.statusCode());
        JsonNode body = MAPPER.readTree(response.body());
        assertEquals(2, body.get("symbols").size());
        assertEquals(10000, body.get("cash").asInt());
        assertEquals(10000, body.get("equity").asInt());
        assertEquals(0, body.get("positions").size());
        assertTrue(body.get("last_order").isNull());
        assertTrue(body.at("/last/AAA").has("tick"));
        assertTrue(body.at("/provider_health/tick_count").has("BBB"));
    }

    @Test
    void testWsClients() throws Exception {
        HttpResponse<String> response = get("/api/ws_clients");

        assertEquals(200, response.statusCode());
        assertEquals(0, MAPPER.readTree(response.body()).get("clients").asInt());
    }
}
