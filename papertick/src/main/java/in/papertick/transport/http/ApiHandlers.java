package in.papertick.transport.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.papertick.service.pipeline.TradingSession;
import in.papertick.service.snapshot.SnapshotStore;
import in.papertick.transport.ws.MessageCodec;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

/**
 * Read-only HTTP endpoints over the running session.
 */
public final class ApiHandlers {
    private static final Logger log = LoggerFactory.getLogger(ApiHandlers.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final String JSON_CONTENT_TYPE = "application/json; charset=utf-8";

    private final TradingSession session;

    public ApiHandlers(TradingSession session) {
        this.session = session;
    }

    /**
     * GET /api/snapshot - pull fallback for consumers without a live connection.
     */
    public void snapshot(HttpServerExchange exchange) {
        respond(exchange, 200, MessageCodec.snapshotPayload(session.hub().pull()));
    }

    /**
     * GET /api/health
     */
    public void health(HttpServerExchange exchange) {
        SnapshotStore.Snapshot snap = session.hub().pull();

        ObjectNode health = MAPPER.createObjectNode();
        health.put("ts", Instant.now().toString());
        health.put("running", session.isRunning());
        ArrayNode symbols = health.putArray("symbols");
        snap.symbols().forEach(symbols::add);
        health.put("clients", session.hub().getConnectionCount());

        ObjectNode lastOk = health.putObject("last_ok_ts");
        ObjectNode lastErr = health.putObject("last_error");
        ObjectNode counts = health.putObject("tick_count");
        snap.states().forEach((symbol, st) -> {
            if (st.lastOkTs() == null) {
                lastOk.putNull(symbol);
            } else {
                lastOk.put(symbol, st.lastOkTs().toString());
            }
            if (st.lastError() == null) {
                lastErr.putNull(symbol);
            } else {
                lastErr.put(symbol, st.lastError());
            }
            counts.put(symbol, st.tickCount());
        });

        Throwable halt = session.haltCause();
        if (halt != null) {
            health.put("halted", halt.toString());
        }
        respond(exchange, session.isRunning() ? 200 : 503, health);
    }

    /**
     * GET /api/ws_clients
     */
    public void wsClients(HttpServerExchange exchange) {
        ObjectNode o = MAPPER.createObjectNode();
        o.put("clients", session.hub().getConnectionCount());
        respond(exchange, 200, o);
    }

    private void respond(HttpServerExchange exchange, int status, ObjectNode body) {
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, JSON_CONTENT_TYPE);
        try {
            exchange.setStatusCode(status);
            exchange.getResponseSender().send(MAPPER.writeValueAsString(body));
        } catch (Exception e) {
            log.error("Failed to write response for {}: {}", exchange.getRequestPath(), e.getMessage(), e);
            exchange.setStatusCode(500);
            exchange.getResponseSender().send("{\"error\":\"internal error\"}");
        }
    }
}
