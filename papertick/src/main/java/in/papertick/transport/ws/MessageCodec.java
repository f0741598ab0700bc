package in.papertick.transport.ws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.papertick.domain.account.AccountView;
import in.papertick.domain.account.OrderRecord;
import in.papertick.domain.account.Position;
import in.papertick.domain.data.CompositeEvent;
import in.papertick.domain.data.Tick;
import in.papertick.domain.signal.IndicatorSnapshot;
import in.papertick.domain.signal.Signal;
import in.papertick.service.snapshot.SnapshotStore;

import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

/**
 * JSON encoding of live channel messages and the pull payload.
 * Timestamps are ISO-8601 strings, prices and amounts are JSON numbers.
 */
public final class MessageCodec {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final String TYPE_SNAPSHOT = "snapshot";
    public static final String TYPE_TICK = "tick";
    public static final String TYPE_ERROR = "error";
    public static final String TYPE_PONG = "pong";

    private MessageCodec() {}

    public static String tickMessage(CompositeEvent e) {
        ObjectNode o = MAPPER.createObjectNode();
        o.put("type", TYPE_TICK);
        o.put("ts", e.tick().timestamp().toString());
        o.put("symbol", e.symbol());
        o.put("price", e.tick().price());
        o.set("indicators", indicators(e.indicators()));
        o.put("signal", e.signal().kind().name());
        o.set("signal_meta", signalMeta(e.signal()));
        o.set("broker", account(e.account()));
        return write(o);
    }

    public static String errorMessage(String symbol, String error, Instant ts) {
        ObjectNode o = MAPPER.createObjectNode();
        o.put("type", TYPE_ERROR);
        o.put("ts", ts.toString());
        o.put("symbol", symbol);
        o.put("error", error);
        return write(o);
    }

    public static String pongMessage(Instant ts) {
        ObjectNode o = MAPPER.createObjectNode();
        o.put("type", TYPE_PONG);
        o.put("ts", ts.toString());
        return write(o);
    }

    public static String snapshotMessage(SnapshotStore.Snapshot snapshot) {
        ObjectNode o = MAPPER.createObjectNode();
        o.put("type", TYPE_SNAPSHOT);
        o.set("data", snapshotPayload(snapshot));
        return write(o);
    }

    /**
     * Body of {@code GET /api/snapshot}, also embedded as {@code data} in the snapshot message.
     */
    public static ObjectNode snapshotPayload(SnapshotStore.Snapshot snapshot) {
        ObjectNode o = MAPPER.createObjectNode();
        o.put("ts", snapshot.ts().toString());
        ArrayNode symbols = o.putArray("symbols");
        snapshot.symbols().forEach(symbols::add);

        AccountView acct = snapshot.account();
        o.put("cash", acct.cash());
        o.put("equity", acct.equity());
        o.set("positions", positions(acct));
        o.set("last_order", order(acct.lastOrder()));

        ObjectNode last = o.putObject("last");
        ObjectNode health = o.putObject("provider_health");
        ObjectNode lastOk = health.putObject("last_ok_ts");
        ObjectNode lastErr = health.putObject("last_error");
        ObjectNode counts = health.putObject("tick_count");

        for (Map.Entry<String, SnapshotStore.SymbolState> entry : snapshot.states().entrySet()) {
            String symbol = entry.getKey();
            SnapshotStore.SymbolState st = entry.getValue();

            ObjectNode s = last.putObject(symbol);
            s.set("tick", tick(st.lastTick()));
            s.set("indicators", st.indicators() == null ? MAPPER.nullNode() : indicators(st.indicators()));
            if (st.signal() == null) {
                s.putNull("signal");
                s.putNull("signal_meta");
            } else {
                s.put("signal", st.signal().kind().name());
                s.set("signal_meta", signalMeta(st.signal()));
            }

            putInstant(lastOk, symbol, st.lastOkTs());
            if (st.lastError() == null) {
                lastErr.putNull(symbol);
            } else {
                lastErr.put(symbol, st.lastError());
            }
            counts.put(symbol, st.tickCount());
        }
        return o;
    }

    /**
     * Inbound keepalive frames: plain {@code ping} / {@code hello}, or a JSON object whose type is one of them.
     */
    public static boolean isKeepalive(String text) {
        if (text == null) {
            return false;
        }
        String t = text.trim();
        if (t.equalsIgnoreCase("ping") || t.equalsIgnoreCase("hello")) {
            return true;
        }
        if (!t.startsWith("{")) {
            return false;
        }
        try {
            JsonNode node = MAPPER.readTree(t);
            String type = node.path("type").asText("");
            return type.equalsIgnoreCase("ping") || type.equalsIgnoreCase("hello");
        } catch (JsonProcessingException e) {
            return false;
        }
    }

    public static JsonNode parse(String json) throws JsonProcessingException {
        return MAPPER.readTree(json);
    }

    static ObjectNode indicators(IndicatorSnapshot ind) {
        ObjectNode o = MAPPER.createObjectNode();
        putDecimal(o, "ma_short", ind.maShort());
        putDecimal(o, "ma_long", ind.maLong());
        putDecimal(o, "rsi", ind.rsi());
        return o;
    }

    private static ObjectNode signalMeta(Signal signal) {
        ObjectNode o = MAPPER.createObjectNode();
        o.put("reason", signal.reason());
        return o;
    }

    static ObjectNode account(AccountView acct) {
        ObjectNode o = MAPPER.createObjectNode();
        o.put("cash", acct.cash());
        o.put("equity", acct.equity());
        o.set("positions", positions(acct));
        o.set("last_order", order(acct.lastOrder()));
        return o;
    }

    private static ArrayNode positions(AccountView acct) {
        ArrayNode arr = MAPPER.createArrayNode();
        for (Position p : acct.positions()) {
            ObjectNode po = arr.addObject();
            po.put("symbol", p.symbol());
            po.put("qty", p.qty());
            po.put("avg_price", p.avgPrice());
        }
        return arr;
    }

    private static JsonNode order(OrderRecord order) {
        if (order == null) {
            return MAPPER.nullNode();
        }
        ObjectNode o = MAPPER.createObjectNode();
        o.put("order_id", order.orderId());
        o.put("symbol", order.symbol());
        o.put("side", order.side().name());
        o.put("qty", order.qty());
        o.put("price", order.price());
        o.put("status", order.status().name());
        o.put("reason", order.reason());
        o.put("ts", order.timestamp().toString());
        return o;
    }

    private static JsonNode tick(Tick t) {
        if (t == null) {
            return MAPPER.nullNode();
        }
        ObjectNode o = MAPPER.createObjectNode();
        o.put("symbol", t.symbol());
        o.put("ts", t.timestamp().toString());
        o.put("price", t.price());
        return o;
    }

    private static void putDecimal(ObjectNode o, String key, BigDecimal v) {
        if (v == null) {
            o.putNull(key);
        } else {
            o.put(key, v);
        }
    }

    private static void putInstant(ObjectNode o, String key, Instant v) {
        if (v == null) {
            o.putNull(key);
        } else {
            o.put(key, v.toString());
        }
    }

    private static String write(JsonNode node) {
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
}
