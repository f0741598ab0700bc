package in.papertick.transport.ws;

import com.fasterxml.jackson.databind.JsonNode;
import in.papertick.domain.account.AccountView;
import in.papertick.domain.account.OrderRecord;
import in.papertick.domain.account.OrderSide;
import in.papertick.domain.account.Position;
import in.papertick.domain.data.CompositeEvent;
import in.papertick.domain.data.Tick;
import in.papertick.domain.signal.IndicatorSnapshot;
import in.papertick.domain.signal.Signal;
import in.papertick.domain.signal.SignalKind;
import in.papertick.service.snapshot.SnapshotStore;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MessageCodecTest {

    private static final Instant TS = Instant.parse("2024-03-01T10:15:30Z");

    private static AccountView accountWithPosition() {
        OrderRecord order = OrderRecord.filled("AAA", OrderSide.BUY, 50, new BigDecimal("100"), TS);
        return new AccountView(new BigDecimal("5000"), new BigDecimal("10250"),
            List.of(new Position("AAA", 50, new BigDecimal("100"))), order, 4);
    }

    @Test
    void testTickMessageCarriesEveryStage() throws Exception {
        CompositeEvent event = new CompositeEvent(
            new Tick("AAA", new BigDecimal("105"), TS),
            new IndicatorSnapshot(new BigDecimal("11.000000"), new BigDecimal("10.666667"), null),
            new Signal("AAA", SignalKind.BUY, "ma_cross_up ma_short=11.000000 ma_long=10.666667", TS),
            accountWithPosition());

        JsonNode msg = MessageCodec.parse(MessageCodec.tickMessage(event));

        assertEquals("tick", msg.get("type").asText());
        assertEquals("2024-03-01T10:15:30Z", msg.get("ts").asText());
        assertEquals("AAA", msg.get("symbol").asText());
        assertEquals(105, msg.get("price").asInt());
        assertEquals(11.0, msg.at("/indicators/ma_short").asDouble(), 1e-9);
        assertEquals(10.666667, msg.at("/indicators/ma_long").asDouble(), 1e-9);
        assertTrue(msg.at("/indicators/rsi").isNull(), "Missing indicator is JSON null");
        assertEquals("BUY", msg.get("signal").asText());
        assertTrue(msg.at("/signal_meta/reason").asText().startsWith("ma_cross_up"));

        JsonNode broker = msg.get("broker");
        assertEquals(5000, broker.get("cash").asInt());
        assertEquals(10250, broker.get("equity").asInt());
        assertEquals("AAA", broker.at("/positions/0/symbol").asText());
        assertEquals(50, broker.at("/positions/0/qty").asLong());
        assertEquals(100, broker.at("/positions/0/avg_price").asInt());
        assertEquals("FILLED", broker.at("/last_order/status").asText());
        assertEquals("BUY", broker.at("/last_order/side").asText());
        assertFalse(broker.at("/last_order/order_id").asText().isEmpty());
    }

    @Test
    void testErrorAndPongMessages() throws Exception {
        JsonNode error = MessageCodec.parse(MessageCodec.errorMessage("BBB", "Empty quote data", TS));
        assertEquals("error", error.get("type").asText());
        assertEquals("BBB", error.get("symbol").asText());
        assertEquals("Empty quote data", error.get("error").asText());
        assertEquals("2024-03-01T10:15:30Z", error.get("ts").asText());

        JsonNode pong = MessageCodec.parse(MessageCodec.pongMessage(TS));
        assertEquals("pong", pong.get("type").asText());
    }

    @Test
    void testSnapshotForSymbolWithoutTicks() throws Exception {
        SnapshotStore store = new SnapshotStore(
            new AccountView(new BigDecimal("10000"), new BigDecimal("10000"), List.of(), null, 0));
        store.register("AAA");

        JsonNode msg = MessageCodec.parse(MessageCodec.snapshotMessage(store.view()));

        assertEquals("snapshot", msg.get("type").asText());
        JsonNode data = msg.get("data");
        assertEquals("AAA", data.at("/symbols/0").asText());
        assertEquals(10000, data.get("cash").asInt());
        assertTrue(data.get("positions").isArray());
        assertEquals(0, data.get("positions").size());
        assertTrue(data.get("last_order").isNull());
        assertTrue(data.at("/last/AAA/tick").isNull());
        assertTrue(data.at("/last/AAA/signal").isNull());
        assertTrue(data.at("/provider_health/last_ok_ts/AAA").isNull());
        assertTrue(data.at("/provider_health/last_error/AAA").isNull());
        assertEquals(0, data.at("/provider_health/tick_count/AAA").asLong());
    }

    @Test
    void testSnapshotPayloadKeepsSubscriptionOrder() {
        SnapshotStore store = new SnapshotStore(
            new AccountView(new BigDecimal("1"), new BigDecimal("1"), List.of(), null, 0));
        store.register("ZZZ");
        store.register("AAA");
        store.register("MMM");

        JsonNode payload = MessageCodec.snapshotPayload(store.view());

        assertEquals("ZZZ", payload.at("/symbols/0").asText());
        assertEquals("AAA", payload.at("/symbols/1").asText());
        assertEquals("MMM", payload.at("/symbols/2").asText());
        assertEquals(List.of("ZZZ", "AAA", "MMM"), iterFieldNames(payload.get("last")));
    }

    private static List<String> iterFieldNames(JsonNode node) {
        List<String> names = new ArrayList<>();
        node.fieldNames().forEachRemaining(names::add);
        return names;
    }

    @Test
    void testKeepaliveDetection() {
        assertTrue(MessageCodec.isKeepalive("ping"));
        assertTrue(MessageCodec.isKeepalive(" HELLO "));
        assertTrue(MessageCodec.isKeepalive("{\"type\":\"ping\"}"));
        assertTrue(MessageCodec.isKeepalive("{\"type\":\"hello\",\"client\":\"dash\"}"));

        assertFalse(MessageCodec.isKeepalive(null));
        assertFalse(MessageCodec.isKeepalive("subscribe"));
        assertFalse(MessageCodec.isKeepalive("{\"type\":\"subscribe\"}"));
        assertFalse(MessageCodec.isKeepalive("{not json"));
    }
}
