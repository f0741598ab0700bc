package in.papertick.transport.ws;

import com.fasterxml.jackson.databind.JsonNode;
import in.papertick.config.HubConfig;
import in.papertick.domain.account.AccountView;
import in.papertick.domain.data.CompositeEvent;
import in.papertick.domain.data.Tick;
import in.papertick.domain.signal.IndicatorSnapshot;
import in.papertick.domain.signal.Signal;
import in.papertick.infrastructure.metrics.PipelineMetrics;
import in.papertick.service.snapshot.SnapshotStore;
import io.prometheus.client.CollectorRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class BroadcastHubTest {

    private static final AccountView START = new AccountView(
        new BigDecimal("10000"), new BigDecimal("10000"), List.of(), null, 0);

    private SnapshotStore store;
    private PipelineMetrics metrics;
    private BroadcastHub hub;

    @BeforeEach
    void setUp() {
        store = new SnapshotStore(START);
        store.register("AAA");
        metrics = new PipelineMetrics(new CollectorRegistry());
        hub = new BroadcastHub(store, new HubConfig(1024, Duration.ofSeconds(30)), metrics);
    }

    @AfterEach
    void tearDown() {
        hub.shutdown();
    }

    private static CompositeEvent event(String symbol, long price, long revision) {
        Instant now = Instant.now();
        AccountView account = new AccountView(new BigDecimal("10000"), new BigDecimal("10000"),
            List.of(), null, revision);
        return new CompositeEvent(
            new Tick(symbol, BigDecimal.valueOf(price), now),
            IndicatorSnapshot.EMPTY,
            Signal.hold(symbol, "warming_up", now),
            account);
    }

    private static JsonNode json(String text) throws Exception {
        return MessageCodec.parse(text);
    }

    @Test
    void testSnapshotIsFirstMessage() throws Exception {
        hub.publish(event("AAA", 7, 1));
        FakeTransport transport = new FakeTransport();

        ClientSession session = hub.connect(transport);

        assertNotNull(session);
        assertTrue(session.isOpen());
        assertEquals(1, hub.getConnectionCount());

        List<String> sent = transport.awaitSent(1, 2000);
        JsonNode first = json(sent.get(0));
        assertEquals("snapshot", first.get("type").asText());
        assertEquals(7, first.at("/data/last/AAA/tick/price").asInt());
        assertEquals(1, first.at("/data/provider_health/tick_count/AAA").asLong());
    }

    @Test
    void testPublishReachesEveryOpenSession() throws Exception {
        FakeTransport a = new FakeTransport();
        FakeTransport b = new FakeTransport();
        hub.connect(a);
        hub.connect(b);

        hub.publish(event("AAA", 11, 1));

        for (FakeTransport t : List.of(a, b)) {
            List<String> sent = t.awaitSent(2, 2000);
            assertEquals(2, sent.size());
            JsonNode tick = json(sent.get(1));
            assertEquals("tick", tick.get("type").asText());
            assertEquals("AAA", tick.get("symbol").asText());
            assertEquals(11, tick.get("price").asInt());
            assertEquals("HOLD", tick.get("signal").asText());
        }
    }

    @Test
    void testSnapshotThenEveryLaterEventExactlyOnceUnderConcurrentPublish() throws Exception {
        int total = 500;
        Thread publisher = new Thread(() -> {
            for (int i = 1; i <= total; i++) {
                hub.publish(event("AAA", i, i));
            }
        });

        List<FakeTransport> clients = new ArrayList<>();
        publisher.start();
        for (int i = 0; i < 8; i++) {
            FakeTransport t = new FakeTransport();
            hub.connect(t);
            clients.add(t);
            Thread.sleep(1);
        }
        publisher.join();

        for (FakeTransport t : clients) {
            JsonNode snapshot = json(t.awaitSent(1, 2000).get(0));
            assertEquals("snapshot", snapshot.get("type").asText());

            JsonNode lastTick = snapshot.at("/data/last/AAA/tick");
            int expected = lastTick.isNull() ? 1 : lastTick.get("price").asInt() + 1;
            int expectedMessages = 1 + (total - expected + 1);

            List<String> sent = t.awaitSent(expectedMessages, 5000);
            assertEquals(expectedMessages, sent.size(), "Each event after the snapshot exactly once");
            for (int i = 1; i < sent.size(); i++) {
                JsonNode msg = json(sent.get(i));
                assertEquals("tick", msg.get("type").asText());
                assertEquals(expected++, msg.get("price").asInt(), "Events must arrive in publish order");
            }
        }
    }

    @Test
    void testSlowConsumerDoesNotStallOthers() throws Exception {
        CountDownLatch gate = new CountDownLatch(1);
        FakeTransport slow = FakeTransport.blocking(gate);
        FakeTransport fast = new FakeTransport();
        hub.connect(slow);
        hub.connect(fast);

        for (int i = 1; i <= 10; i++) {
            hub.publish(event("AAA", i, i));
        }

        assertEquals(11, fast.awaitSent(11, 2000).size(), "Fast consumer gets snapshot and every tick");
        assertTrue(slow.sent().isEmpty(), "Slow consumer is still blocked on its first send");

        gate.countDown();
        assertEquals(11, slow.awaitSent(11, 2000).size());
    }

    @Test
    void testFullQueueDropsOldestAndCountsDrops() throws Exception {
        hub.shutdown();
        hub = new BroadcastHub(store, new HubConfig(2, Duration.ofSeconds(30)), metrics);
        CountDownLatch gate = new CountDownLatch(1);
        FakeTransport slow = FakeTransport.blocking(gate);
        ClientSession session = hub.connect(slow);

        for (int i = 1; i <= 5; i++) {
            hub.publish(event("AAA", i, i));
        }

        assertEquals(3, session.getDropped());
        assertEquals(3.0, metrics.droppedMessages(), 0.0);

        gate.countDown();
        List<String> sent = slow.awaitSent(3, 2000);
        assertEquals("snapshot", json(sent.get(0)).get("type").asText());
        assertEquals(4, json(sent.get(1)).get("price").asInt(), "Oldest ticks were dropped");
        assertEquals(5, json(sent.get(2)).get("price").asInt());
    }

    @Test
    void testUnregisteredSymbolIsIgnored() throws Exception {
        FakeTransport t = new FakeTransport();
        hub.connect(t);

        hub.publish(event("ZZZ", 3, 1));
        hub.publish(event("AAA", 4, 2));

        List<String> sent = t.awaitSent(2, 2000);
        assertEquals("AAA", json(sent.get(1)).get("symbol").asText());
        assertFalse(store.contains("ZZZ"));
        assertFalse(hub.pull().states().containsKey("ZZZ"));
    }

    @Test
    void testPublishErrorBroadcastsAndKeepsLastTick() throws Exception {
        FakeTransport t = new FakeTransport();
        hub.publish(event("AAA", 9, 1));
        hub.connect(t);

        hub.publishError("AAA", "HTTP 503 from quote endpoint");

        JsonNode error = json(t.awaitSent(2, 2000).get(1));
        assertEquals("error", error.get("type").asText());
        assertEquals("AAA", error.get("symbol").asText());
        assertEquals("HTTP 503 from quote endpoint", error.get("error").asText());

        SnapshotStore.SymbolState state = hub.pull().states().get("AAA");
        assertEquals("HTTP 503 from quote endpoint", state.lastError());
        assertEquals(0, new BigDecimal("9").compareTo(state.lastTick().price()));
    }

    @Test
    void testPingIsAnsweredWithPong() throws Exception {
        FakeTransport t = new FakeTransport();
        ClientSession session = hub.connect(t);

        hub.onInbound(session, "ping");
        hub.onInbound(session, "{\"type\":\"hello\"}");
        hub.onInbound(session, "something else");

        List<String> sent = t.awaitSent(3, 2000);
        Thread.sleep(50);
        assertEquals(3, t.sent().size(), "Only keepalives get a reply");
        assertEquals("pong", json(sent.get(1)).get("type").asText());
        assertEquals("pong", json(sent.get(2)).get("type").asText());
    }

    @Test
    void testIdleSessionsAreReaped() throws Exception {
        hub.shutdown();
        hub = new BroadcastHub(store, new HubConfig(16, Duration.ofMillis(100)), metrics);
        FakeTransport idle = new FakeTransport();
        FakeTransport active = new FakeTransport();
        hub.connect(idle);
        ClientSession activeSession = hub.connect(active);

        Thread.sleep(150);
        hub.onInbound(activeSession, "ping");

        assertEquals(1, hub.reapIdle());
        assertEquals(CloseCodes.GOING_AWAY, idle.closeCode());
        assertEquals(-1, active.closeCode());
        assertEquals(1, hub.getConnectionCount());
    }

    @Test
    void testReapingStalledConsumerEndsItsSender() throws Exception {
        hub.shutdown();
        hub = new BroadcastHub(store, new HubConfig(16, Duration.ofMillis(100)), metrics);
        FakeTransport stalled = FakeTransport.blocking(new CountDownLatch(1));
        ClientSession session = hub.connect(stalled);

        long deadline = System.currentTimeMillis() + 2000;
        while (!session.isSending() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertTrue(session.isSending(), "Sender is stuck on the snapshot");

        Thread.sleep(150);
        assertEquals(1, hub.reapIdle());
        assertEquals(CloseCodes.GOING_AWAY, stalled.closeCode());

        deadline = System.currentTimeMillis() + 2000;
        while (session.hasLiveSender() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertFalse(session.hasLiveSender(), "Sender task must end once the session is reaped");
        assertFalse(session.isSending());
        assertTrue(stalled.sent().isEmpty());
        assertEquals(ConnectionState.CLOSED, session.getState());
    }

    @Test
    void testReaperRunsAfterStart() throws Exception {
        hub.shutdown();
        hub = new BroadcastHub(store, new HubConfig(16, Duration.ofMillis(100)), metrics);
        hub.start();
        FakeTransport idle = new FakeTransport();
        hub.connect(idle);

        long deadline = System.currentTimeMillis() + 2000;
        while (hub.getConnectionCount() > 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }

        assertEquals(0, hub.getConnectionCount());
        assertEquals(CloseCodes.GOING_AWAY, idle.closeCode());
    }

    @Test
    void testFailedSendDisconnectsSession() throws Exception {
        FakeTransport broken = new FakeTransport();
        broken.failSends();
        ClientSession session = hub.connect(broken);

        long deadline = System.currentTimeMillis() + 2000;
        while (hub.getConnectionCount() > 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }

        assertEquals(0, hub.getConnectionCount());
        assertEquals(CloseCodes.ABNORMAL, broken.closeCode());
        assertEquals(ConnectionState.CLOSED, session.getState());
    }

    @Test
    void testDisconnectIsIdempotent() {
        FakeTransport t = new FakeTransport();
        ClientSession session = hub.connect(t);

        hub.disconnect(session, CloseCodes.NORMAL, "bye");
        hub.disconnect(session, CloseCodes.GOING_AWAY, "again");

        assertEquals(CloseCodes.NORMAL, t.closeCode());
        assertEquals(0, hub.getConnectionCount());
        assertNull(hub.session(session.getId()));
    }

    @Test
    void testShutdownClosesWithRestartCodeAndRefusesNewSessions() {
        FakeTransport a = new FakeTransport();
        FakeTransport b = new FakeTransport();
        hub.connect(a);
        hub.connect(b);

        hub.shutdown();

        assertEquals(CloseCodes.SERVICE_RESTART, a.closeCode());
        assertEquals(CloseCodes.SERVICE_RESTART, b.closeCode());
        assertEquals(0, hub.getConnectionCount());

        FakeTransport late = new FakeTransport();
        assertNull(hub.connect(late));
        assertEquals(CloseCodes.SERVICE_RESTART, late.closeCode());
    }

    @Test
    void testPullReturnsLatestAccount() {
        hub.publish(event("AAA", 5, 3));
        hub.publish(event("AAA", 6, 2));

        SnapshotStore.Snapshot snapshot = hub.pull();

        assertEquals(3, snapshot.account().revision(), "Stale account view must not replace a newer one");
        assertEquals(0, new BigDecimal("6").compareTo(snapshot.states().get("AAA").lastTick().price()));
        assertEquals(List.of("AAA"), snapshot.symbols());
    }
}
