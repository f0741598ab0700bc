package in.papertick.transport.ws;

import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ClientSessionTest {

    @Test
    void testNewSessionIsConnecting() {
        ClientSession session = new ClientSession("s1", new FakeTransport(), 4);

        assertEquals(ConnectionState.CONNECTING, session.getState());
        assertFalse(session.isOpen());
        assertEquals(session.getConnectedAt(), session.getLastSeen());
    }

    @Test
    void testPrimedMessageComesFirst() throws InterruptedException {
        ClientSession session = new ClientSession("s1", new FakeTransport(), 4);
        session.prime("snapshot");
        session.transition(ConnectionState.OPEN);
        session.enqueue("a");
        session.enqueue("b");

        assertEquals("snapshot", session.nextOutbound(10, TimeUnit.MILLISECONDS));
        assertEquals("a", session.nextOutbound(10, TimeUnit.MILLISECONDS));
        assertEquals("b", session.nextOutbound(10, TimeUnit.MILLISECONDS));
        assertNull(session.nextOutbound(10, TimeUnit.MILLISECONDS), "Queue should be empty");
    }

    @Test
    void testPrimeAfterOpenIsRejected() {
        ClientSession session = new ClientSession("s1", new FakeTransport(), 4);
        session.transition(ConnectionState.OPEN);

        assertThrows(IllegalStateException.class, () -> session.prime("late"));
    }

    @Test
    void testFullQueueDropsOldest() throws InterruptedException {
        ClientSession session = new ClientSession("s1", new FakeTransport(), 2);

        assertEquals(0, session.enqueue("1"));
        assertEquals(0, session.enqueue("2"));
        assertEquals(1, session.enqueue("3"));
        assertEquals(1, session.enqueue("4"));

        assertEquals(2, session.queued());
        assertEquals(2, session.getDropped());
        assertEquals("3", session.nextOutbound(10, TimeUnit.MILLISECONDS));
        assertEquals("4", session.nextOutbound(10, TimeUnit.MILLISECONDS));
    }

    @Test
    void testDropsAreCountedOnlyForEvictedMessages() throws Exception {
        ClientSession session = new ClientSession("s1", new FakeTransport(), 1);
        session.transition(ConnectionState.OPEN);
        int total = 20_000;
        AtomicBoolean done = new AtomicBoolean();
        AtomicInteger delivered = new AtomicInteger();

        Thread sender = new Thread(() -> {
            try {
                while (!done.get() || session.queued() > 0) {
                    if (session.nextOutbound(1, TimeUnit.MILLISECONDS) != null) {
                        delivered.incrementAndGet();
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        sender.start();

        long dropped = 0;
        for (int i = 0; i < total; i++) {
            dropped += session.enqueue("m" + i);
        }
        done.set(true);
        sender.join(5000);

        assertEquals(dropped, session.getDropped());
        assertEquals(total, delivered.get() + dropped, "Every message is either delivered or counted as dropped");
    }

    @Test
    void testLifecycleTransitions() {
        ClientSession session = new ClientSession("s1", new FakeTransport(), 1);

        session.transition(ConnectionState.OPEN);
        assertThrows(IllegalStateException.class, () -> session.transition(ConnectionState.CONNECTING));
        assertThrows(IllegalStateException.class, () -> session.transition(ConnectionState.CLOSED));

        session.transition(ConnectionState.CLOSING);
        session.transition(ConnectionState.CLOSED);

        assertFalse(session.tryTransition(ConnectionState.OPEN), "CLOSED is terminal");
        assertEquals(ConnectionState.CLOSED, session.getState());
    }

    @Test
    void testTouchAdvancesLastSeen() throws InterruptedException {
        ClientSession session = new ClientSession("s1", new FakeTransport(), 1);
        Thread.sleep(5);

        session.touch();

        assertTrue(session.getLastSeen().isAfter(session.getConnectedAt()));
    }
}
