package in.papertick.transport.ws;

import java.time.Instant;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One connected consumer: a bounded outbound queue drained by its own sender task.
 *
 * The snapshot primed on connect sits in a separate slot and is always handed out
 * before anything queued. A full queue drops its oldest message.
 */
public final class ClientSession {
    private final String id;
    private final ClientTransport transport;
    private final Instant connectedAt;
    private final LinkedBlockingDeque<String> outbound;
    private final AtomicReference<String> priming = new AtomicReference<>();
    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.CONNECTING);
    private final AtomicLong dropped = new AtomicLong();
    private volatile Instant lastSeen;
    private volatile Future<?> sender;
    private volatile Thread senderThread;
    private volatile boolean sending;

    public ClientSession(String id, ClientTransport transport, int capacity) {
        this.id = id;
        this.transport = transport;
        this.outbound = new LinkedBlockingDeque<>(capacity);
        this.connectedAt = Instant.now();
        this.lastSeen = connectedAt;
    }

    public String getId() {
        return id;
    }

    public ClientTransport getTransport() {
        return transport;
    }

    public Instant getConnectedAt() {
        return connectedAt;
    }

    public Instant getLastSeen() {
        return lastSeen;
    }

    public ConnectionState getState() {
        return state.get();
    }

    public boolean isOpen() {
        return state.get() == ConnectionState.OPEN;
    }

    public void touch() {
        this.lastSeen = Instant.now();
    }

    /**
     * Set the first message this session will send. Only valid while CONNECTING.
     */
    void prime(String snapshot) {
        if (state.get() != ConnectionState.CONNECTING) {
            throw new IllegalStateException("Session " + id + " already " + state.get());
        }
        priming.set(snapshot);
    }

    /**
     * Queue a message without blocking.
     *
     * @return number of messages dropped to make room (0 or 1)
     */
    int enqueue(String message) {
        synchronized (outbound) {
            if (outbound.offerLast(message)) {
                return 0;
            }
            // the sender may empty the queue between the offer and the eviction
            boolean evicted = outbound.pollFirst() != null;
            outbound.offerLast(message);
            if (!evicted) {
                return 0;
            }
        }
        dropped.incrementAndGet();
        return 1;
    }

    /**
     * Next message to send, primed snapshot first.
     *
     * @return null if nothing arrived within the timeout
     */
    String nextOutbound(long timeout, TimeUnit unit) throws InterruptedException {
        String first = priming.getAndSet(null);
        if (first != null) {
            return first;
        }
        return outbound.pollFirst(timeout, unit);
    }

    void attachSender(Future<?> task) {
        this.sender = task;
        if (state.get() == ConnectionState.CLOSED) {
            task.cancel(true);
        }
    }

    /**
     * Interrupt the sender task, if any.
     */
    void stopSender() {
        Future<?> task = sender;
        if (task != null) {
            task.cancel(true);
        }
    }

    void bindSender(Thread thread) {
        this.senderThread = thread;
    }

    boolean hasLiveSender() {
        return senderThread != null;
    }

    boolean onSenderThread() {
        return Thread.currentThread() == senderThread;
    }

    boolean isSending() {
        return sending;
    }

    void markSending(boolean inFlight) {
        this.sending = inFlight;
    }

    int queued() {
        return outbound.size();
    }

    public long getDropped() {
        return dropped.get();
    }

    /**
     * @throws IllegalStateException if the lifecycle does not allow the move
     */
    public void transition(ConnectionState next) {
        if (!tryTransition(next)) {
            throw new IllegalStateException("Session " + id + ": " + state.get() + " -> " + next + " not allowed");
        }
    }

    boolean tryTransition(ConnectionState next) {
        while (true) {
            ConnectionState cur = state.get();
            if (!cur.canTransitionTo(next)) {
                return false;
            }
            if (state.compareAndSet(cur, next)) {
                return true;
            }
        }
    }
}
