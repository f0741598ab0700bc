package in.papertick.transport.ws;

import in.papertick.config.HubConfig;
import in.papertick.domain.data.CompositeEvent;
import in.papertick.infrastructure.metrics.PipelineMetrics;
import in.papertick.service.snapshot.SnapshotStore;
import io.undertow.websockets.WebSocketConnectionCallback;
import io.undertow.websockets.WebSocketProtocolHandshakeHandler;
import io.undertow.websockets.core.AbstractReceiveListener;
import io.undertow.websockets.core.BufferedTextMessage;
import io.undertow.websockets.core.CloseMessage;
import io.undertow.websockets.core.WebSocketChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fan-out of composite events to every connected consumer, plus the pull snapshot.
 *
 * - each publish overwrites the snapshot store, then enqueues one encoded message per OPEN session
 * - enqueue never blocks; a full session queue drops its oldest message
 * - a new session is primed with the snapshot and registered under the publish lock,
 *   so it sees every later event exactly once and the snapshot always comes first
 * - each session has its own sender task, so a slow consumer only stalls itself
 * - sessions silent past the keepalive timeout are closed by the reaper
 */
public final class BroadcastHub {
    private static final Logger log = LoggerFactory.getLogger(BroadcastHub.class);

    private static final long POLL_MS = 250;
    private static final long SEND_GRACE_MS = 200;

    private final SnapshotStore store;
    private final HubConfig cfg;
    private final PipelineMetrics metrics;

    private final ConcurrentMap<String, ClientSession> sessions = new ConcurrentHashMap<>();
    private final Object publishLock = new Object();

    private final AtomicInteger senderSeq = new AtomicInteger();
    private final ExecutorService senders = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "hub-sender-" + senderSeq.incrementAndGet());
        t.setDaemon(true);
        return t;
    });
    private final ScheduledExecutorService reaper = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "hub-reaper");
        t.setDaemon(true);
        return t;
    });

    private volatile boolean accepting = true;

    public BroadcastHub(SnapshotStore store, HubConfig cfg, PipelineMetrics metrics) {
        this.store = store;
        this.cfg = cfg;
        this.metrics = metrics;
    }

    public void start() {
        long periodMs = Math.max(50, Math.min(1000, cfg.keepaliveTimeout().toMillis() / 2));
        reaper.scheduleAtFixedRate(() -> {
            try {
                reapIdle();
            } catch (RuntimeException e) {
                log.warn("[HUB] Reaper pass failed: {}", e.toString());
            }
        }, periodMs, periodMs, TimeUnit.MILLISECONDS);
        log.info("[HUB] Started (queue={}, keepalive={}ms, reap every {}ms)",
            cfg.queueCapacity(), cfg.keepaliveTimeout().toMillis(), periodMs);
    }

    /**
     * Register a new consumer. The snapshot is its first message.
     *
     * @return the session, or null when the hub is shutting down
     */
    public ClientSession connect(ClientTransport transport) {
        if (!accepting) {
            transport.close(CloseCodes.SERVICE_RESTART, "server shutting down");
            return null;
        }

        ClientSession session = new ClientSession(UUID.randomUUID().toString(), transport, cfg.queueCapacity());
        synchronized (publishLock) {
            session.prime(MessageCodec.snapshotMessage(store.view()));
            sessions.put(session.getId(), session);
            session.transition(ConnectionState.OPEN);
        }
        metrics.sessionOpened();
        session.attachSender(senders.submit(() -> drain(session)));

        log.info("[HUB] Connected {} (session={}, total={})",
            transport.remoteAddress(), session.getId(), sessions.size());
        return session;
    }

    /**
     * Inbound frame from a consumer. Keepalives refresh lastSeen and are answered with a pong.
     */
    public void onInbound(ClientSession session, String text) {
        session.touch();
        if (MessageCodec.isKeepalive(text)) {
            session.enqueue(MessageCodec.pongMessage(Instant.now()));
        } else {
            log.debug("[HUB] Ignoring inbound frame on {}: {}", session.getId(), text);
        }
    }

    /**
     * Close a session from the server side and release it.
     */
    public void disconnect(ClientSession session, int code, String reason) {
        release(session, code, reason, true);
    }

    /**
     * The peer closed or the channel failed; release without sending a close frame.
     */
    void peerClosed(ClientSession session, int code, String reason) {
        release(session, code, reason, false);
    }

    private void release(ClientSession session, int code, String reason, boolean sendClose) {
        if (sessions.remove(session.getId()) == null) {
            return;
        }
        session.tryTransition(ConnectionState.CLOSING);
        if (sendClose) {
            try {
                session.getTransport().close(code, reason);
            } catch (RuntimeException e) {
                log.debug("[HUB] Close of {} failed: {}", session.getId(), e.toString());
            }
        }
        session.tryTransition(ConnectionState.CLOSED);
        stopSender(session, sendClose);
        metrics.sessionClosed();
        log.info("[HUB] Disconnected session={} code={} reason={} dropped={} (total={})",
            session.getId(), code, reason, session.getDropped(), sessions.size());
    }

    /**
     * A send still in flight gets a short grace to finish so the close frame can follow it.
     * After that the sender is interrupted and the connection dropped.
     */
    private void stopSender(ClientSession session, boolean grace) {
        if (session.onSenderThread()) {
            return;
        }
        if (grace && session.isSending()) {
            long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(SEND_GRACE_MS);
            try {
                while (session.isSending() && System.nanoTime() < deadline) {
                    Thread.sleep(10);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        session.stopSender();
        if (session.isSending()) {
            log.info("[HUB] Session {} stuck in send, dropping connection", session.getId());
            session.getTransport().abort();
        }
    }

    public void publish(CompositeEvent event) {
        synchronized (publishLock) {
            if (!store.update(event)) {
                log.debug("[HUB] Dropping event for unsubscribed {}", event.symbol());
                return;
            }
            fanOut(MessageCodec.tickMessage(event));
        }
    }

    public void publishError(String symbol, String error) {
        synchronized (publishLock) {
            if (!store.recordError(symbol, error)) {
                return;
            }
            fanOut(MessageCodec.errorMessage(symbol, error, Instant.now()));
        }
    }

    private void fanOut(String json) {
        long dropped = 0;
        for (ClientSession s : sessions.values()) {
            if (s.isOpen()) {
                dropped += s.enqueue(json);
            }
        }
        metrics.recordDropped(dropped);
    }

    public SnapshotStore.Snapshot pull() {
        return store.view();
    }

    /**
     * Close every session silent for longer than the keepalive timeout.
     *
     * @return number of sessions closed
     */
    public int reapIdle() {
        Instant cutoff = Instant.now().minus(cfg.keepaliveTimeout());
        int reaped = 0;
        for (ClientSession s : List.copyOf(sessions.values())) {
            if (s.getLastSeen().isBefore(cutoff)) {
                log.info("[HUB] Session {} idle since {}, closing", s.getId(), s.getLastSeen());
                disconnect(s, CloseCodes.GOING_AWAY, "keepalive timeout");
                reaped++;
            }
        }
        return reaped;
    }

    /**
     * Stop accepting, close every session with the restart code and stop sender tasks.
     */
    public void shutdown() {
        accepting = false;
        reaper.shutdownNow();
        for (ClientSession s : List.copyOf(sessions.values())) {
            disconnect(s, CloseCodes.SERVICE_RESTART, "server restart");
        }
        senders.shutdownNow();
        try {
            if (!senders.awaitTermination(2, TimeUnit.SECONDS)) {
                log.warn("[HUB] Sender tasks still running after shutdown");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("[HUB] Shut down");
    }

    public int getConnectionCount() {
        return sessions.size();
    }

    ClientSession session(String id) {
        return sessions.get(id);
    }

    private void drain(ClientSession session) {
        session.bindSender(Thread.currentThread());
        try {
            while (session.isOpen()) {
                String msg = session.nextOutbound(POLL_MS, TimeUnit.MILLISECONDS);
                if (msg == null) {
                    continue;
                }
                session.markSending(true);
                try {
                    session.getTransport().send(msg);
                } catch (IOException e) {
                    if (session.isOpen()) {
                        log.warn("[HUB] Send to {} failed: {}", session.getId(), e.toString());
                    }
                    disconnect(session, CloseCodes.ABNORMAL, "send failed");
                    return;
                } finally {
                    session.markSending(false);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            session.bindSender(null);
        }
    }

    /**
     * Undertow handler for {@code GET /ws}.
     */
    public WebSocketProtocolHandshakeHandler websocketHandler() {
        return new WebSocketProtocolHandshakeHandler((WebSocketConnectionCallback) (exchange, channel) -> {
            ClientSession session = connect(new UndertowClientTransport(channel));
            if (session == null) {
                return;
            }

            channel.getReceiveSetter().set(new AbstractReceiveListener() {
                @Override
                protected void onFullTextMessage(WebSocketChannel ch, BufferedTextMessage message) {
                    onInbound(session, message.getData());
                }

                @Override
                protected void onCloseMessage(CloseMessage cm, WebSocketChannel ch) {
                    peerClosed(session, cm.getCode(), cm.getReason());
                    super.onCloseMessage(cm, ch);
                }

                @Override
                protected void onError(WebSocketChannel ch, Throwable error) {
                    log.warn("[HUB] Channel error on {}: {}", session.getId(), error.toString());
                    peerClosed(session, CloseCodes.ABNORMAL, "channel error");
                    super.onError(ch, error);
                }
            });
            channel.getCloseSetter().set(c -> peerClosed(session, CloseCodes.ABNORMAL, "channel closed"));
            channel.resumeReceives();
        });
    }
}
