package in.papertick.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.papertick.infrastructure.common.ReconnectionPolicy;
import in.papertick.transport.ws.CloseCodes;
import in.papertick.util.Env;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Consumer of the live channel with a pull fallback.
 *
 * - connects to {@code /ws}, pings through a {@link HeartbeatManager}, treats missing pongs as a dead link
 * - on any close other than its own normal close, reconnects with exponential backoff;
 *   a 1012 restart close resets the backoff first
 * - while disconnected, polls {@code /api/snapshot} on a fixed interval and delivers it
 *   as a {@code snapshot} message
 */
public final class LiveFeedClient implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(LiveFeedClient.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final URI baseUri;
    private final URI wsUri;
    private final ReconnectionPolicy reconnect;
    private final Duration pollInterval;
    private final Duration pingInterval;
    private final Duration pongTimeout;
    private final Consumer<JsonNode> listener;

    private final HttpClient http = HttpClient.newBuilder()
        .connectTimeout(Duration.ofSeconds(5))
        .build();
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "live-feed-client");
        t.setDaemon(true);
        return t;
    });

    private final AtomicInteger connectionSeq = new AtomicInteger();
    private final AtomicInteger connects = new AtomicInteger();
    private final AtomicInteger polls = new AtomicInteger();

    private volatile Connection current;
    private volatile ScheduledFuture<?> pollTask;
    private volatile int lastCloseCode = -1;
    private volatile JsonNode lastSnapshot;
    private volatile boolean stopped = false;

    public LiveFeedClient(URI baseUri, ReconnectionPolicy reconnect, Duration pollInterval,
                          Duration pingInterval, Duration pongTimeout, Consumer<JsonNode> listener) {
        String base = baseUri.toString().endsWith("/")
            ? baseUri.toString().substring(0, baseUri.toString().length() - 1)
            : baseUri.toString();
        this.baseUri = URI.create(base);
        this.wsUri = URI.create(base.replaceFirst("^http", "ws") + "/ws");
        this.reconnect = reconnect;
        this.pollInterval = pollInterval;
        this.pingInterval = pingInterval;
        this.pongTimeout = pongTimeout;
        this.listener = listener;
    }

    /**
     * Defaults: backoff 500ms doubling to 30s, poll every 2s, ping every 15s, dead after 45s.
     */
    public static LiveFeedClient create(URI baseUri, Consumer<JsonNode> listener) {
        return new LiveFeedClient(baseUri, ReconnectionPolicy.forLiveFeed(), Duration.ofSeconds(2),
            Duration.ofSeconds(15), Duration.ofSeconds(45), listener);
    }

    public void start() {
        log.info("[CLIENT] Connecting to {}", wsUri);
        scheduler.execute(this::connect);
    }

    private void connect() {
        if (stopped) {
            return;
        }
        Connection conn = new Connection(connectionSeq.incrementAndGet());
        current = conn;
        http.newWebSocketBuilder()
            .connectTimeout(Duration.ofSeconds(5))
            .buildAsync(wsUri, conn)
            .whenComplete((ws, err) -> {
                if (err != null) {
                    onDisconnected(conn, CloseCodes.ABNORMAL, "connect failed: " + err.getMessage());
                }
            });
    }

    private void onConnected(Connection conn, WebSocket ws) {
        conn.ws = ws;
        if (stopped || current != conn) {
            ws.sendClose(CloseCodes.NORMAL, "client closing");
            return;
        }
        connects.incrementAndGet();
        reconnect.reset();
        stopPolling();

        conn.heartbeat = new HeartbeatManager("live-feed", String.valueOf(conn.id), pingInterval, pongTimeout,
            () -> ws.sendText("ping", true),
            healthy -> {
                if (!healthy) {
                    scheduler.execute(() -> {
                        ws.abort();
                        onDisconnected(conn, CloseCodes.ABNORMAL, "heartbeat timeout");
                    });
                }
            });
        conn.heartbeat.start();
        log.info("[CLIENT] Connected (connection #{})", conn.id);
    }

    private void onDisconnected(Connection conn, int code, String reason) {
        if (!conn.down.compareAndSet(false, true)) {
            return;
        }
        if (conn.heartbeat != null) {
            conn.heartbeat.stop();
        }
        lastCloseCode = code;
        if (stopped) {
            return;
        }

        if (CloseCodes.isServerRestart(code)) {
            log.info("[CLIENT] Server restarting ({}), reconnecting", reason);
            reconnect.reset();
        } else {
            log.warn("[CLIENT] Disconnected code={} reason={}", code, reason);
        }
        startPolling();

        Optional<Duration> backoff = reconnect.onFailure();
        if (backoff.isEmpty()) {
            log.error("[CLIENT] Giving up after {} reconnect attempts, staying on snapshot polling",
                reconnect.failures());
            return;
        }
        long delayMs = backoff.get().toMillis();
        try {
            scheduler.schedule(this::connect, delayMs, TimeUnit.MILLISECONDS);
            log.info("[CLIENT] Reconnect attempt {} in {}ms", reconnect.failures(), delayMs);
        } catch (RejectedExecutionException e) {
            log.debug("[CLIENT] Scheduler stopped, not reconnecting");
        }
    }

    private synchronized void startPolling() {
        if (pollTask != null || stopped) {
            return;
        }
        pollTask = scheduler.scheduleWithFixedDelay(this::pollSnapshot,
            0, pollInterval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("[CLIENT] Polling {}/api/snapshot every {}ms", baseUri, pollInterval.toMillis());
    }

    private synchronized void stopPolling() {
        if (pollTask != null) {
            pollTask.cancel(false);
            pollTask = null;
            log.info("[CLIENT] Live channel back, polling stopped");
        }
    }

    private void pollSnapshot() {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(baseUri + "/api/snapshot"))
            .timeout(Duration.ofSeconds(5))
            .GET()
            .build();
        try {
            HttpResponse<String> response = http.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                log.debug("[CLIENT] Snapshot poll returned {}", response.statusCode());
                return;
            }
            polls.incrementAndGet();
            ObjectNode msg = MAPPER.createObjectNode();
            msg.put("type", "snapshot");
            msg.set("data", MAPPER.readTree(response.body()));
            deliver(msg);
        } catch (IOException e) {
            log.debug("[CLIENT] Snapshot poll failed: {}", e.toString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void onText(Connection conn, String text) {
        JsonNode msg;
        try {
            msg = MAPPER.readTree(text);
        } catch (IOException e) {
            log.warn("[CLIENT] Unparsable message: {}", text);
            return;
        }
        if ("pong".equals(msg.path("type").asText()) && conn.heartbeat != null) {
            conn.heartbeat.recordPong();
        }
        deliver(msg);
    }

    private void deliver(JsonNode msg) {
        if ("snapshot".equals(msg.path("type").asText())) {
            lastSnapshot = msg.get("data");
        }
        try {
            listener.accept(msg);
        } catch (RuntimeException e) {
            log.warn("[CLIENT] Listener threw on {} message: {}", msg.path("type").asText(), e.toString());
        }
    }

    /**
     * Normal close initiated by this client; ends the reconnect loop.
     */
    @Override
    public void close() {
        stopped = true;
        Connection conn = current;
        if (conn != null) {
            if (conn.heartbeat != null) {
                conn.heartbeat.stop();
            }
            if (conn.ws != null && !conn.ws.isOutputClosed()) {
                conn.ws.sendClose(CloseCodes.NORMAL, "client closing");
            }
        }
        stopPolling();
        scheduler.shutdownNow();
        log.info("[CLIENT] Closed");
    }

    public boolean isConnected() {
        Connection conn = current;
        return conn != null && conn.ws != null && !conn.down.get() && !conn.ws.isInputClosed();
    }

    public boolean isPolling() {
        return pollTask != null;
    }

    public int getConnectCount() {
        return connects.get();
    }

    public int getPollCount() {
        return polls.get();
    }

    public int getLastCloseCode() {
        return lastCloseCode;
    }

    public JsonNode getLastSnapshot() {
        return lastSnapshot;
    }

    private final class Connection implements WebSocket.Listener {
        final int id;
        final AtomicBoolean down = new AtomicBoolean(false);
        final StringBuilder partial = new StringBuilder();
        volatile WebSocket ws;
        volatile HeartbeatManager heartbeat;

        Connection(int id) {
            this.id = id;
        }

        @Override
        public void onOpen(WebSocket webSocket) {
            onConnected(this, webSocket);
            webSocket.request(1);
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            partial.append(data);
            if (last) {
                String text = partial.toString();
                partial.setLength(0);
                LiveFeedClient.this.onText(this, text);
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            onDisconnected(this, statusCode, reason);
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            onDisconnected(this, CloseCodes.ABNORMAL, error.toString());
        }
    }

    /**
     * Prints every message from {@code FEED_URL} (default http://localhost:8080) until interrupted.
     */
    public static void main(String[] args) throws InterruptedException {
        URI base = URI.create(Env.get("FEED_URL", "http://localhost:8080"));
        LiveFeedClient client = LiveFeedClient.create(base, msg -> log.info("[CLIENT] {}", msg));
        CountDownLatch done = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            client.close();
            done.countDown();
        }, "client-shutdown"));
        client.start();
        done.await();
    }
}
