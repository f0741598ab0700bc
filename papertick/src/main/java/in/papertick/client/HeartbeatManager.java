package in.papertick.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Keeps a live feed connection alive and detects a dead link.
 *
 * Sends a ping every {@code pingInterval}; if no pong arrives within {@code timeout}
 * of the last one, the link is reported unhealthy once. A later pong reports it healthy again.
 *
 * <pre>
 * HeartbeatManager hb = new HeartbeatManager("live-feed", "conn-1",
 *     Duration.ofSeconds(15), Duration.ofSeconds(45),
 *     () -> ws.sendText("ping", true),
 *     healthy -> { if (!healthy) reconnect(); });
 * hb.start();
 * // on {"type":"pong"}:
 * hb.recordPong();
 * </pre>
 */
public class HeartbeatManager {

    private static final Logger log = LoggerFactory.getLogger(HeartbeatManager.class);

    private final String name;
    private final String connectionId;
    private final Duration pingInterval;
    private final Duration timeout;
    private final Runnable pingFunction;
    private final Consumer<Boolean> healthCallback;

    private final ScheduledExecutorService scheduler;
    private volatile ScheduledFuture<?> pingTask;
    private volatile Instant lastPongTime;
    private volatile boolean running = false;
    private volatile boolean healthy = true;

    public HeartbeatManager(String name, String connectionId,
                            Duration pingInterval, Duration timeout,
                            Runnable pingFunction,
                            Consumer<Boolean> healthCallback) {
        if (timeout.compareTo(pingInterval) <= 0) {
            throw new IllegalArgumentException("Heartbeat timeout must exceed the ping interval");
        }
        this.name = name;
        this.connectionId = connectionId;
        this.pingInterval = pingInterval;
        this.timeout = timeout;
        this.pingFunction = pingFunction;
        this.healthCallback = healthCallback;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "heartbeat-" + name + "-" + connectionId);
            t.setDaemon(true);
            return t;
        });
    }

    public synchronized void start() {
        if (running) {
            log.warn("[CLIENT] [{}:{}] Heartbeat already running", name, connectionId);
            return;
        }
        log.debug("[CLIENT] [{}:{}] Heartbeat started (ping every {}ms, timeout {}ms)",
            name, connectionId, pingInterval.toMillis(), timeout.toMillis());

        running = true;
        healthy = true;
        lastPongTime = Instant.now();
        pingTask = scheduler.scheduleAtFixedRate(this::tick, 0, pingInterval.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Stop pinging. Safe to call more than once.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        if (pingTask != null) {
            pingTask.cancel(false);
            pingTask = null;
        }
        scheduler.shutdownNow();
        log.debug("[CLIENT] [{}:{}] Heartbeat stopped", name, connectionId);
    }

    public void recordPong() {
        lastPongTime = Instant.now();
        if (!healthy) {
            log.info("[CLIENT] [{}:{}] Pong received, link healthy again", name, connectionId);
            setHealthy(true);
        }
    }

    public boolean isHealthy() {
        return healthy && isWithinTimeout();
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * @return time since the last pong, or null before the first one
     */
    public Duration getTimeSinceLastPong() {
        Instant lastPong = lastPongTime;
        return lastPong == null ? null : Duration.between(lastPong, Instant.now());
    }

    private void tick() {
        if (!running) {
            return;
        }
        if (!isWithinTimeout()) {
            log.warn("[CLIENT] [{}:{}] No pong for {}ms", name, connectionId, timeout.toMillis());
            setHealthy(false);
            return;
        }
        try {
            pingFunction.run();
        } catch (RuntimeException e) {
            log.warn("[CLIENT] [{}:{}] Ping failed: {}", name, connectionId, e.toString());
            setHealthy(false);
        }
    }

    private boolean isWithinTimeout() {
        Instant lastPong = lastPongTime;
        return lastPong != null && Duration.between(lastPong, Instant.now()).compareTo(timeout) < 0;
    }

    private void setHealthy(boolean value) {
        if (healthy == value) {
            return;
        }
        healthy = value;
        if (healthCallback != null) {
            try {
                healthCallback.accept(value);
            } catch (RuntimeException e) {
                log.error("[CLIENT] [{}:{}] Health callback threw", name, connectionId, e);
            }
        }
    }

    /**
     * Defaults for the live feed: ping every 15s, dead after 45s without a pong.
     */
    public static HeartbeatManager forLiveFeed(String connectionId, Runnable pingFunction,
                                               Consumer<Boolean> healthCallback) {
        return new HeartbeatManager("live-feed", connectionId,
            Duration.ofSeconds(15), Duration.ofSeconds(45), pingFunction, healthCallback);
    }
}
