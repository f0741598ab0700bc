package in.papertick.service.pipeline;

import in.papertick.config.SessionConfig;
import in.papertick.infrastructure.metrics.PipelineMetrics;
import in.papertick.infrastructure.provider.MarketDataProvider;
import in.papertick.infrastructure.provider.ProviderFactory;
import in.papertick.service.broker.PaperBroker;
import in.papertick.service.indicator.IndicatorEngine;
import in.papertick.service.snapshot.SnapshotStore;
import in.papertick.service.strategy.StrategyEngine;
import in.papertick.transport.ws.BroadcastHub;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns one provider, the indicator and strategy engines, the paper broker, the snapshot
 * store, the broadcast hub and one pipeline per subscribed symbol.
 */
public final class TradingSession implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TradingSession.class);

    private final SessionConfig cfg;
    private final PipelineMetrics metrics;
    private final MarketDataProvider provider;
    private final IndicatorEngine indicators;
    private final StrategyEngine strategy;
    private final PaperBroker broker;
    private final SnapshotStore store;
    private final BroadcastHub hub;

    private final Map<String, SymbolPipeline> pipelines = new LinkedHashMap<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicReference<Throwable> haltCause = new AtomicReference<>();

    public static TradingSession create(SessionConfig cfg, PipelineMetrics metrics) {
        return new TradingSession(cfg, ProviderFactory.create(cfg.provider()), metrics);
    }

    public TradingSession(SessionConfig cfg, MarketDataProvider provider, PipelineMetrics metrics) {
        this.cfg = cfg;
        this.metrics = metrics;
        this.provider = provider;
        this.indicators = IndicatorEngine.from(cfg.strategy());
        this.strategy = StrategyEngine.from(cfg.strategy());
        this.broker = new PaperBroker(cfg.broker(), metrics);
        this.store = new SnapshotStore(broker.view().join());
        this.hub = new BroadcastHub(store, cfg.hub(), metrics);
    }

    public synchronized void start() {
        if (closed.get()) {
            throw new IllegalStateException("Session already closed");
        }
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("Session already started");
        }
        hub.start();
        for (String symbol : cfg.symbols()) {
            subscribe(symbol);
        }
        log.info("[PIPELINE] Session started: symbols={} provider={} strategy={}",
            cfg.symbols(), provider.name(), strategy.strategyName());
    }

    /**
     * Start a pipeline for the symbol.
     *
     * @return false if it is already subscribed
     */
    public synchronized boolean subscribe(String symbol) {
        if (closed.get()) {
            throw new IllegalStateException("Session closed");
        }
        if (pipelines.containsKey(symbol)) {
            return false;
        }
        store.register(symbol);
        SymbolPipeline pipeline = new SymbolPipeline(symbol, cfg.interval(), provider, indicators,
            strategy, broker, hub, metrics, this::halt);
        pipelines.put(symbol, pipeline);
        pipeline.start();
        return true;
    }

    /**
     * Stop the symbol's pipeline and forget its indicator, strategy, provider and snapshot state.
     *
     * @return false if it was not subscribed
     */
    public synchronized boolean unsubscribe(String symbol) {
        SymbolPipeline pipeline = pipelines.remove(symbol);
        if (pipeline == null) {
            return false;
        }
        pipeline.stop();
        indicators.release(symbol);
        strategy.release(symbol);
        provider.release(symbol);
        store.remove(symbol);
        broker.forget(symbol).join();
        log.info("[PIPELINE] Unsubscribed {}", symbol);
        return true;
    }

    /**
     * Stop everything after a fatal pipeline failure. Runs the shutdown on its own thread
     * because the caller is usually one of the pipelines being stopped.
     */
    public void halt(Throwable cause) {
        if (!haltCause.compareAndSet(null, cause)) {
            return;
        }
        log.error("[PIPELINE] Session halted: {}", cause.toString());
        Thread t = new Thread(this::close, "session-halt");
        t.setDaemon(true);
        t.start();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        List<SymbolPipeline> toStop;
        synchronized (this) {
            toStop = new ArrayList<>(pipelines.values());
            pipelines.clear();
        }
        toStop.forEach(SymbolPipeline::stop);
        hub.shutdown();
        broker.close();
        provider.close();
        store.clear();
        running.set(false);
        log.info("[PIPELINE] Session closed");
    }

    public boolean isRunning() {
        return running.get() && !closed.get();
    }

    public synchronized List<String> symbols() {
        return List.copyOf(pipelines.keySet());
    }

    public Throwable haltCause() {
        return haltCause.get();
    }

    public BroadcastHub hub() {
        return hub;
    }

    public SnapshotStore store() {
        return store;
    }

    public PaperBroker broker() {
        return broker;
    }

    public IndicatorEngine indicators() {
        return indicators;
    }

    public StrategyEngine strategy() {
        return strategy;
    }
}
