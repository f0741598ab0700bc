package in.papertick.service.pipeline;

import in.papertick.domain.account.AccountView;
import in.papertick.domain.data.CompositeEvent;
import in.papertick.domain.data.ProviderEvent;
import in.papertick.domain.data.Tick;
import in.papertick.domain.signal.IndicatorSnapshot;
import in.papertick.domain.signal.Signal;
import in.papertick.infrastructure.metrics.PipelineMetrics;
import in.papertick.infrastructure.provider.MarketDataProvider;
import in.papertick.service.broker.AccountOwnershipException;
import in.papertick.service.broker.PaperBroker;
import in.papertick.service.indicator.IndicatorEngine;
import in.papertick.service.strategy.StrategyEngine;
import in.papertick.transport.ws.BroadcastHub;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Tick loop for one symbol: provider → indicators → strategy → broker → hub.
 *
 * Runs on its own single-thread scheduler, so ticks of a symbol never overlap and each
 * finishes every stage before the next one starts. Provider failures and unexpected
 * step failures become error events; a single-writer breach halts the session.
 */
public final class SymbolPipeline {
    private static final Logger log = LoggerFactory.getLogger(SymbolPipeline.class);

    private final String symbol;
    private final Duration interval;
    private final MarketDataProvider provider;
    private final IndicatorEngine indicators;
    private final StrategyEngine strategy;
    private final PaperBroker broker;
    private final BroadcastHub hub;
    private final PipelineMetrics metrics;
    private final Consumer<Throwable> haltHandler;

    private final ScheduledExecutorService executor;
    private volatile ScheduledFuture<?> task;
    private volatile boolean stopped = false;

    public SymbolPipeline(String symbol, Duration interval, MarketDataProvider provider,
                          IndicatorEngine indicators, StrategyEngine strategy, PaperBroker broker,
                          BroadcastHub hub, PipelineMetrics metrics, Consumer<Throwable> haltHandler) {
        this.symbol = symbol;
        this.interval = interval;
        this.provider = provider;
        this.indicators = indicators;
        this.strategy = strategy;
        this.broker = broker;
        this.hub = hub;
        this.metrics = metrics;
        this.haltHandler = haltHandler;
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "pipeline-" + symbol);
            t.setDaemon(true);
            return t;
        });
    }

    public synchronized void start() {
        if (task != null || stopped) {
            throw new IllegalStateException("Pipeline " + symbol + " already started or stopped");
        }
        task = executor.scheduleAtFixedRate(this::step, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("[PIPELINE] {} started (interval={}ms, provider={})", symbol, interval.toMillis(), provider.name());
    }

    /**
     * Cancel the loop, interrupting an in-flight provider call, and release the thread.
     */
    public synchronized void stop() {
        if (stopped) {
            return;
        }
        stopped = true;
        if (task != null) {
            task.cancel(true);
        }
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(2, TimeUnit.SECONDS)) {
                log.warn("[PIPELINE] {} did not stop within 2s", symbol);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("[PIPELINE] {} stopped", symbol);
    }

    public String symbol() {
        return symbol;
    }

    public boolean isStopped() {
        return stopped;
    }

    /**
     * One scheduled iteration. Never throws, so the schedule keeps running.
     */
    void step() {
        try {
            runOnce();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (AccountOwnershipException e) {
            fatal(e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof AccountOwnershipException) {
                fatal(cause);
            } else {
                fail(cause);
            }
        } catch (RuntimeException e) {
            fail(e);
        }
    }

    void runOnce() throws InterruptedException, ExecutionException {
        ProviderEvent event = provider.nextTick(symbol);
        if (stopped) {
            return;
        }
        if (event.isError()) {
            metrics.recordProviderError(symbol);
            log.warn("[PIPELINE] {} provider error: {}", symbol, event.error());
            hub.publishError(symbol, event.error());
            return;
        }

        long started = System.nanoTime();
        Tick tick = event.tick();
        IndicatorSnapshot snapshot = indicators.update(tick);
        Signal signal = strategy.evaluate(tick, snapshot);
        if (signal.isActionable()) {
            metrics.recordSignal(symbol, signal.kind().name());
        }

        AccountView account = broker.onTick(tick, signal).get();
        hub.publish(new CompositeEvent(tick, snapshot, signal, account));
        metrics.recordTick(symbol, System.nanoTime() - started);

        log.debug("[PIPELINE] {} price={} ma_short={} ma_long={} rsi={} signal={}",
            symbol, tick.price(), snapshot.maShort(), snapshot.maLong(), snapshot.rsi(), signal.kind());
    }

    private void fail(Throwable e) {
        if (stopped) {
            return;
        }
        String error = e.getClass().getSimpleName() + ": " + e.getMessage();
        log.warn("[PIPELINE] {} step failed: {}", symbol, error, e);
        hub.publishError(symbol, error);
    }

    private void fatal(Throwable e) {
        log.error("[PIPELINE] {} single-writer violation on the paper account, halting session", symbol, e);
        haltHandler.accept(e);
    }
}
