package in.papertick.service.strategy;

import in.papertick.config.StrategyConfig;
import in.papertick.domain.data.Tick;
import in.papertick.domain.signal.IndicatorSnapshot;
import in.papertick.domain.signal.Signal;
import in.papertick.domain.signal.SignalKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Runs the configured strategy against each tick and owns per-symbol {@link StrategyMemory}.
 */
public final class StrategyEngine {
    private static final Logger log = LoggerFactory.getLogger(StrategyEngine.class);

    private final TradingStrategy strategy;
    private final ConcurrentMap<String, StrategyMemory> memory = new ConcurrentHashMap<>();

    public StrategyEngine(TradingStrategy strategy) {
        this.strategy = strategy;
    }

    public static StrategyEngine from(StrategyConfig cfg) {
        TradingStrategy strategy = switch (cfg.type()) {
            case MA_CROSSOVER -> new MaCrossoverStrategy(cfg.shortPeriod(), cfg.longPeriod());
            case RSI_THRESHOLD -> new RsiThresholdStrategy(cfg.oversold(), cfg.overbought());
        };
        return new StrategyEngine(strategy);
    }

    public Signal evaluate(Tick tick, IndicatorSnapshot indicators) {
        StrategyMemory mem = memory.computeIfAbsent(tick.symbol(), s -> new StrategyMemory());
        Signal signal = strategy.evaluate(tick, indicators, mem.previous());
        mem.record(indicators, signal);

        if (signal.isActionable()) {
            log.info("[STRATEGY] {} {} @ {} ({})", signal.kind(), tick.symbol(), tick.price(), signal.reason());
        }
        return signal;
    }

    /**
     * Last BUY or SELL emitted for a symbol, null if none.
     */
    public SignalKind lastActionable(String symbol) {
        StrategyMemory mem = memory.get(symbol);
        return mem == null ? null : mem.lastActionable();
    }

    public void release(String symbol) {
        if (memory.remove(symbol) != null) {
            log.info("[STRATEGY] Released memory for {}", symbol);
        }
    }

    public boolean isTracking(String symbol) {
        return memory.containsKey(symbol);
    }

    public String strategyName() {
        return strategy.name();
    }
}
