package in.papertick.service.indicator;

import in.papertick.config.StrategyConfig;
import in.papertick.domain.data.Tick;
import in.papertick.domain.signal.IndicatorSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Maintains per-symbol price history, short/long SMA and Wilder RSI.
 *
 * Indicators stay {@code null} until their window is full. Each symbol's state is
 * updated only from that symbol's pipeline, so per-state access needs no locking.
 */
public final class IndicatorEngine {
    private static final Logger log = LoggerFactory.getLogger(IndicatorEngine.class);

    private final int shortPeriod;
    private final int longPeriod;
    private final int rsiPeriod;
    private final ConcurrentMap<String, IndicatorState> states = new ConcurrentHashMap<>();

    public IndicatorEngine(int shortPeriod, int longPeriod, int rsiPeriod) {
        if (shortPeriod <= 0 || longPeriod <= 0 || rsiPeriod <= 0) {
            throw new IllegalArgumentException("Indicator periods must be positive");
        }
        this.shortPeriod = shortPeriod;
        this.longPeriod = longPeriod;
        this.rsiPeriod = rsiPeriod;
    }

    public static IndicatorEngine from(StrategyConfig cfg) {
        return new IndicatorEngine(cfg.shortPeriod(), cfg.longPeriod(), cfg.rsiPeriod());
    }

    public IndicatorSnapshot update(Tick tick) {
        IndicatorState state = states.computeIfAbsent(tick.symbol(),
            s -> new IndicatorState(shortPeriod, longPeriod, rsiPeriod));
        IndicatorSnapshot snapshot = state.push(tick.price());
        log.debug("[INDICATOR] {} price={} ma_short={} ma_long={} rsi={}",
            tick.symbol(), tick.price(), snapshot.maShort(), snapshot.maLong(), snapshot.rsi());
        return snapshot;
    }

    /**
     * Latest snapshot for a symbol, {@link IndicatorSnapshot#EMPTY} if it never ticked.
     */
    public IndicatorSnapshot current(String symbol) {
        IndicatorState state = states.get(symbol);
        return state == null ? IndicatorSnapshot.EMPTY : state.last();
    }

    public void release(String symbol) {
        if (states.remove(symbol) != null) {
            log.info("[INDICATOR] Released state for {}", symbol);
        }
    }

    public boolean isTracking(String symbol) {
        return states.containsKey(symbol);
    }

    public int historyCapacity() {
        return Math.max(longPeriod, rsiPeriod) + 1;
    }

    int historySize(String symbol) {
        IndicatorState state = states.get(symbol);
        return state == null ? 0 : state.size();
    }
}
