package in.papertick.service.strategy;

import in.papertick.domain.data.Tick;
import in.papertick.domain.signal.IndicatorSnapshot;
import in.papertick.domain.signal.Signal;
import in.papertick.domain.signal.SignalKind;

import java.math.BigDecimal;

/**
 * Moving-average crossover.
 *
 * BUY on the tick where short MA moves from {@code <= long} to {@code > long},
 * SELL on the mirror move. Sustained trends produce HOLD.
 */
public final class MaCrossoverStrategy implements TradingStrategy {

    private final int shortPeriod;
    private final int longPeriod;

    public MaCrossoverStrategy(int shortPeriod, int longPeriod) {
        if (shortPeriod <= 0 || shortPeriod >= longPeriod) {
            throw new IllegalArgumentException("Require 0 < shortPeriod < longPeriod");
        }
        this.shortPeriod = shortPeriod;
        this.longPeriod = longPeriod;
    }

    @Override
    public String name() {
        return "ma_crossover(" + shortPeriod + "," + longPeriod + ")";
    }

    @Override
    public Signal evaluate(Tick tick, IndicatorSnapshot current, IndicatorSnapshot previous) {
        if (!current.hasMovingAverages() || !previous.hasMovingAverages()) {
            return Signal.hold(tick.symbol(), "insufficient_data", tick.timestamp());
        }

        int prevCmp = previous.maShort().compareTo(previous.maLong());
        int curCmp = current.maShort().compareTo(current.maLong());

        if (prevCmp <= 0 && curCmp > 0) {
            return new Signal(tick.symbol(), SignalKind.BUY,
                reason("ma_cross_up", current.maShort(), current.maLong()), tick.timestamp());
        }
        if (prevCmp >= 0 && curCmp < 0) {
            return new Signal(tick.symbol(), SignalKind.SELL,
                reason("ma_cross_down", current.maShort(), current.maLong()), tick.timestamp());
        }
        return Signal.hold(tick.symbol(), "no_cross", tick.timestamp());
    }

    private static String reason(String trigger, BigDecimal maShort, BigDecimal maLong) {
        return trigger + " ma_short=" + maShort.toPlainString() + " ma_long=" + maLong.toPlainString();
    }
}
