package in.papertick.service.strategy;

import in.papertick.domain.data.Tick;
import in.papertick.domain.signal.IndicatorSnapshot;
import in.papertick.domain.signal.Signal;
import in.papertick.domain.signal.SignalKind;

import java.math.BigDecimal;

/**
 * RSI threshold crossing.
 *
 * BUY when RSI drops from {@code >= oversold} to {@code < oversold} (reversal buy),
 * SELL when it rises from {@code <= overbought} to {@code > overbought}.
 */
public final class RsiThresholdStrategy implements TradingStrategy {

    private final BigDecimal oversold;
    private final BigDecimal overbought;

    public RsiThresholdStrategy(double oversold, double overbought) {
        if (oversold < 0 || overbought > 100 || oversold >= overbought) {
            throw new IllegalArgumentException("Require 0 <= oversold < overbought <= 100");
        }
        this.oversold = BigDecimal.valueOf(oversold);
        this.overbought = BigDecimal.valueOf(overbought);
    }

    @Override
    public String name() {
        return "rsi_threshold(" + oversold.toPlainString() + "," + overbought.toPlainString() + ")";
    }

    @Override
    public Signal evaluate(Tick tick, IndicatorSnapshot current, IndicatorSnapshot previous) {
        if (!current.hasRsi() || !previous.hasRsi()) {
            return Signal.hold(tick.symbol(), "insufficient_data", tick.timestamp());
        }

        BigDecimal prev = previous.rsi();
        BigDecimal rsi = current.rsi();

        if (prev.compareTo(oversold) >= 0 && rsi.compareTo(oversold) < 0) {
            return new Signal(tick.symbol(), SignalKind.BUY,
                "rsi_cross_below_oversold rsi=" + rsi.toPlainString() + " prev=" + prev.toPlainString()
                    + " oversold=" + oversold.toPlainString(),
                tick.timestamp());
        }
        if (prev.compareTo(overbought) <= 0 && rsi.compareTo(overbought) > 0) {
            return new Signal(tick.symbol(), SignalKind.SELL,
                "rsi_cross_above_overbought rsi=" + rsi.toPlainString() + " prev=" + prev.toPlainString()
                    + " overbought=" + overbought.toPlainString(),
                tick.timestamp());
        }
        return Signal.hold(tick.symbol(), "rsi_neutral rsi=" + rsi.toPlainString(), tick.timestamp());
    }
}
