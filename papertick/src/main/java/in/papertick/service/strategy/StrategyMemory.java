package in.papertick.service.strategy;

import in.papertick.domain.signal.IndicatorSnapshot;
import in.papertick.domain.signal.Signal;
import in.papertick.domain.signal.SignalKind;

/**
 * Per-symbol memory used to detect transitions between ticks.
 */
public final class StrategyMemory {
    private IndicatorSnapshot previous = IndicatorSnapshot.EMPTY;
    private SignalKind lastActionable;

    IndicatorSnapshot previous() {
        return previous;
    }

    void record(IndicatorSnapshot current, Signal signal) {
        previous = current;
        if (signal.isActionable()) {
            lastActionable = signal.kind();
        }
    }

    /**
     * Last BUY or SELL emitted for the symbol, null if none yet.
     */
    public SignalKind lastActionable() {
        return lastActionable;
    }
}
