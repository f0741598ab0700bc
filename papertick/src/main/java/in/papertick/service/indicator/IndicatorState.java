package in.papertick.service.indicator;

import in.papertick.domain.signal.IndicatorSnapshot;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayDeque;
import java.util.Iterator;

/**
 * Rolling indicator state for one symbol.
 * Only the owning symbol's pipeline thread touches an instance.
 */
final class IndicatorState {
    private static final int MA_SCALE = 6;

    private final int shortPeriod;
    private final int longPeriod;
    private final int capacity;
    private final ArrayDeque<BigDecimal> history;
    private final WilderRsi rsi;

    private IndicatorSnapshot last = IndicatorSnapshot.EMPTY;

    IndicatorState(int shortPeriod, int longPeriod, int rsiPeriod) {
        this.shortPeriod = shortPeriod;
        this.longPeriod = longPeriod;
        this.capacity = Math.max(longPeriod, rsiPeriod) + 1;
        this.history = new ArrayDeque<>(capacity);
        this.rsi = new WilderRsi(rsiPeriod);
    }

    IndicatorSnapshot push(BigDecimal price) {
        if (history.size() == capacity) {
            history.removeFirst();
        }
        history.addLast(price);

        BigDecimal rsiValue = rsi.update(price);
        last = new IndicatorSnapshot(sma(shortPeriod), sma(longPeriod), rsiValue);
        return last;
    }

    /**
     * Arithmetic mean of the newest {@code window} prices, or null if fewer are held.
     */
    BigDecimal sma(int window) {
        if (history.size() < window) {
            return null;
        }
        BigDecimal sum = BigDecimal.ZERO;
        Iterator<BigDecimal> it = history.descendingIterator();
        for (int i = 0; i < window; i++) {
            sum = sum.add(it.next());
        }
        return sum.divide(new BigDecimal(window), MA_SCALE, RoundingMode.HALF_UP);
    }

    IndicatorSnapshot last() {
        return last;
    }

    int size() {
        return history.size();
    }
}
