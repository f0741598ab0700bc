package in.papertick.service.indicator;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Incremental RSI with Wilder's smoothing.
 *
 * Calculation Method:
 * - gain = max(change, 0), loss = max(-change, 0) for each price change
 * - avg_t = ((avg_{t-1} × (n-1)) + x_t) / n, seeded at 0 from the first change
 * - RSI = 100 - 100 / (1 + avgGain / avgLoss)
 *
 * A sample is one price change, so the value is defined once {@code period}
 * changes (period + 1 prices) have been seen. Cost per update is O(1).
 */
final class WilderRsi {

    private static final BigDecimal HUNDRED = new BigDecimal("100");
    private static final BigDecimal FIFTY = new BigDecimal("50");
    private static final int WORK_SCALE = 10;
    private static final int OUT_SCALE = 6;

    private final int period;
    private final BigDecimal periodDec;
    private final BigDecimal weightPrev;

    private BigDecimal prevPrice;
    private BigDecimal avgGain = BigDecimal.ZERO;
    private BigDecimal avgLoss = BigDecimal.ZERO;
    private int samples;

    WilderRsi(int period) {
        if (period <= 0) {
            throw new IllegalArgumentException("RSI period must be positive: " + period);
        }
        this.period = period;
        this.periodDec = new BigDecimal(period);
        this.weightPrev = new BigDecimal(period - 1);
    }

    /**
     * Feed one price.
     *
     * @return RSI in [0, 100], or null while fewer than {@code period} changes were seen
     */
    BigDecimal update(BigDecimal price) {
        if (prevPrice == null) {
            prevPrice = price;
            return null;
        }

        BigDecimal change = price.subtract(prevPrice);
        prevPrice = price;

        BigDecimal gain = change.max(BigDecimal.ZERO);
        BigDecimal loss = change.negate().max(BigDecimal.ZERO);

        avgGain = smooth(avgGain, gain);
        avgLoss = smooth(avgLoss, loss);
        samples++;

        if (samples < period) {
            return null;
        }
        return value();
    }

    private BigDecimal smooth(BigDecimal prevAvg, BigDecimal x) {
        return prevAvg.multiply(weightPrev).add(x).divide(periodDec, WORK_SCALE, RoundingMode.HALF_UP);
    }

    private BigDecimal value() {
        if (avgLoss.signum() == 0) {
            // flat series has no momentum either way
            return avgGain.signum() > 0 ? HUNDRED.setScale(OUT_SCALE) : FIFTY.setScale(OUT_SCALE);
        }
        BigDecimal rs = avgGain.divide(avgLoss, WORK_SCALE, RoundingMode.HALF_UP);
        BigDecimal rsi = HUNDRED.subtract(HUNDRED.divide(BigDecimal.ONE.add(rs), WORK_SCALE, RoundingMode.HALF_UP));
        return rsi.setScale(OUT_SCALE, RoundingMode.HALF_UP);
    }
}
