package in.papertick.domain.signal;

import java.math.BigDecimal;

/**
 * Indicator values after a tick. A {@code null} component means "not enough samples yet".
 */
public record IndicatorSnapshot(
    BigDecimal maShort,
    BigDecimal maLong,
    BigDecimal rsi
) {
    public static final IndicatorSnapshot EMPTY = new IndicatorSnapshot(null, null, null);

    public boolean hasMovingAverages() {
        return maShort != null && maLong != null;
    }

    public boolean hasRsi() {
        return rsi != null;
    }
}
