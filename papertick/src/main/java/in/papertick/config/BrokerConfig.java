package in.papertick.config;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Paper account settings.
 *
 * @param cashFraction   share of current cash spent per BUY when sizing is CASH_FRACTION
 * @param fixedQty       units bought per BUY when sizing is FIXED_QTY
 * @param lotSize        quantities are floored to a multiple of this
 * @param allowAveraging whether a BUY may add to an already open position
 */
public record BrokerConfig(
    BigDecimal startingCash,
    SizingType sizing,
    BigDecimal cashFraction,
    long fixedQty,
    long lotSize,
    boolean allowAveraging
) {
    public enum SizingType {
        CASH_FRACTION,
        FIXED_QTY
    }

    public BrokerConfig {
        Objects.requireNonNull(startingCash, "startingCash");
        Objects.requireNonNull(sizing, "sizing");
        Objects.requireNonNull(cashFraction, "cashFraction");
        if (startingCash.signum() < 0) {
            throw new IllegalArgumentException("startingCash cannot be negative: " + startingCash);
        }
        if (cashFraction.signum() <= 0 || cashFraction.compareTo(BigDecimal.ONE) > 0) {
            throw new IllegalArgumentException("cashFraction must be in (0, 1]: " + cashFraction);
        }
        if (sizing == SizingType.FIXED_QTY && fixedQty <= 0) {
            throw new IllegalArgumentException("fixedQty must be positive: " + fixedQty);
        }
        if (lotSize <= 0) {
            throw new IllegalArgumentException("lotSize must be positive: " + lotSize);
        }
    }

    public static BrokerConfig defaults() {
        return new BrokerConfig(new BigDecimal("100000"), SizingType.CASH_FRACTION,
            new BigDecimal("0.5"), 0, 1, false);
    }
}
