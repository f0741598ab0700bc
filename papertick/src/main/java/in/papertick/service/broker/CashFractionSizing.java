package in.papertick.service.broker;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Spend a fixed fraction of current cash: qty = floor(cash × fraction / price), floored to lot.
 */
public final class CashFractionSizing implements PositionSizingPolicy {

    private final BigDecimal fraction;

    public CashFractionSizing(BigDecimal fraction) {
        if (fraction.signum() <= 0 || fraction.compareTo(BigDecimal.ONE) > 0) {
            throw new IllegalArgumentException("fraction must be in (0, 1]: " + fraction);
        }
        this.fraction = fraction;
    }

    @Override
    public long quantity(BigDecimal cash, BigDecimal price, long lotSize) {
        if (cash.signum() <= 0) {
            return 0;
        }
        BigDecimal spend = cash.multiply(fraction);
        long units = spend.divide(price, 0, RoundingMode.FLOOR).longValueExact();
        return PositionSizingPolicy.floorToLot(units, lotSize);
    }
}
