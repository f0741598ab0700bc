package in.papertick.service.broker;

import java.math.BigDecimal;

/**
 * Always request the same number of units; the broker rejects it if cash is short.
 */
public final class FixedQuantitySizing implements PositionSizingPolicy {

    private final long qty;

    public FixedQuantitySizing(long qty) {
        if (qty <= 0) {
            throw new IllegalArgumentException("qty must be positive: " + qty);
        }
        this.qty = qty;
    }

    @Override
    public long quantity(BigDecimal cash, BigDecimal price, long lotSize) {
        return PositionSizingPolicy.floorToLot(qty, lotSize);
    }
}
