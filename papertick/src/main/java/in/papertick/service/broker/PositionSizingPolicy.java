package in.papertick.service.broker;

import in.papertick.config.BrokerConfig;

import java.math.BigDecimal;

/**
 * Decides how many units a BUY should request.
 */
public interface PositionSizingPolicy {

    /**
     * @param cash    cash available before the order
     * @param price   execution price, positive
     * @param lotSize result must be a multiple of this
     * @return units to buy, 0 when nothing affordable
     */
    long quantity(BigDecimal cash, BigDecimal price, long lotSize);

    static PositionSizingPolicy from(BrokerConfig cfg) {
        return switch (cfg.sizing()) {
            case CASH_FRACTION -> new CashFractionSizing(cfg.cashFraction());
            case FIXED_QTY -> new FixedQuantitySizing(cfg.fixedQty());
        };
    }

    static long floorToLot(long qty, long lotSize) {
        return (qty / lotSize) * lotSize;
    }
}
