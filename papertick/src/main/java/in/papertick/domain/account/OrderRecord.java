package in.papertick.domain.account;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Outcome of the most recent BUY or SELL the broker acted on.
 * Rejected orders carry the precondition that failed in {@code reason}.
 */
public record OrderRecord(
    String orderId,
    String symbol,
    OrderSide side,
    long qty,
    BigDecimal price,
    OrderStatus status,
    String reason,
    Instant timestamp
) {
    public static OrderRecord filled(String symbol, OrderSide side, long qty, BigDecimal price, Instant ts) {
        return new OrderRecord(UUID.randomUUID().toString(), symbol, side, qty, price, OrderStatus.FILLED, "filled", ts);
    }

    public static OrderRecord rejected(String symbol, OrderSide side, long qty, BigDecimal price,
                                       String reason, Instant ts) {
        return new OrderRecord(UUID.randomUUID().toString(), symbol, side, qty, price, OrderStatus.REJECTED, reason, ts);
    }
}
