package in.papertick.domain.account;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Open quantity and cost-basis average price for one symbol.
 */
public record Position(
    String symbol,
    long qty,
    BigDecimal avgPrice
) {
    public Position {
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(avgPrice, "avgPrice");
        if (qty < 0) {
            throw new IllegalArgumentException("Position qty cannot be negative: " + qty);
        }
        if (avgPrice.signum() < 0) {
            throw new IllegalArgumentException("Position avgPrice cannot be negative: " + avgPrice);
        }
    }

    public static Position flat(String symbol) {
        return new Position(symbol, 0, BigDecimal.ZERO);
    }

    public boolean isOpen() {
        return qty > 0;
    }
}
