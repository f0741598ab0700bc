package in.papertick.domain.data;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * One price observation for a symbol.
 */
public record Tick(
    String symbol,
    BigDecimal price,
    Instant timestamp
) {
    public Tick {
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(price, "price");
        Objects.requireNonNull(timestamp, "timestamp");
        if (price.signum() <= 0) {
            throw new IllegalArgumentException("Tick price must be positive: " + symbol + "=" + price);
        }
    }
}
