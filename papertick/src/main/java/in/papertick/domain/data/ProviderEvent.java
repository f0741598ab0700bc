package in.papertick.domain.data;

import java.time.Instant;
import java.util.Objects;

/**
 * Result of one provider call: either a tick or a tick-level error for the symbol.
 */
public record ProviderEvent(
    String symbol,
    Tick tick,
    String error,
    Instant timestamp
) {
    public ProviderEvent {
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(timestamp, "timestamp");
        if ((tick == null) == (error == null)) {
            throw new IllegalArgumentException("Exactly one of tick or error must be set");
        }
    }

    public static ProviderEvent ofTick(Tick tick) {
        return new ProviderEvent(tick.symbol(), tick, null, tick.timestamp());
    }

    public static ProviderEvent ofError(String symbol, String error) {
        return new ProviderEvent(symbol, null, error, Instant.now());
    }

    public boolean isError() {
        return error != null;
    }
}
