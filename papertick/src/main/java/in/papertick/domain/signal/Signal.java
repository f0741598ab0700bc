package in.papertick.domain.signal;

import java.time.Instant;
import java.util.Objects;

/**
 * Strategy output for one tick.
 *
 * @param reason trigger name followed by the values that caused it,
 *               e.g. {@code ma_cross_up ma_short=11.000000 ma_long=10.666667}
 */
public record Signal(
    String symbol,
    SignalKind kind,
    String reason,
    Instant timestamp
) {
    public Signal {
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(reason, "reason");
        Objects.requireNonNull(timestamp, "timestamp");
    }

    public static Signal hold(String symbol, String reason, Instant timestamp) {
        return new Signal(symbol, SignalKind.HOLD, reason, timestamp);
    }

    public boolean isActionable() {
        return kind != SignalKind.HOLD;
    }
}
