package in.papertick.config;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * Already-validated configuration handed to the trading session.
 * The core never reads configuration files; the bootstrap builds this object.
 */
public record SessionConfig(
    List<String> symbols,
    Duration interval,
    ProviderConfig provider,
    StrategyConfig strategy,
    BrokerConfig broker,
    HubConfig hub
) {
    public SessionConfig {
        Objects.requireNonNull(symbols, "symbols");
        Objects.requireNonNull(interval, "interval");
        Objects.requireNonNull(provider, "provider");
        Objects.requireNonNull(strategy, "strategy");
        Objects.requireNonNull(broker, "broker");
        Objects.requireNonNull(hub, "hub");
        if (symbols.isEmpty()) {
            throw new IllegalArgumentException("At least one symbol is required");
        }
        for (String s : symbols) {
            if (s == null || s.isBlank()) {
                throw new IllegalArgumentException("Symbols must not be blank");
            }
        }
        if (new LinkedHashSet<>(symbols).size() != symbols.size()) {
            throw new IllegalArgumentException("Duplicate symbols: " + symbols);
        }
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be positive");
        }
        symbols = List.copyOf(symbols);
    }
}
