package in.papertick.config;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Objects;

/**
 * Market data provider selection and per-variant settings.
 */
public record ProviderConfig(
    ProviderType type,
    Simulated simulated,
    PolledHttp polledHttp
) {
    public enum ProviderType {
        SIMULATED,
        POLLED_HTTP
    }

    public ProviderConfig {
        Objects.requireNonNull(type, "provider type");
        if (type == ProviderType.SIMULATED && simulated == null) {
            throw new IllegalArgumentException("SIMULATED provider requires simulated settings");
        }
        if (type == ProviderType.POLLED_HTTP && polledHttp == null) {
            throw new IllegalArgumentException("POLLED_HTTP provider requires polledHttp settings");
        }
    }

    public static ProviderConfig simulated(Simulated simulated) {
        return new ProviderConfig(ProviderType.SIMULATED, simulated, null);
    }

    public static ProviderConfig polledHttp(PolledHttp polledHttp) {
        return new ProviderConfig(ProviderType.POLLED_HTTP, null, polledHttp);
    }

    /**
     * Geometric random walk settings. {@code seed == null} means non-deterministic.
     */
    public record Simulated(
        BigDecimal startPrice,
        double drift,
        double volatility,
        Long seed
    ) {
        public Simulated {
            Objects.requireNonNull(startPrice, "startPrice");
            if (startPrice.signum() <= 0) {
                throw new IllegalArgumentException("startPrice must be positive: " + startPrice);
            }
            if (volatility < 0 || Double.isNaN(volatility)) {
                throw new IllegalArgumentException("volatility must be >= 0: " + volatility);
            }
            if (Double.isNaN(drift) || Double.isInfinite(drift)) {
                throw new IllegalArgumentException("drift must be finite: " + drift);
            }
        }

        public static Simulated defaults() {
            return new Simulated(new BigDecimal("100.00"), 0.0, 0.01, null);
        }
    }

    /**
     * Polled quote endpoint settings.
     *
     * @param minSpacing minimum gap between two upstream calls, shared by all symbols
     * @param apiKey     optional credential sent as a header, may be null
     */
    public record PolledHttp(
        String baseUrl,
        Duration timeout,
        Duration minSpacing,
        int maxRetries,
        Duration retryInitialDelay,
        Duration retryMaxDelay,
        String apiKey
    ) {
        public PolledHttp {
            Objects.requireNonNull(baseUrl, "baseUrl");
            Objects.requireNonNull(timeout, "timeout");
            Objects.requireNonNull(minSpacing, "minSpacing");
            Objects.requireNonNull(retryInitialDelay, "retryInitialDelay");
            Objects.requireNonNull(retryMaxDelay, "retryMaxDelay");
            if (baseUrl.isBlank()) {
                throw new IllegalArgumentException("baseUrl must not be blank");
            }
            if (timeout.isNegative() || timeout.isZero()) {
                throw new IllegalArgumentException("timeout must be positive");
            }
            if (minSpacing.isNegative()) {
                throw new IllegalArgumentException("minSpacing cannot be negative");
            }
            if (maxRetries < 0) {
                throw new IllegalArgumentException("maxRetries cannot be negative: " + maxRetries);
            }
            if (retryInitialDelay.isNegative() || retryInitialDelay.isZero()
                || retryInitialDelay.compareTo(retryMaxDelay) > 0) {
                throw new IllegalArgumentException("Require 0 < retryInitialDelay <= retryMaxDelay");
            }
        }

        public static PolledHttp defaults(String baseUrl) {
            return new PolledHttp(baseUrl, Duration.ofSeconds(5), Duration.ofMillis(500), 2,
                Duration.ofMillis(200), Duration.ofSeconds(2), null);
        }
    }
}
