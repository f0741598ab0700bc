package in.papertick.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Broadcast hub limits.
 *
 * @param queueCapacity    per-session outbound queue bound
 * @param keepaliveTimeout sessions silent for longer than this are dropped
 */
public record HubConfig(
    int queueCapacity,
    Duration keepaliveTimeout
) {
    public HubConfig {
        Objects.requireNonNull(keepaliveTimeout, "keepaliveTimeout");
        if (queueCapacity <= 0) {
            throw new IllegalArgumentException("queueCapacity must be positive: " + queueCapacity);
        }
        if (keepaliveTimeout.isNegative() || keepaliveTimeout.isZero()) {
            throw new IllegalArgumentException("keepaliveTimeout must be positive");
        }
    }

    public static HubConfig defaults() {
        return new HubConfig(256, Duration.ofSeconds(60));
    }
}
