package in.papertick.infrastructure.common;

import java.time.Duration;
import java.util.Optional;

/**
 * Exponential backoff shared by the quote retries and the live feed reconnect loop.
 *
 * The delay after failure n is {@code initialDelay * multiplier^(n-1)}, capped at {@code maxDelay}.
 * After {@code maxAttempts} consecutive failures the policy gives up; {@link #reset()} starts over.
 *
 * <pre>
 * ReconnectionPolicy retry = ReconnectionPolicy.exponential(
 *     Duration.ofMillis(200), Duration.ofSeconds(2), 2.0, 3);
 * while (true) {
 *     try {
 *         return call();
 *     } catch (TransientException e) {
 *         Duration delay = retry.onFailure().orElseThrow(() -> e);
 *         Thread.sleep(delay.toMillis());
 *     }
 * }
 * </pre>
 */
public final class ReconnectionPolicy {

    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double multiplier;
    private final int maxAttempts;

    private int failures = 0;

    private ReconnectionPolicy(Duration initialDelay, Duration maxDelay, double multiplier, int maxAttempts) {
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
        this.multiplier = multiplier;
        this.maxAttempts = maxAttempts;
    }

    public static ReconnectionPolicy exponential(Duration initialDelay, Duration maxDelay,
                                                 double multiplier, int maxAttempts) {
        if (initialDelay.isNegative() || initialDelay.isZero()) {
            throw new IllegalArgumentException("initialDelay must be positive");
        }
        if (initialDelay.compareTo(maxDelay) > 0) {
            throw new IllegalArgumentException("initialDelay " + initialDelay + " exceeds maxDelay " + maxDelay);
        }
        if (multiplier <= 1.0) {
            throw new IllegalArgumentException("multiplier must be > 1.0: " + multiplier);
        }
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive: " + maxAttempts);
        }
        return new ReconnectionPolicy(initialDelay, maxDelay, multiplier, maxAttempts);
    }

    /**
     * Reconnect loop of the live feed client: 500ms doubling up to 30s, never gives up.
     */
    public static ReconnectionPolicy forLiveFeed() {
        return exponential(Duration.ofMillis(500), Duration.ofSeconds(30), 2.0, Integer.MAX_VALUE);
    }

    /**
     * Count a failed attempt.
     *
     * @return how long to wait before the next attempt, or empty once attempts are used up
     */
    public synchronized Optional<Duration> onFailure() {
        if (failures < Integer.MAX_VALUE) {
            failures++;
        }
        if (failures >= maxAttempts) {
            return Optional.empty();
        }
        return Optional.of(delayAfter(failures));
    }

    /**
     * Forget past failures, after a success or a server-announced restart.
     */
    public synchronized void reset() {
        failures = 0;
    }

    public synchronized int failures() {
        return failures;
    }

    public synchronized boolean isExhausted() {
        return failures >= maxAttempts;
    }

    Duration delayAfter(int failure) {
        double millis = initialDelay.toMillis() * Math.pow(multiplier, failure - 1);
        return millis >= maxDelay.toMillis() ? maxDelay : Duration.ofMillis((long) millis);
    }
}
