package in.papertick.infrastructure.common;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Enforces a minimum spacing between calls across all threads.
 *
 * Each caller reserves the next free slot under the lock and sleeps outside it,
 * so waiting callers do not hold the monitor.
 */
public final class MinIntervalRateLimiter {

    private final long minSpacingNanos;
    private long nextFreeAt = Long.MIN_VALUE;

    public MinIntervalRateLimiter(Duration minSpacing) {
        if (minSpacing.isNegative()) {
            throw new IllegalArgumentException("minSpacing cannot be negative");
        }
        this.minSpacingNanos = minSpacing.toNanos();
    }

    /**
     * Block until this caller's slot arrives.
     *
     * @return nanoseconds spent waiting
     */
    public long acquire() throws InterruptedException {
        long waitNanos;
        synchronized (this) {
            long now = System.nanoTime();
            long slot = nextFreeAt == Long.MIN_VALUE ? now : Math.max(now, nextFreeAt);
            nextFreeAt = slot + minSpacingNanos;
            waitNanos = slot - now;
        }
        if (waitNanos > 0) {
            TimeUnit.NANOSECONDS.sleep(waitNanos);
        }
        return Math.max(0, waitNanos);
    }

    public Duration minSpacing() {
        return Duration.ofNanos(minSpacingNanos);
    }
}
