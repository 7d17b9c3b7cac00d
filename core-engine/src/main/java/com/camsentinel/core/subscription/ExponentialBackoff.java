package com.camsentinel.core.subscription;

import java.time.Duration;
import java.util.Objects;

/**
 * Reconnect delay that doubles on every consecutive failure up to a cap.
 *
 * <p>
 * Not thread-safe; each pipeline owns its own instance.
 * </p>
 */
public class ExponentialBackoff {

    private final Duration base;
    private final Duration max;
    private int failures;

    /**
     * @param base delay after the first failure
     * @param max  upper bound for any delay
     * @throws IllegalArgumentException if {@code base} is not positive or
     *                                  {@code max} is smaller than {@code base}
     */
    public ExponentialBackoff(Duration base, Duration max) {
        this.base = Objects.requireNonNull(base, "base must not be null");
        this.max = Objects.requireNonNull(max, "max must not be null");
        if (base.isZero() || base.isNegative()) {
            throw new IllegalArgumentException("base must be > 0, got: " + base);
        }
        if (max.compareTo(base) < 0) {
            throw new IllegalArgumentException("max must be >= base, got: " + max);
        }
    }

    /**
     * Record a failure and return how long to wait before the next attempt.
     *
     * @return the delay for this failure
     */
    public Duration nextDelay() {
        failures++;
        // Shift is capped so the multiplication cannot overflow
        int shift = Math.min(failures - 1, 30);
        long millis = base.toMillis() * (1L << shift);
        if (millis <= 0 || millis > max.toMillis()) {
            return max;
        }
        return Duration.ofMillis(millis);
    }

    /** @return consecutive failures since the last {@link #reset()} */
    public int failures() {
        return failures;
    }

    public void reset() {
        failures = 0;
    }
}
