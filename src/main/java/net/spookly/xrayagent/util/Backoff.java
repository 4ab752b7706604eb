package net.spookly.xrayagent.util;

import java.time.Duration;

/**
 * Exponential backoff schedule capped at a maximum delay.
 */
public final class Backoff {
    private final long initialMillis;
    private final long maxMillis;
    private final double multiplier;

    public Backoff(Duration initial, Duration max) {
        this(initial, max, 2.0);
    }

    public Backoff(Duration initial, Duration max, double multiplier) {
        if (initial.isNegative() || initial.isZero()) {
            throw new IllegalArgumentException("initial backoff must be positive");
        }
        if (max.compareTo(initial) < 0) {
            throw new IllegalArgumentException("max backoff must be >= initial backoff");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1");
        }
        this.initialMillis = initial.toMillis();
        this.maxMillis = max.toMillis();
        this.multiplier = multiplier;
    }

    /**
     * Delay before the given retry, where attempt 0 is the first retry.
     */
    public Duration delayFor(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must be >= 0");
        }
        double delay = initialMillis;
        for (int i = 0; i < attempt && delay < maxMillis; i++) {
            delay *= multiplier;
        }
        return Duration.ofMillis((long) Math.min(delay, maxMillis));
    }
}
