package com.fintech.trades.backoff;

import java.time.Duration;
import java.util.Objects;

/**
 * delay(n) = min(initialDelay * multiplier^(n-1), maxDelay).
 *
 * With the defaults (5s initial, x2, 300s cap) the sequence is
 * 5s, 10s, 20s, 40s, 80s, 160s, 300s, 300s, ...
 * Large attempt numbers saturate at the cap instead of overflowing.
 */
public final class ExponentialBackoffStrategy implements BackoffStrategy {

    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double multiplier;

    public ExponentialBackoffStrategy(Duration initialDelay, Duration maxDelay, double multiplier) {
        this.initialDelay = Objects.requireNonNull(initialDelay, "initialDelay");
        this.maxDelay = Objects.requireNonNull(maxDelay, "maxDelay");
        if (initialDelay.isNegative()) {
            throw new IllegalArgumentException("Initial delay cannot be negative: " + initialDelay);
        }
        if (maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException(
                "Max delay (" + maxDelay + ") cannot be less than initial delay (" + initialDelay + ")");
        }
        if (Double.isNaN(multiplier) || multiplier < 1.0) {
            throw new IllegalArgumentException("Multiplier must be >= 1.0, got " + multiplier);
        }
        this.multiplier = multiplier;
    }

    @Override
    public Duration getDelay(int attemptNumber) {
        BackoffStrategy.requireValidAttempt(attemptNumber);

        double nanos = initialDelay.toNanos() * Math.pow(multiplier, attemptNumber - 1);
        // Infinity and anything past the cap both saturate
        if (Double.isInfinite(nanos) || nanos >= maxDelay.toNanos()) {
            return maxDelay;
        }
        return Duration.ofNanos((long) nanos);
    }

    @Override
    public Duration getInitialDelay() {
        return initialDelay;
    }

    @Override
    public String toString() {
        return "ExponentialBackoffStrategy[initial=" + initialDelay + ", max=" + maxDelay
            + ", multiplier=" + multiplier + "]";
    }
}
