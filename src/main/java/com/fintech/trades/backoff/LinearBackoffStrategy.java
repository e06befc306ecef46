package com.fintech.trades.backoff;

import java.time.Duration;
import java.util.Objects;

/**
 * delay(n) = min(initialDelay * n, maxDelay).
 */
public final class LinearBackoffStrategy implements BackoffStrategy {

    private final Duration initialDelay;
    private final Duration maxDelay;

    public LinearBackoffStrategy(Duration initialDelay, Duration maxDelay) {
        this.initialDelay = Objects.requireNonNull(initialDelay, "initialDelay");
        this.maxDelay = Objects.requireNonNull(maxDelay, "maxDelay");
        if (initialDelay.isNegative()) {
            throw new IllegalArgumentException("Initial delay cannot be negative: " + initialDelay);
        }
        if (maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException(
                "Max delay (" + maxDelay + ") cannot be less than initial delay (" + initialDelay + ")");
        }
    }

    @Override
    public Duration getDelay(int attemptNumber) {
        BackoffStrategy.requireValidAttempt(attemptNumber);

        long initialNanos = initialDelay.toNanos();
        if (initialNanos != 0 && attemptNumber > maxDelay.toNanos() / initialNanos) {
            return maxDelay;
        }
        Duration delay = initialDelay.multipliedBy(attemptNumber);
        return delay.compareTo(maxDelay) > 0 ? maxDelay : delay;
    }

    @Override
    public Duration getInitialDelay() {
        return initialDelay;
    }

    @Override
    public String toString() {
        return "LinearBackoffStrategy[initial=" + initialDelay + ", max=" + maxDelay + "]";
    }
}
