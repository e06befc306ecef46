package com.fintech.trades.backoff;

import java.time.Duration;

/**
 * Configurable backoff algorithms.
 */
public enum BackoffType {
    EXPONENTIAL,
    LINEAR;

    public BackoffStrategy create(Duration initialDelay, Duration maxDelay, double multiplier) {
        return switch (this) {
            case EXPONENTIAL -> new ExponentialBackoffStrategy(initialDelay, maxDelay, multiplier);
            case LINEAR -> new LinearBackoffStrategy(initialDelay, maxDelay);
        };
    }
}
