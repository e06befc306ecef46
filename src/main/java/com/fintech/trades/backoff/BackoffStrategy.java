package com.fintech.trades.backoff;

import java.time.Duration;

/**
 * Maps a 1-based failed-attempt number to the delay before the next attempt.
 * Implementations are pure: no hidden state, no I/O.
 */
public interface BackoffStrategy {

    /**
     * @param attemptNumber number of consecutive failures so far, starting at 1
     * @throws IllegalArgumentException if {@code attemptNumber < 1}
     */
    Duration getDelay(int attemptNumber);

    /** Delay returned for the first attempt. */
    Duration getInitialDelay();

    static void requireValidAttempt(int attemptNumber) {
        if (attemptNumber < 1) {
            throw new IllegalArgumentException("Attempt number must be >= 1, got " + attemptNumber);
        }
    }
}
