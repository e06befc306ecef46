package com.fintech.trades.backoff;

import com.fintech.trades.util.CancellationToken;

import java.time.Duration;
import java.util.concurrent.CancellationException;

/**
 * Sleep seam used between retry attempts. Tests substitute an implementation
 * that records requested delays and returns immediately.
 */
@FunctionalInterface
public interface DelayProvider {

    /**
     * Sleeps for {@code delay} unless the token is cancelled first.
     *
     * @throws CancellationException if the token is cancelled before or during the sleep
     * @throws InterruptedException if the calling thread is interrupted
     */
    void delay(Duration delay, CancellationToken token) throws InterruptedException;

    /** Real-time sleep that wakes as soon as the token is cancelled. */
    static DelayProvider system() {
        return (delay, token) -> {
            token.throwIfCancellationRequested();
            if (token.await(delay)) {
                throw new CancellationException("Delay cancelled");
            }
        };
    }
}
