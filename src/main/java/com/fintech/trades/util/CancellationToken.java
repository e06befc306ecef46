package com.fintech.trades.util;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Lifetime-scoped cancellation signal shared by connect attempts, backoff sleeps
 * and the upstream reader.
 *
 * A token is cancelled at most once. Waiting via {@link #await(Duration)} returns
 * early as soon as the token is cancelled, which lets a stop abort a long backoff
 * sleep immediately.
 */
public final class CancellationToken {

    private static final CancellationToken NONE = new CancellationToken();

    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

    /** Token that is never cancelled. */
    public static CancellationToken none() {
        return NONE;
    }

    public void cancel() {
        if (this == NONE) {
            throw new IllegalStateException("The shared non-cancellable token cannot be cancelled");
        }
        synchronized (callbacks) {
            if (cancelled.getCount() == 0) {
                return;
            }
            cancelled.countDown();
        }
        callbacks.forEach(Runnable::run);
        callbacks.clear();
    }

    public boolean isCancellationRequested() {
        return cancelled.getCount() == 0;
    }

    /**
     * @throws CancellationException if cancellation has been requested
     */
    public void throwIfCancellationRequested() {
        if (isCancellationRequested()) {
            throw new CancellationException("Operation was cancelled");
        }
    }

    /**
     * Waits up to {@code timeout} for cancellation.
     *
     * @return true if the token was cancelled before the timeout elapsed
     */
    public boolean await(Duration timeout) throws InterruptedException {
        return cancelled.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    /**
     * Registers a callback run once on cancellation. Runs immediately if already cancelled.
     */
    public Registration onCancel(Runnable callback) {
        synchronized (callbacks) {
            if (cancelled.getCount() != 0) {
                callbacks.add(callback);
                return () -> callbacks.remove(callback);
            }
        }
        callback.run();
        return Registration.EMPTY;
    }

    @Override
    public String toString() {
        return "CancellationToken[cancelled=" + isCancellationRequested() + "]";
    }
}
