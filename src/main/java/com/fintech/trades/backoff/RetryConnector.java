package com.fintech.trades.backoff;

import com.fintech.trades.util.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;

/**
 * Runs an action until it succeeds or the token is cancelled, sleeping between
 * failures as dictated by a {@link BackoffStrategy}.
 *
 * There is no maximum attempt count. Cancellation, whether observed before an
 * attempt, raised by the action itself or raised during the sleep, terminates
 * the loop with {@link CancellationException} and is never retried.
 */
public class RetryConnector {

    private static final Logger log = LoggerFactory.getLogger(RetryConnector.class);

    private final BackoffStrategy backoffStrategy;
    private final DelayProvider delayProvider;

    public RetryConnector(BackoffStrategy backoffStrategy) {
        this(backoffStrategy, DelayProvider.system());
    }

    public RetryConnector(BackoffStrategy backoffStrategy, DelayProvider delayProvider) {
        this.backoffStrategy = Objects.requireNonNull(backoffStrategy, "backoffStrategy");
        this.delayProvider = Objects.requireNonNull(delayProvider, "delayProvider");
    }

    public <T> T executeWithRetry(Callable<T> action, CancellationToken token) {
        return executeWithRetry(action, token, RetryListener.NONE);
    }

    /**
     * @return the action's result from the first successful attempt
     * @throws CancellationException when the token is cancelled or the thread is interrupted
     */
    public <T> T executeWithRetry(Callable<T> action, CancellationToken token, RetryListener listener) {
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(token, "token");

        int attempt = 0;
        while (true) {
            token.throwIfCancellationRequested();
            try {
                return action.call();
            } catch (CancellationException e) {
                if (token.isCancellationRequested()) {
                    throw e;
                }
                // Cancelled by something other than our caller: an ordinary failure
                attempt = onFailure(++attempt, e, token, listener);
            } catch (InterruptedException e) {
                throw interrupted(e);
            } catch (Exception e) {
                if (token.isCancellationRequested()) {
                    throw cancelled(e);
                }
                attempt = onFailure(++attempt, e, token, listener);
            }
        }
    }

    private int onFailure(int attempt, Exception cause, CancellationToken token, RetryListener listener) {
        Duration delay = backoffStrategy.getDelay(attempt);
        listener.onRetry(attempt, delay, cause);
        log.debug("Attempt {} failed ({}), retrying in {}", attempt, cause.toString(), delay);
        try {
            delayProvider.delay(delay, token);
        } catch (InterruptedException e) {
            throw interrupted(e);
        }
        return attempt;
    }

    private static CancellationException interrupted(InterruptedException e) {
        Thread.currentThread().interrupt();
        return cancelled(e);
    }

    private static CancellationException cancelled(Exception cause) {
        CancellationException cancellation = new CancellationException("Retry cancelled");
        cancellation.initCause(cause);
        return cancellation;
    }

    /**
     * Notified after each failed attempt, before the backoff sleep.
     */
    @FunctionalInterface
    public interface RetryListener {

        RetryListener NONE = (attempt, delay, cause) -> { };

        void onRetry(int attempt, Duration nextDelay, Exception cause);
    }
}
