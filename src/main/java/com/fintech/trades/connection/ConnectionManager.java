package com.fintech.trades.connection;

import com.fintech.trades.backoff.BackoffStrategy;
import com.fintech.trades.backoff.DelayProvider;
import com.fintech.trades.backoff.RetryConnector;
import com.fintech.trades.util.CancellationToken;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the connection lifecycle of a {@link Connectable}: connects, retries with
 * backoff forever until success or cancellation, and disconnects on stop.
 *
 * Guarantees:
 * - start is single-flight: concurrent callers never overlap connect attempts,
 *   and a caller that waited for another start returns once that start connected
 * - the backoff delay is reset to the initial delay on every start and after every
 *   successful connect
 * - connectivity is never cached; {@link #isConnected()} asks the connectable
 * - cancellation of the caller's token ends a start normally, never with an exception
 */
public class ConnectionManager {

    private static final Logger log = LoggerFactory.getLogger(ConnectionManager.class);
    private static final long LOCK_POLL_MILLIS = 50;

    private final Connectable connectable;
    private final BackoffStrategy backoffStrategy;
    private final RetryConnector retryConnector;
    private final ReentrantLock startLock = new ReentrantLock();
    private final AtomicBoolean connecting = new AtomicBoolean(false);
    private final ExecutorService reconnectExecutor;

    private volatile Duration currentBackoffDelay;

    // Prometheus metrics
    private final AtomicLong connectAttempts = new AtomicLong(0);
    private final AtomicLong connectFailures = new AtomicLong(0);
    private final AtomicLong successfulConnects = new AtomicLong(0);

    public ConnectionManager(
            Connectable connectable,
            BackoffStrategy backoffStrategy,
            DelayProvider delayProvider,
            MeterRegistry meterRegistry) {
        this.connectable = Objects.requireNonNull(connectable, "connectable");
        this.backoffStrategy = Objects.requireNonNull(backoffStrategy, "backoffStrategy");
        this.retryConnector = new RetryConnector(backoffStrategy, delayProvider);
        this.currentBackoffDelay = backoffStrategy.getInitialDelay();
        this.reconnectExecutor = Executors.newSingleThreadExecutor(new ReconnectThreadFactory());

        meterRegistry.gauge("trades.connection.attempts", connectAttempts);
        meterRegistry.gauge("trades.connection.failures", connectFailures);
        meterRegistry.gauge("trades.connection.successes", successfulConnects);
        meterRegistry.gauge("trades.connection.connected", this, manager -> manager.isConnected() ? 1 : 0);
    }

    /**
     * Connects unless already connected, retrying with backoff until success or
     * until {@code token} is cancelled. Returns normally in both cases.
     */
    public void start(CancellationToken token) {
        Objects.requireNonNull(token, "token");
        if (connectable.isConnected()) {
            log.debug("Start requested while already connected");
            return;
        }

        if (!acquireStartLock(token)) {
            return;
        }
        try {
            // Another caller may have connected while we waited for the lock
            if (connectable.isConnected()) {
                return;
            }

            currentBackoffDelay = backoffStrategy.getInitialDelay();
            connecting.set(true);
            log.info("Connecting to upstream feed");

            retryConnector.executeWithRetry(() -> {
                connectAttempts.incrementAndGet();
                connectable.connect(token);
                return null;
            }, token, (attempt, nextDelay, cause) -> {
                connectFailures.incrementAndGet();
                currentBackoffDelay = nextDelay;
                log.warn("Connection attempt {} failed: {}. Retrying in {}s",
                    attempt, cause.getMessage(), nextDelay.toMillis() / 1000.0);
            });

            successfulConnects.incrementAndGet();
            currentBackoffDelay = backoffStrategy.getInitialDelay();
            log.info("Connected to upstream feed");

        } catch (CancellationException e) {
            log.info("Connection attempts cancelled");
        } finally {
            connecting.set(false);
            startLock.unlock();
        }
    }

    /**
     * Runs {@link #start(CancellationToken)} on the manager's reconnect thread.
     * Used after a connection loss, where the caller is the transport's own thread.
     */
    public CompletableFuture<Void> startAsync(CancellationToken token) {
        return CompletableFuture.runAsync(() -> start(token), reconnectExecutor);
    }

    /**
     * Releases the connectable, also when the connection was already lost, so that
     * its receive loop ends and a lost connection is forgotten. A failing disconnect
     * is logged, not thrown.
     */
    public void stop(CancellationToken token) {
        try {
            connectable.disconnect(token);
            log.info("Disconnected from upstream feed");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while disconnecting from upstream feed");
        } catch (Exception e) {
            log.warn("Error while disconnecting from upstream feed: {}", e.getMessage(), e);
        }
    }

    public boolean isConnected() {
        return connectable.isConnected();
    }

    public ConnectionState getState() {
        if (connectable.isConnected()) {
            return ConnectionState.CONNECTED;
        }
        return connecting.get() ? ConnectionState.CONNECTING : ConnectionState.DISCONNECTED;
    }

    public Duration getCurrentBackoffDelay() {
        return currentBackoffDelay;
    }

    /** Stops the reconnect thread. Called by the container on shutdown. */
    public void shutdown() {
        reconnectExecutor.shutdownNow();
        try {
            if (!reconnectExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Reconnect thread did not terminate within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Waits for the start lock while watching the token.
     *
     * @return false if the token was cancelled or the thread interrupted first
     */
    private boolean acquireStartLock(CancellationToken token) {
        try {
            while (!startLock.tryLock(LOCK_POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                if (token.isCancellationRequested()) {
                    log.info("Start cancelled while waiting for a connect in progress");
                    return false;
                }
            }
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Interrupted while waiting for a connect in progress");
            return false;
        }
    }

    private static final class ReconnectThreadFactory implements java.util.concurrent.ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger(0);

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r);
            thread.setName("connection-reconnect-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
