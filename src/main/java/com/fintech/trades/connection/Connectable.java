package com.fintech.trades.connection;

import com.fintech.trades.util.CancellationToken;

/**
 * Something that holds a single live connection which can be (re)established.
 */
public interface Connectable {

    /** Live connectivity, re-evaluated on every call. */
    boolean isConnected();

    /**
     * Establishes the connection. Any exception other than a cancellation caused by
     * {@code token} is treated by callers as a retryable failure.
     */
    void connect(CancellationToken token) throws Exception;

    /**
     * Closes the connection gracefully and releases everything the last connect
     * acquired. Safe to call when not connected.
     */
    void disconnect(CancellationToken token) throws Exception;
}
