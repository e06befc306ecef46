package com.fintech.trades.connection;

/**
 * DISCONNECTED -> CONNECTING -> CONNECTED -> (loss) CONNECTING -> ... -> (stop) DISCONNECTED
 */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED
}
