package com.fintech.trades.util;

/**
 * Handle returned when registering an observer or callback. Closing it removes
 * the registration; closing twice is harmless.
 */
@FunctionalInterface
public interface Registration extends AutoCloseable {

    Registration EMPTY = () -> { };

    void remove();

    @Override
    default void close() {
        remove();
    }
}
