package com.fintech.trades.util;

import java.util.function.Consumer;

/**
 * Read side of an observer list: consumers can register but not publish.
 */
public interface EventSource<T> {

    Registration subscribe(Consumer<? super T> observer);
}
