package com.fintech.trades.storage;

import com.fintech.trades.domain.Symbol;
import com.fintech.trades.domain.Trade;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Per-symbol store of recent trades, deduplicated by trade id.
 *
 * All query results are ordered by timestamp descending (most recent first),
 * independent of the order trades were added in. Time bounds are strict.
 * A negative {@code count} is rejected with {@link IllegalArgumentException};
 * an unknown symbol yields an empty list.
 */
public interface TradeCache {

    /**
     * Adds a trade unless its id is already cached for the symbol.
     *
     * @return true if the trade was added, false for a duplicate
     */
    boolean tryAdd(Trade trade);

    /** Up to {@code count} most recent trades. */
    List<Trade> getRecent(Symbol symbol, int count);

    /** Up to {@code count} most recent trades with {@code timestamp < before}. */
    List<Trade> getRecent(Symbol symbol, int count, Instant before);

    /** Up to {@code count} most recent trades with {@code timestamp > after}. */
    List<Trade> getSince(Symbol symbol, int count, Instant after);

    /** Drops all trades and seen ids for the symbol. Idempotent. */
    void clear(Symbol symbol);

    int count(Symbol symbol);

    /** Cached trade count per symbol that has at least one trade. */
    Map<Symbol, Integer> counts();
}
