package com.fintech.trades.storage;

import com.fintech.trades.domain.Symbol;
import com.fintech.trades.domain.Trade;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Trades of a single symbol plus the set of trade ids seen so far.
 *
 * Trades are kept in ascending timestamp order. Appends that arrive in order keep
 * the list sorted; an out-of-order append marks it dirty and the next read re-sorts
 * it. The sort is stable, so among equal timestamps the later arrival is returned
 * first by the descending queries.
 *
 * All access goes through this object's monitor.
 */
final class CachedTrades {

    private static final Comparator<Trade> BY_TIMESTAMP = Comparator.comparing(Trade::timestamp);

    private final Symbol symbol;
    private final List<Trade> trades = new ArrayList<>();
    private final Set<String> tradeIds = new HashSet<>();
    private boolean sorted = true;

    CachedTrades(Symbol symbol) {
        this.symbol = symbol;
    }

    synchronized boolean tryAdd(Trade trade) {
        if (trade.symbol() != symbol) {
            throw new IllegalArgumentException(
                "Trade for " + trade.symbol() + " added to cache of " + symbol);
        }
        if (!tradeIds.add(trade.tradeId())) {
            return false;
        }
        if (sorted && !trades.isEmpty()
                && trade.timestamp().isBefore(trades.get(trades.size() - 1).timestamp())) {
            sorted = false;
        }
        trades.add(trade);
        return true;
    }

    synchronized List<Trade> getRecent(int count) {
        return collectDescending(count, null, null);
    }

    synchronized List<Trade> getRecent(int count, Instant before) {
        return collectDescending(count, before, null);
    }

    synchronized List<Trade> getSince(int count, Instant after) {
        return collectDescending(count, null, after);
    }

    synchronized int size() {
        return trades.size();
    }

    synchronized void clear() {
        trades.clear();
        tradeIds.clear();
        sorted = true;
    }

    /**
     * Walks from the newest trade backwards. Trades at or after {@code before} are
     * skipped; the walk stops at the first trade at or before {@code after}.
     */
    private List<Trade> collectDescending(int count, Instant before, Instant after) {
        if (count == 0 || trades.isEmpty()) {
            return List.of();
        }
        ensureSorted();

        List<Trade> result = new ArrayList<>(Math.min(count, trades.size()));
        for (int i = trades.size() - 1; i >= 0 && result.size() < count; i--) {
            Trade trade = trades.get(i);
            if (after != null && !trade.timestamp().isAfter(after)) {
                break;
            }
            if (before != null && !trade.timestamp().isBefore(before)) {
                continue;
            }
            result.add(trade);
        }
        return List.copyOf(result);
    }

    private void ensureSorted() {
        if (!sorted) {
            trades.sort(BY_TIMESTAMP);
            sorted = true;
        }
    }
}
