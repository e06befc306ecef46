package com.fintech.trades.storage;

import com.fintech.trades.domain.Symbol;
import com.fintech.trades.domain.Trade;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Heap-resident {@link TradeCache}.
 *
 * Per-symbol containers are created lazily on the first trade and only removed by
 * {@link #clear(Symbol)}. There is no retention limit: trades live for the lifetime
 * of the process unless cleared.
 *
 * Thread safety:
 * - tryAdd runs inside {@link ConcurrentHashMap#compute} for the symbol, so two
 *   concurrent adds of the same trade id cannot both succeed
 * - reads lock only the symbol's container, so symbols never contend with each other
 */
public class InMemoryTradeCache implements TradeCache {

    private static final Logger log = LoggerFactory.getLogger(InMemoryTradeCache.class);

    private final ConcurrentHashMap<Symbol, CachedTrades> bySymbol = new ConcurrentHashMap<>();

    @Override
    public boolean tryAdd(Trade trade) {
        Objects.requireNonNull(trade, "trade");
        boolean[] added = new boolean[1];
        bySymbol.compute(trade.symbol(), (symbol, cached) -> {
            CachedTrades target = cached != null ? cached : new CachedTrades(symbol);
            added[0] = target.tryAdd(trade);
            return target;
        });

        if (!added[0] && log.isTraceEnabled()) {
            log.trace("Duplicate trade ignored: symbol={}, tradeId={}", trade.symbol(), trade.tradeId());
        }
        return added[0];
    }

    @Override
    public List<Trade> getRecent(Symbol symbol, int count) {
        requireNonNegative(count);
        CachedTrades cached = bySymbol.get(symbol);
        return cached == null ? List.of() : cached.getRecent(count);
    }

    @Override
    public List<Trade> getRecent(Symbol symbol, int count, Instant before) {
        requireNonNegative(count);
        Objects.requireNonNull(before, "before");
        CachedTrades cached = bySymbol.get(symbol);
        return cached == null ? List.of() : cached.getRecent(count, before);
    }

    @Override
    public List<Trade> getSince(Symbol symbol, int count, Instant after) {
        requireNonNegative(count);
        Objects.requireNonNull(after, "after");
        CachedTrades cached = bySymbol.get(symbol);
        return cached == null ? List.of() : cached.getSince(count, after);
    }

    @Override
    public void clear(Symbol symbol) {
        CachedTrades removed = bySymbol.remove(symbol);
        if (removed != null) {
            log.info("Cleared {} cached trades for {}", removed.size(), symbol);
        }
    }

    @Override
    public int count(Symbol symbol) {
        CachedTrades cached = bySymbol.get(symbol);
        return cached == null ? 0 : cached.size();
    }

    @Override
    public Map<Symbol, Integer> counts() {
        Map<Symbol, Integer> counts = new EnumMap<>(Symbol.class);
        bySymbol.forEach((symbol, cached) -> {
            int size = cached.size();
            if (size > 0) {
                counts.put(symbol, size);
            }
        });
        return counts;
    }

    private static void requireNonNegative(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("Count must be >= 0, got " + count);
        }
    }
}
