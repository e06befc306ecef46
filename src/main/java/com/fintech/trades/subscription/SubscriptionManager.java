package com.fintech.trades.subscription;

import com.fintech.trades.domain.Symbol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Reference counts of interested consumers per symbol.
 *
 * Only the 0 -> 1 and 1 -> 0 transitions should reach the upstream feed, so N
 * consumers of one symbol cost a single upstream subscription. Updates to a symbol
 * are serialized through {@link ConcurrentHashMap#compute}; different symbols
 * proceed in parallel. An entry exists only while its count is positive.
 */
public class SubscriptionManager {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionManager.class);

    private final ConcurrentHashMap<Symbol, Integer> referenceCounts = new ConcurrentHashMap<>();

    /**
     * Registers one more consumer of {@code symbol}.
     *
     * @return true iff this was the first consumer and the upstream subscribe must be sent
     */
    public boolean shouldSubscribeDownstream(Symbol symbol) {
        Objects.requireNonNull(symbol, "symbol");
        int count = referenceCounts.merge(symbol, 1, Integer::sum);
        log.debug("Subscription count for {} -> {}", symbol, count);
        return count == 1;
    }

    /**
     * Releases one consumer of {@code symbol}. Releasing a symbol with no consumers
     * is a no-op.
     *
     * @return true iff this released the last consumer and the upstream unsubscribe must be sent
     */
    public boolean shouldUnsubscribeDownstream(Symbol symbol) {
        Objects.requireNonNull(symbol, "symbol");
        boolean[] reachedZero = new boolean[1];
        referenceCounts.computeIfPresent(symbol, (key, count) -> {
            if (count <= 1) {
                reachedZero[0] = true;
                return null;
            }
            return count - 1;
        });
        log.debug("Unsubscribe for {}, last consumer released: {}", symbol, reachedZero[0]);
        return reachedZero[0];
    }

    public int referenceCount(Symbol symbol) {
        return referenceCounts.getOrDefault(symbol, 0);
    }

    /** Symbols with at least one consumer. */
    public Set<Symbol> activeSymbols() {
        Set<Symbol> active = EnumSet.noneOf(Symbol.class);
        active.addAll(referenceCounts.keySet());
        return active;
    }

    /** Snapshot of the current counts. */
    public Map<Symbol, Integer> referenceCounts() {
        Map<Symbol, Integer> snapshot = new EnumMap<>(Symbol.class);
        snapshot.putAll(referenceCounts);
        return snapshot;
    }
}
