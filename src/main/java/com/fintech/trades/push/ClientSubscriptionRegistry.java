package com.fintech.trades.push;

import com.fintech.trades.domain.Symbol;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Symbols each push-channel session is subscribed to.
 *
 * A session counts once per symbol no matter how many times it subscribes, so a
 * client repeating a subscribe cannot inflate the relay's reference counts.
 */
public class ClientSubscriptionRegistry {

    private final Map<String, Set<Symbol>> sessionSubscriptions = new ConcurrentHashMap<>();

    /**
     * @return true if the session was not yet subscribed to the symbol
     */
    public boolean add(String sessionId, Symbol symbol) {
        boolean[] added = new boolean[1];
        sessionSubscriptions.compute(sessionId, (id, symbols) -> {
            Set<Symbol> target = symbols != null ? symbols : EnumSet.noneOf(Symbol.class);
            added[0] = target.add(symbol);
            return target;
        });
        return added[0];
    }

    /**
     * @return true if the session was subscribed to the symbol
     */
    public boolean remove(String sessionId, Symbol symbol) {
        boolean[] removed = new boolean[1];
        sessionSubscriptions.computeIfPresent(sessionId, (id, symbols) -> {
            removed[0] = symbols.remove(symbol);
            return symbols.isEmpty() ? null : symbols;
        });
        return removed[0];
    }

    /**
     * Forgets the session.
     *
     * @return the symbols it was subscribed to
     */
    public Set<Symbol> removeSession(String sessionId) {
        Set<Symbol> symbols = sessionSubscriptions.remove(sessionId);
        return symbols == null ? Set.of() : symbols;
    }

    public Set<Symbol> subscriptionsOf(String sessionId) {
        Set<Symbol> snapshot = EnumSet.noneOf(Symbol.class);
        sessionSubscriptions.computeIfPresent(sessionId, (id, symbols) -> {
            snapshot.addAll(symbols);
            return symbols;
        });
        return snapshot;
    }

    public int sessionCount() {
        return sessionSubscriptions.size();
    }
}
