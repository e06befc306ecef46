package com.fintech.trades.domain;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * Immutable trade print received from the exchange feed.
 * Compact constructor rejects partially populated trades so malformed input
 * can never reach the cache.
 *
 * @param sequenceNumber upstream per-connection sequence number
 * @param event feed event kind the trade arrived with (snapshot or updated)
 * @param symbol instrument
 * @param timestamp exchange execution time (UTC, microsecond precision)
 * @param side aggressor side
 * @param quantity executed quantity, strictly positive
 * @param price execution price, strictly positive
 * @param tradeId exchange trade id, unique per symbol
 */
public record Trade(
    int sequenceNumber,
    FeedEvent event,
    Symbol symbol,
    Instant timestamp,
    Side side,
    BigDecimal quantity,
    BigDecimal price,
    String tradeId
) {

    public Trade {
        Objects.requireNonNull(event, "event");
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(side, "side");
        Objects.requireNonNull(quantity, "quantity");
        Objects.requireNonNull(price, "price");
        Objects.requireNonNull(tradeId, "tradeId");

        if (tradeId.isBlank()) {
            throw new IllegalArgumentException("Trade id cannot be blank");
        }
        if (quantity.signum() <= 0) {
            throw new IllegalArgumentException("Quantity must be positive: " + quantity);
        }
        if (price.signum() <= 0) {
            throw new IllegalArgumentException("Price must be positive: " + price);
        }
    }
}
