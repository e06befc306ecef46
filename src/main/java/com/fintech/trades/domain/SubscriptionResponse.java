package com.fintech.trades.domain;

/**
 * Upstream acknowledgement of a subscribe or unsubscribe request.
 *
 * @param sequenceNumber upstream sequence number
 * @param event {@code SUBSCRIBED}, {@code UNSUBSCRIBED} or {@code REJECTED}
 * @param symbol instrument, null when the exchange did not echo it back
 * @param text optional rejection reason
 */
public record SubscriptionResponse(int sequenceNumber, FeedEvent event, Symbol symbol, String text) {

    public SubscriptionResponse(int sequenceNumber, FeedEvent event, Symbol symbol) {
        this(sequenceNumber, event, symbol, null);
    }
}
