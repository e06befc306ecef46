package com.fintech.trades.push;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Payloads exchanged with push-channel clients.
 */
public final class PushMessages {

    public static final String TRADES_CHANNEL = "trades";

    private PushMessages() {
    }

    /** Client request body for {@code /app/trades.subscribe} and {@code /app/trades.unsubscribe}. */
    public record SubscriptionRequest(String channel, String symbol) { }

    /** Reply sent to the requesting session only. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record SubscriptionReply(String event, String channel, String symbol, String error) {

        public static SubscriptionReply ok(String event, String symbol) {
            return new SubscriptionReply(event, TRADES_CHANNEL, symbol, null);
        }

        public static SubscriptionReply error(String message) {
            return new SubscriptionReply("error", null, null, message);
        }
    }
}
