package com.fintech.trades.domain;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Trade builders shared by tests.
 */
public final class TradeFixtures {

    public static final Instant BASE_TIME = Instant.parse("2026-10-17T10:00:00Z");

    private TradeFixtures() {
    }

    public static Trade trade(Symbol symbol, String tradeId, Instant timestamp) {
        return new Trade(1, FeedEvent.UPDATED, symbol, timestamp, Side.BUY,
            new BigDecimal("0.5"), new BigDecimal("50000.00"), tradeId);
    }

    /** Trade at {@link #BASE_TIME} plus the given seconds. */
    public static Trade trade(Symbol symbol, String tradeId, long secondsAfterBase) {
        return trade(symbol, tradeId, BASE_TIME.plusSeconds(secondsAfterBase));
    }

    public static Trade btc(String tradeId, long secondsAfterBase) {
        return trade(Symbol.BTC_USD, tradeId, secondsAfterBase);
    }
}
