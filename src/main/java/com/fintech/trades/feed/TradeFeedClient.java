package com.fintech.trades.feed;

import com.fintech.trades.connection.Connectable;
import com.fintech.trades.domain.ConnectionEvent;
import com.fintech.trades.domain.SubscriptionResponse;
import com.fintech.trades.domain.Symbol;
import com.fintech.trades.domain.Trade;
import com.fintech.trades.util.CancellationToken;
import com.fintech.trades.util.EventSource;

import java.io.IOException;

/**
 * Upstream exchange feed carrying the {@code trades} channel.
 *
 * Events are published on the client's reader thread in the order the exchange
 * sent them.
 */
public interface TradeFeedClient extends Connectable {

    /**
     * Sends a subscribe request for the symbol's trades.
     *
     * @throws IOException if the request could not be sent
     */
    void subscribeToTrades(Symbol symbol, CancellationToken token) throws IOException;

    /**
     * Sends an unsubscribe request for the symbol's trades.
     *
     * @throws IOException if the request could not be sent
     */
    void unsubscribeFromTrades(Symbol symbol, CancellationToken token) throws IOException;

    EventSource<Trade> tradeReceived();

    EventSource<SubscriptionResponse> subscriptionConfirmed();

    /** Fired once when an established connection ends without a local disconnect. */
    EventSource<ConnectionEvent> connectionLost();

    /** Fired when a connect succeeds after a loss. */
    EventSource<ConnectionEvent> connectionRestored();
}
