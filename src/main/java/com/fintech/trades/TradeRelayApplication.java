package com.fintech.trades;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Trade Relay Service
 *
 * Relays real-time trades from an exchange WebSocket feed to many downstream
 * consumers and caches recent trades per symbol for on-demand queries.
 *
 * Key Features:
 * - Resilient upstream connection (exponential backoff, single-flight reconnect)
 * - Reference-counted upstream subscriptions with resubscribe after reconnect
 * - Deduplicated in-memory trade cache with time-bounded queries
 * - STOMP push channel backed by an LMAX Disruptor ring buffer
 * - Prometheus metrics via Micrometer
 *
 * @since 1.0.0
 */
@SpringBootApplication
public class TradeRelayApplication {

    public static void main(String[] args) {
        SpringApplication.run(TradeRelayApplication.class, args);
    }
}
