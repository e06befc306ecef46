package com.fintech.trades;

import com.fintech.trades.backoff.DelayProvider;
import com.fintech.trades.feed.FakeTradeFeedClient;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

import java.time.Duration;

/**
 * Replaces the exchange WebSocket client with an in-memory feed so integration
 * tests never touch the network.
 */
@TestConfiguration
public class FakeFeedConfiguration {

    @Bean
    @Primary
    public FakeTradeFeedClient fakeTradeFeedClient() {
        return new FakeTradeFeedClient();
    }

    /** Backoff sleeps shortened to 10ms; still cancellable. */
    @Bean
    @Primary
    public DelayProvider fastDelayProvider() {
        DelayProvider system = DelayProvider.system();
        return (delay, token) -> system.delay(Duration.ofMillis(10), token);
    }
}
