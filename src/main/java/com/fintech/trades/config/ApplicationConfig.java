package com.fintech.trades.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.trades.backoff.BackoffStrategy;
import com.fintech.trades.backoff.DelayProvider;
import com.fintech.trades.connection.ConnectionManager;
import com.fintech.trades.feed.BlockchainTradeFeedClient;
import com.fintech.trades.feed.TradeFeedClient;
import com.fintech.trades.feed.TradeFeedMessageCodec;
import com.fintech.trades.push.ClientSubscriptionRegistry;
import com.fintech.trades.service.TradeDataService;
import com.fintech.trades.storage.InMemoryTradeCache;
import com.fintech.trades.storage.TradeCache;
import com.fintech.trades.subscription.SubscriptionManager;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;

/**
 * Composition root: one connection manager, subscription manager and trade cache
 * per upstream connection, injected into the orchestrating service.
 */
@Configuration
public class ApplicationConfig {

    private static final Logger log = LoggerFactory.getLogger(ApplicationConfig.class);

    @Bean
    public TradeCache tradeCache() {
        return new InMemoryTradeCache();
    }

    @Bean
    public SubscriptionManager subscriptionManager() {
        return new SubscriptionManager();
    }

    @Bean
    public BackoffStrategy backoffStrategy(TradeRelayProperties properties) {
        TradeRelayProperties.Connection connection = properties.getConnection();
        BackoffStrategy strategy = connection.getStrategy().create(
            connection.getInitialBackoffDelay(),
            connection.getMaxBackoffDelay(),
            connection.getBackoffMultiplier());
        log.info("Reconnect backoff: {}", strategy);
        return strategy;
    }

    @Bean
    public DelayProvider delayProvider() {
        return DelayProvider.system();
    }

    @Bean
    public WebSocketClient feedWebSocketClient() {
        return new StandardWebSocketClient();
    }

    @Bean
    public TradeFeedMessageCodec tradeFeedMessageCodec(ObjectMapper objectMapper) {
        return new TradeFeedMessageCodec(objectMapper);
    }

    @Bean
    public TradeFeedClient tradeFeedClient(
            WebSocketClient feedWebSocketClient,
            TradeFeedMessageCodec codec,
            TradeRelayProperties properties) {
        return new BlockchainTradeFeedClient(feedWebSocketClient, codec, properties.getFeed());
    }

    @Bean
    public ConnectionManager connectionManager(
            TradeFeedClient tradeFeedClient,
            BackoffStrategy backoffStrategy,
            DelayProvider delayProvider,
            MeterRegistry meterRegistry) {
        return new ConnectionManager(tradeFeedClient, backoffStrategy, delayProvider, meterRegistry);
    }

    @Bean
    public TradeDataService tradeDataService(
            TradeFeedClient tradeFeedClient,
            ConnectionManager connectionManager,
            SubscriptionManager subscriptionManager,
            TradeCache tradeCache,
            CircuitBreakerRegistry circuitBreakerRegistry,
            MeterRegistry meterRegistry) {
        return new TradeDataService(
            tradeFeedClient, connectionManager, subscriptionManager, tradeCache,
            circuitBreakerRegistry, meterRegistry);
    }

    @Bean
    public ClientSubscriptionRegistry clientSubscriptionRegistry() {
        return new ClientSubscriptionRegistry();
    }
}
