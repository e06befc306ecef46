package com.fintech.trades.config;

import com.fintech.trades.backoff.BackoffType;
import com.fintech.trades.domain.Symbol;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Externalized configuration for the trade relay.
 * Maps to 'trades.*' properties in application.yml.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "trades")
public class TradeRelayProperties {

    private Feed feed = new Feed();
    private Connection connection = new Connection();
    private Cache cache = new Cache();
    private Broadcast broadcast = new Broadcast();

    @Data
    public static class Feed {
        private String url = "wss://ws.blockchain.info/mercury-gateway/v1/ws";
        private String origin = "https://exchange.blockchain.com";
        private String apiToken;
        private boolean autoStart = true;
        private List<Symbol> initialSymbols = new ArrayList<>();  // Subscribed once on startup
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration sendTimeLimit = Duration.ofSeconds(5);
        private int sendBufferSizeLimit = 512 * 1024;
    }

    @Data
    public static class Connection {
        private Duration initialBackoffDelay = Duration.ofSeconds(5);
        private Duration maxBackoffDelay = Duration.ofSeconds(300);
        private double backoffMultiplier = 2.0;
        private BackoffType strategy = BackoffType.EXPONENTIAL;
    }

    @Data
    public static class Cache {
        private int defaultQueryCount = 100;
        private int maxQueryCount = 1000;
    }

    @Data
    public static class Broadcast {
        private int bufferSize = 4096;  // Must be a power of 2
        private String waitStrategy = "BLOCKING";
    }
}
