package com.fintech.trades.api;

import com.fintech.trades.FakeFeedConfiguration;
import com.fintech.trades.domain.Symbol;
import com.fintech.trades.feed.FakeTradeFeedClient;
import com.fintech.trades.service.TradeDataService;
import com.fintech.trades.storage.TradeCache;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import java.util.concurrent.TimeUnit;

import static com.fintech.trades.domain.TradeFixtures.btc;
import static com.fintech.trades.domain.TradeFixtures.trade;
import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@Import(FakeFeedConfiguration.class)
@TestPropertySource(properties = {
    "trades.feed.auto-start=false",  // Feed is started explicitly by tests
    "spring.jmx.enabled=false"
})
@DisplayName("TradeController Integration Tests")
class TradeControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private TradeCache tradeCache;

    @Autowired
    private TradeDataService tradeDataService;

    @Autowired
    private FakeTradeFeedClient feed;

    @BeforeEach
    void setUp() {
        // Context is shared between test classes, so start from a clean relay
        tradeDataService.stop();
        feed.reset();
        for (Symbol symbol : Symbol.values()) {
            tradeCache.clear(symbol);
            while (tradeDataService.getSubscriptionCounts().containsKey(symbol)) {
                tradeDataService.unsubscribeFromTrades(symbol);
            }
        }
    }

    @Test
    @DisplayName("Should return trades most recent first, limited by count")
    void recentTrades() throws Exception {
        tradeCache.tryAdd(btc("t1", 1));
        tradeCache.tryAdd(btc("t3", 3));
        tradeCache.tryAdd(btc("t2", 2));

        mockMvc.perform(get("/api/v1/trades")
                .param("symbol", "BTC-USD")
                .param("count", "2"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.symbol").value("BTC-USD"))
            .andExpect(jsonPath("$.count").value(2))
            .andExpect(jsonPath("$.trades[*].tradeId", contains("t3", "t2")))
            .andExpect(jsonPath("$.trades[0].timestamp").value("2026-10-17T10:00:03Z"))
            .andExpect(jsonPath("$.trades[0].side").value("buy"));
    }

    @Test
    @DisplayName("Should page backwards with a strict before bound")
    void recentTradesBefore() throws Exception {
        for (int i = 1; i <= 5; i++) {
            tradeCache.tryAdd(btc("t" + i, i));
        }

        mockMvc.perform(get("/api/v1/trades")
                .param("symbol", "btc-usd")
                .param("count", "10")
                .param("before", "2026-10-17T10:00:03Z"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.trades[*].tradeId", contains("t2", "t1")));
    }

    @Test
    @DisplayName("Should return trades strictly after an instant")
    void tradesSince() throws Exception {
        for (int i = 1; i <= 5; i++) {
            tradeCache.tryAdd(btc("t" + i, i));
        }

        mockMvc.perform(get("/api/v1/trades/since")
                .param("symbol", "BTC-USD")
                .param("after", "2026-10-17T10:00:03Z"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.trades[*].tradeId", contains("t5", "t4")));
    }

    @Test
    @DisplayName("Should return an empty list for a symbol without trades")
    void emptySymbol() throws Exception {
        mockMvc.perform(get("/api/v1/trades").param("symbol", "DOT-USD"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.count").value(0))
            .andExpect(jsonPath("$.trades", hasSize(0)));
    }

    @Test
    @DisplayName("Should reject an unsupported symbol")
    void unsupportedSymbol() throws Exception {
        mockMvc.perform(get("/api/v1/trades").param("symbol", "XRP-USD"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("INVALID_ARGUMENT"))
            .andExpect(jsonPath("$.message", containsString("Unsupported symbol 'XRP-USD'")))
            .andExpect(jsonPath("$.path").value("/api/v1/trades"));
    }

    @Test
    @DisplayName("Should reject a negative count")
    void negativeCount() throws Exception {
        mockMvc.perform(get("/api/v1/trades")
                .param("symbol", "BTC-USD")
                .param("count", "-1"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));
    }

    @Test
    @DisplayName("Should reject a count above the configured maximum")
    void countAboveMax() throws Exception {
        mockMvc.perform(get("/api/v1/trades")
                .param("symbol", "BTC-USD")
                .param("count", "1001"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("Count must be <= 1000, got 1001"));
    }

    @Test
    @DisplayName("Should reject a malformed timestamp")
    void malformedTimestamp() throws Exception {
        mockMvc.perform(get("/api/v1/trades/since")
                .param("symbol", "BTC-USD")
                .param("after", "yesterday"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("TYPE_MISMATCH"))
            .andExpect(jsonPath("$.fieldErrors[0].field").value("after"));
    }

    @Test
    @DisplayName("Should report a missing symbol parameter")
    void missingSymbol() throws Exception {
        mockMvc.perform(get("/api/v1/trades"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("MISSING_PARAMETER"))
            .andExpect(jsonPath("$.message").value("Required parameter 'symbol' is missing"));
    }

    @Test
    @DisplayName("Should clear one symbol's cache")
    void clearTrades() throws Exception {
        tradeCache.tryAdd(btc("t1", 1));
        tradeCache.tryAdd(trade(Symbol.ETH_USD, "e1", 1));

        mockMvc.perform(delete("/api/v1/trades").param("symbol", "BTC-USD"))
            .andExpect(status().isNoContent());

        assertThat(tradeCache.count(Symbol.BTC_USD)).isZero();
        assertThat(tradeCache.count(Symbol.ETH_USD)).isEqualTo(1);
    }

    @Test
    @DisplayName("Should list supported symbols")
    void symbols() throws Exception {
        mockMvc.perform(get("/api/v1/symbols"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$", contains("BTC-USD", "ETH-USD", "SOL-USD", "ADA-USD", "DOT-USD")));
    }

    @Test
    @DisplayName("Should start and stop the feed and report status")
    void feedLifecycle() throws Exception {
        tradeDataService.subscribeToTrades(Symbol.ETH_USD);

        mockMvc.perform(post("/api/v1/feed/start"))
            .andExpect(status().isAccepted());
        awaitSubscribedUpstream();

        mockMvc.perform(get("/api/v1/status"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.running").value(true))
            .andExpect(jsonPath("$.connected").value(true))
            .andExpect(jsonPath("$.connectionState").value("CONNECTED"))
            .andExpect(jsonPath("$.subscriptions['ETH-USD']").value(1))
            .andExpect(jsonPath("$.backoffDelaySeconds").value(5.0));
        assertThat(feed.subscribeCalls()).containsExactly(Symbol.ETH_USD);

        mockMvc.perform(post("/api/v1/feed/stop"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.running").value(false))
            .andExpect(jsonPath("$.connected").value(false));
    }

    private void awaitSubscribedUpstream() throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (feed.subscribeCalls().isEmpty()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("Feed did not connect within 5s");
            }
            Thread.sleep(10);
        }
    }
}
