package com.fintech.trades.service;

import com.fintech.trades.config.TradeRelayProperties;
import com.fintech.trades.domain.Symbol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Ties the relay to the application lifecycle.
 *
 * On startup the configured initial symbols are subscribed on behalf of the
 * server and, when auto-start is enabled, the feed connects in the background so
 * an unreachable exchange never blocks application startup. On shutdown the
 * relay is stopped before the web server goes away.
 */
@Component
public class TradeFeedLifecycle implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(TradeFeedLifecycle.class);

    private final TradeDataService tradeDataService;
    private final TradeRelayProperties properties;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public TradeFeedLifecycle(TradeDataService tradeDataService, TradeRelayProperties properties) {
        this.tradeDataService = tradeDataService;
        this.properties = properties;
    }

    @Override
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        List<Symbol> initialSymbols = properties.getFeed().getInitialSymbols();
        initialSymbols.forEach(tradeDataService::subscribeToTrades);
        if (!initialSymbols.isEmpty()) {
            log.info("Registered initial subscriptions: {}", initialSymbols);
        }

        if (properties.getFeed().isAutoStart()) {
            log.info("Auto-starting trade feed from {}", properties.getFeed().getUrl());
            tradeDataService.startAsync();
        } else {
            log.info("Trade feed auto-start disabled; start it via POST /api/v1/feed/start");
        }
    }

    @Override
    public void stop() {
        if (running.compareAndSet(true, false)) {
            tradeDataService.stop();
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }
}
