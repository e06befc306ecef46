package com.fintech.trades.service;

import com.fintech.trades.connection.ConnectionManager;
import com.fintech.trades.connection.ConnectionState;
import com.fintech.trades.domain.ConnectionEvent;
import com.fintech.trades.domain.FeedEvent;
import com.fintech.trades.domain.SubscriptionResponse;
import com.fintech.trades.domain.Symbol;
import com.fintech.trades.domain.Trade;
import com.fintech.trades.feed.TradeFeedClient;
import com.fintech.trades.storage.TradeCache;
import com.fintech.trades.subscription.SubscriptionManager;
import com.fintech.trades.util.CancellationToken;
import com.fintech.trades.util.EventSource;
import com.fintech.trades.util.Registration;
import com.fintech.trades.util.Subject;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Orchestrates the relay: wires the upstream feed into the trade cache, gates
 * upstream (un)subscribe calls through reference counts and resubscribes after
 * a reconnect.
 *
 * Responsibilities:
 * - Lifecycle (start/stop) with a single lifetime cancellation token
 * - Deduplicated trade re-emission (at most once per trade id)
 * - Circuit breaker around upstream subscription requests
 * - Metrics and logging
 *
 * Transport exceptions never escape this class. After {@link #stop()} returns no
 * trade is cached or re-emitted.
 */
public class TradeDataService {

    private static final Logger log = LoggerFactory.getLogger(TradeDataService.class);

    private final TradeFeedClient feedClient;
    private final ConnectionManager connectionManager;
    private final SubscriptionManager subscriptionManager;
    private final TradeCache tradeCache;
    private final CircuitBreaker circuitBreaker;
    private final ExecutorService startExecutor;

    private final Subject<Trade> tradeReceived = new Subject<>("service.tradeReceived");
    private final Subject<SubscriptionResponse> subscriptionConfirmed = new Subject<>("service.subscriptionConfirmed");
    private final Subject<ConnectionEvent> connectionLost = new Subject<>("service.connectionLost");
    private final Subject<ConnectionEvent> connectionRestored = new Subject<>("service.connectionRestored");

    // Write lock held while flipping 'running'; read lock held while dispatching a trade
    private final ReentrantReadWriteLock dispatchLock = new ReentrantReadWriteLock();
    private final Object lifecycleMonitor = new Object();

    private volatile boolean running;
    private volatile CancellationToken lifetime;
    private List<Registration> registrations = List.of();

    // Symbols subscribed upstream on the current connection; cleared when it ends
    private final Set<Symbol> upstreamSymbols = ConcurrentHashMap.newKeySet();

    // Prometheus metrics
    private final AtomicLong tradesReceived = new AtomicLong(0);
    private final AtomicLong tradesStored = new AtomicLong(0);
    private final AtomicLong duplicateTrades = new AtomicLong(0);
    private final AtomicLong subscriptionFailures = new AtomicLong(0);
    private final AtomicLong reconnects = new AtomicLong(0);

    public TradeDataService(
            TradeFeedClient feedClient,
            ConnectionManager connectionManager,
            SubscriptionManager subscriptionManager,
            TradeCache tradeCache,
            CircuitBreakerRegistry circuitBreakerRegistry,
            MeterRegistry meterRegistry) {
        this.feedClient = feedClient;
        this.connectionManager = connectionManager;
        this.subscriptionManager = subscriptionManager;
        this.tradeCache = tradeCache;
        this.circuitBreaker = circuitBreakerRegistry.circuitBreaker("upstream-subscriptions");
        this.startExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "trade-service-start");
            thread.setDaemon(true);
            return thread;
        });

        // Register metrics
        meterRegistry.gauge("trades.service.received", tradesReceived);
        meterRegistry.gauge("trades.service.stored", tradesStored);
        meterRegistry.gauge("trades.service.duplicates", duplicateTrades);
        meterRegistry.gauge("trades.service.subscription.failures", subscriptionFailures);
        meterRegistry.gauge("trades.service.reconnects", reconnects);

        circuitBreaker.getEventPublisher()
            .onStateTransition(event ->
                log.warn("Upstream subscription circuit breaker: {} -> {}",
                    event.getStateTransition().getFromState(),
                    event.getStateTransition().getToState())
            );
    }

    /**
     * Connects to the upstream feed, blocking until connected or until {@link #stop()}
     * is called. Symbols subscribed before the connection was up are subscribed
     * upstream once connected. Calling start while running is a no-op.
     */
    public void start() {
        CancellationToken token;
        synchronized (lifecycleMonitor) {
            if (running) {
                log.debug("Trade data service already running");
                return;
            }
            token = new CancellationToken();
            dispatchLock.writeLock().lock();
            try {
                lifetime = token;
                upstreamSymbols.clear();
                registrations = List.of(
                    feedClient.tradeReceived().subscribe(this::onTrade),
                    feedClient.subscriptionConfirmed().subscribe(this::onSubscriptionConfirmed),
                    feedClient.connectionLost().subscribe(this::onConnectionLost),
                    feedClient.connectionRestored().subscribe(this::onConnectionRestored)
                );
                running = true;
            } finally {
                dispatchLock.writeLock().unlock();
            }
        }
        log.info("Trade data service starting");

        connectionManager.start(token);

        if (token.isCancellationRequested()) {
            log.info("Trade data service stopped before the feed connected");
            return;
        }
        Set<Symbol> pending = subscriptionManager.activeSymbols();
        if (!pending.isEmpty() && connectionManager.isConnected()) {
            log.info("Subscribing {} symbol(s) requested before connect: {}", pending.size(), pending);
            pending.forEach(this::subscribeUpstream);
        }
        log.info("Trade data service started");
    }

    /** Runs {@link #start()} in the background. */
    public CompletableFuture<Void> startAsync() {
        return CompletableFuture.runAsync(this::start, startExecutor);
    }

    /**
     * Stops event handling, aborts any in-flight connect or backoff sleep and
     * disconnects. Reference counts and cached trades are kept.
     */
    public void stop() {
        CancellationToken token;
        List<Registration> handlers;
        synchronized (lifecycleMonitor) {
            dispatchLock.writeLock().lock();
            try {
                if (!running) {
                    log.debug("Trade data service not running");
                    return;
                }
                running = false;
                token = lifetime;
                handlers = registrations;
                registrations = List.of();
            } finally {
                dispatchLock.writeLock().unlock();
            }
        }
        log.info("Trade data service stopping");

        handlers.forEach(Registration::remove);
        token.cancel();
        connectionManager.stop(CancellationToken.none());
        upstreamSymbols.clear();

        log.info("Trade data service stopped");
    }

    /**
     * Registers interest in a symbol. Only the first subscriber triggers an upstream
     * subscribe; while disconnected the subscribe is issued on connect.
     */
    public void subscribeToTrades(Symbol symbol) {
        if (!subscriptionManager.shouldSubscribeDownstream(symbol)) {
            return;
        }
        if (connectionManager.isConnected()) {
            subscribeUpstream(symbol);
        } else {
            log.info("Feed not connected, subscribe for {} deferred until connected", symbol);
        }
    }

    /**
     * Releases interest in a symbol. Only the last unsubscriber triggers an upstream
     * unsubscribe. Unsubscribing a symbol nobody subscribed to is a no-op.
     */
    public void unsubscribeFromTrades(Symbol symbol) {
        if (!subscriptionManager.shouldUnsubscribeDownstream(symbol)) {
            return;
        }
        if (upstreamSymbols.remove(symbol) && connectionManager.isConnected()) {
            sendUpstream(symbol, false);
        }
    }

    public List<Trade> getRecentTrades(Symbol symbol, int count) {
        return tradeCache.getRecent(symbol, count);
    }

    public List<Trade> getRecentTrades(Symbol symbol, int count, Instant before) {
        return tradeCache.getRecent(symbol, count, before);
    }

    public List<Trade> getTradesSince(Symbol symbol, int count, Instant after) {
        return tradeCache.getSince(symbol, count, after);
    }

    public void clearTrades(Symbol symbol) {
        tradeCache.clear(symbol);
    }

    // Events

    public EventSource<Trade> tradeReceived() {
        return tradeReceived;
    }

    public EventSource<SubscriptionResponse> subscriptionConfirmed() {
        return subscriptionConfirmed;
    }

    public EventSource<ConnectionEvent> connectionLost() {
        return connectionLost;
    }

    public EventSource<ConnectionEvent> connectionRestored() {
        return connectionRestored;
    }

    // Upstream event handlers

    private void onTrade(Trade trade) {
        dispatchLock.readLock().lock();
        try {
            if (!running) {
                return;
            }
            tradesReceived.incrementAndGet();
            if (tradeCache.tryAdd(trade)) {
                tradesStored.incrementAndGet();
                tradeReceived.publish(trade);
            } else {
                duplicateTrades.incrementAndGet();
            }
        } finally {
            dispatchLock.readLock().unlock();
        }
    }

    private void onSubscriptionConfirmed(SubscriptionResponse response) {
        if (!running) {
            return;
        }
        if (response.event() == FeedEvent.REJECTED) {
            log.warn("Upstream rejected subscription for {}: {}", response.symbol(), response.text());
        } else {
            log.info("Upstream {} {}", response.event().wireValue(), response.symbol());
        }
        subscriptionConfirmed.publish(response);
    }

    private void onConnectionLost(ConnectionEvent event) {
        CancellationToken token = lifetime;
        if (!running || token == null) {
            return;
        }
        log.warn("Upstream connection lost ({}), reconnecting", event.reason());
        upstreamSymbols.clear();
        connectionLost.publish(event);
        connectionManager.startAsync(token);
    }

    private void onConnectionRestored(ConnectionEvent event) {
        if (!running) {
            return;
        }
        reconnects.incrementAndGet();
        circuitBreaker.reset();

        Set<Symbol> active = subscriptionManager.activeSymbols();
        log.info("Upstream connection restored, resubscribing {} symbol(s): {}", active.size(), active);
        active.forEach(this::subscribeUpstream);

        connectionRestored.publish(event);
    }

    /**
     * Subscribes upstream unless this connection already carries the symbol. Every
     * path that subscribes (first subscriber, connect, restore) goes through here,
     * so concurrent paths send at most one request per symbol.
     */
    private void subscribeUpstream(Symbol symbol) {
        if (upstreamSymbols.add(symbol) && !sendUpstream(symbol, true)) {
            upstreamSymbols.remove(symbol);
        }
    }

    private boolean sendUpstream(Symbol symbol, boolean subscribe) {
        CancellationToken token = lifetime != null ? lifetime : CancellationToken.none();
        String action = subscribe ? "subscribe" : "unsubscribe";
        try {
            circuitBreaker.executeCheckedRunnable(() -> {
                if (subscribe) {
                    feedClient.subscribeToTrades(symbol, token);
                } else {
                    feedClient.unsubscribeFromTrades(symbol, token);
                }
            });
            return true;
        } catch (CallNotPermittedException e) {
            subscriptionFailures.incrementAndGet();
            log.warn("Circuit breaker OPEN - upstream {} for {} not sent", action, symbol);
        } catch (CancellationException e) {
            log.debug("Upstream {} for {} cancelled", action, symbol);
        } catch (Error e) {
            throw e;
        } catch (Throwable e) {
            subscriptionFailures.incrementAndGet();
            log.warn("Upstream {} for {} failed: {}", action, symbol, e.getMessage(), e);
        }
        return false;
    }

    // Status

    public boolean isRunning() {
        return running;
    }

    public boolean isConnected() {
        return connectionManager.isConnected();
    }

    public ConnectionState getConnectionState() {
        return connectionManager.getState();
    }

    public Duration getCurrentBackoffDelay() {
        return connectionManager.getCurrentBackoffDelay();
    }

    public Map<Symbol, Integer> getSubscriptionCounts() {
        return subscriptionManager.referenceCounts();
    }

    public Map<Symbol, Integer> getCachedTradeCounts() {
        return tradeCache.counts();
    }

    public long getDuplicateTrades() {
        return duplicateTrades.get();
    }

    public long getTradesStored() {
        return tradesStored.get();
    }

    /** Stops the background start thread. Called by the container on shutdown. */
    public void shutdown() {
        stop();
        startExecutor.shutdownNow();
    }
}
