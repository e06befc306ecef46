package com.fintech.trades.feed;

import com.fintech.trades.config.TradeRelayProperties;
import com.fintech.trades.domain.ConnectionEvent;
import com.fintech.trades.domain.SubscriptionResponse;
import com.fintech.trades.domain.Symbol;
import com.fintech.trades.domain.Trade;
import com.fintech.trades.util.CancellationToken;
import com.fintech.trades.util.EventSource;
import com.fintech.trades.util.Registration;
import com.fintech.trades.util.Subject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.net.URI;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link TradeFeedClient} for the Blockchain.com Exchange WebSocket API.
 *
 * Threading:
 * - the WebSocket container thread only enqueues raw text frames
 * - a single reader thread decodes frames and publishes events in arrival order
 * - outbound frames go through a {@link ConcurrentWebSocketSessionDecorator},
 *   so subscribe requests from any thread are serialized
 *
 * A session that ends while no local disconnect is in progress fires
 * {@code connectionLost} exactly once; the next successful connect fires
 * {@code connectionRestored}.
 *
 * Every connect attempt gets its own handler tagged with an attempt number. Only
 * the attempt still awaited by {@link #connect} may install its session; a session
 * established after its attempt timed out, was cancelled or failed is closed.
 */
public class BlockchainTradeFeedClient implements TradeFeedClient {

    private static final Logger log = LoggerFactory.getLogger(BlockchainTradeFeedClient.class);
    private static final long READER_POLL_MILLIS = 100;
    private static final long READER_JOIN_MILLIS = 5000;

    private final WebSocketClient webSocketClient;
    private final TradeFeedMessageCodec codec;
    private final TradeRelayProperties.Feed settings;
    private final URI uri;

    private final Subject<Trade> tradeReceived = new Subject<>("tradeReceived");
    private final Subject<SubscriptionResponse> subscriptionConfirmed = new Subject<>("subscriptionConfirmed");
    private final Subject<ConnectionEvent> connectionLost = new Subject<>("connectionLost");
    private final Subject<ConnectionEvent> connectionRestored = new Subject<>("connectionRestored");

    private final AtomicReference<WebSocketSession> currentSession = new AtomicReference<>();
    private final BlockingQueue<String> inbound = new LinkedBlockingQueue<>();
    private final AtomicBoolean lostSinceLastConnect = new AtomicBoolean(false);
    private final AtomicInteger readerCounter = new AtomicInteger(0);
    private final AtomicLong attemptCounter = new AtomicLong(0);
    private final Object sessionLock = new Object();

    // Attempt whose handshake may still install a session; 0 when none is awaited
    private long awaitedAttempt;

    private volatile boolean closing;
    private volatile boolean readerRunning;
    private volatile Thread readerThread;

    public BlockchainTradeFeedClient(
            WebSocketClient webSocketClient,
            TradeFeedMessageCodec codec,
            TradeRelayProperties.Feed settings) {
        this.webSocketClient = webSocketClient;
        this.codec = codec;
        this.settings = settings;
        this.uri = URI.create(settings.getUrl());
    }

    @Override
    public boolean isConnected() {
        WebSocketSession session = currentSession.get();
        return session != null && session.isOpen();
    }

    @Override
    public void connect(CancellationToken token) throws Exception {
        token.throwIfCancellationRequested();
        log.info("Connecting to {}", uri);

        WebSocketHttpHeaders headers = new WebSocketHttpHeaders();
        if (settings.getOrigin() != null && !settings.getOrigin().isBlank()) {
            headers.setOrigin(settings.getOrigin());
        }

        closing = false;
        long attempt = attemptCounter.incrementAndGet();
        synchronized (sessionLock) {
            awaitedAttempt = attempt;
        }
        boolean established = false;
        try {
            CompletableFuture<WebSocketSession> handshake =
                webSocketClient.execute(new FeedHandler(attempt), headers, uri);
            Registration abortOnCancel = token.onCancel(() -> handshake.cancel(true));
            try {
                handshake.get(settings.getConnectTimeout().toMillis(), TimeUnit.MILLISECONDS);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                throw new IOException("WebSocket handshake with " + uri + " failed: " + cause.getMessage(), cause);
            } catch (TimeoutException e) {
                handshake.cancel(true);
                throw new IOException("WebSocket handshake with " + uri + " timed out after "
                    + settings.getConnectTimeout().toMillis() + "ms", e);
            } finally {
                abortOnCancel.remove();
            }

            if (!isConnected()) {
                throw new IOException("WebSocket session to " + uri + " closed during handshake");
            }
            established = true;
        } finally {
            if (!established) {
                abandonAttempt(attempt);
            }
        }
        startReader();
        log.info("Connected to {}", uri);

        if (lostSinceLastConnect.getAndSet(false)) {
            connectionRestored.publish(ConnectionEvent.restored());
        }
    }

    @Override
    public void disconnect(CancellationToken token) throws Exception {
        closing = true;
        lostSinceLastConnect.set(false);
        WebSocketSession session;
        synchronized (sessionLock) {
            awaitedAttempt = 0;
            session = currentSession.getAndSet(null);
        }
        try {
            if (session != null && session.isOpen()) {
                session.close(CloseStatus.NORMAL.withReason("Client disconnecting"));
            }
        } finally {
            stopReader();
            inbound.clear();
        }
        log.info("Disconnected from {}", uri);
    }

    @Override
    public void subscribeToTrades(Symbol symbol, CancellationToken token) throws IOException {
        send(codec.encodeSubscribe(symbol, settings.getApiToken()), token);
        log.info("Subscribed to trades for {}", symbol);
    }

    @Override
    public void unsubscribeFromTrades(Symbol symbol, CancellationToken token) throws IOException {
        send(codec.encodeUnsubscribe(symbol, settings.getApiToken()), token);
        log.info("Unsubscribed from trades for {}", symbol);
    }

    private void send(String json, CancellationToken token) throws IOException {
        token.throwIfCancellationRequested();
        WebSocketSession session = currentSession.get();
        if (session == null || !session.isOpen()) {
            throw new IOException("WebSocket to " + uri + " is not connected");
        }
        session.sendMessage(new TextMessage(json));
        log.debug("Sent: {}", json);
    }

    @Override
    public EventSource<Trade> tradeReceived() {
        return tradeReceived;
    }

    @Override
    public EventSource<SubscriptionResponse> subscriptionConfirmed() {
        return subscriptionConfirmed;
    }

    @Override
    public EventSource<ConnectionEvent> connectionLost() {
        return connectionLost;
    }

    @Override
    public EventSource<ConnectionEvent> connectionRestored() {
        return connectionRestored;
    }

    /**
     * Stops waiting for {@code attempt}: a session it already installed is removed
     * and closed, and a later one will be closed by its handler.
     */
    private void abandonAttempt(long attempt) {
        WebSocketSession session = null;
        synchronized (sessionLock) {
            if (awaitedAttempt == attempt) {
                awaitedAttempt = 0;
                session = currentSession.getAndSet(null);
            }
        }
        if (session != null) {
            closeQuietly(session, CloseStatus.GOING_AWAY.withReason("Handshake abandoned"));
        }
    }

    private void closeQuietly(WebSocketSession session, CloseStatus status) {
        try {
            session.close(status);
        } catch (IOException e) {
            log.warn("Failed to close WebSocket session {}: {}", session.getId(), e.getMessage());
        }
    }

    // Reader thread

    private synchronized void startReader() {
        Thread existing = readerThread;
        if (existing != null && existing.isAlive()) {
            return;
        }
        readerRunning = true;
        Thread thread = new Thread(this::readLoop);
        thread.setName("trade-feed-reader-" + readerCounter.incrementAndGet());
        thread.setDaemon(true);
        readerThread = thread;
        thread.start();
    }

    private synchronized void stopReader() throws InterruptedException {
        readerRunning = false;
        Thread thread = readerThread;
        readerThread = null;
        if (thread != null && thread != Thread.currentThread()) {
            thread.join(READER_JOIN_MILLIS);
            if (thread.isAlive()) {
                log.warn("Reader thread {} did not stop within {}ms", thread.getName(), READER_JOIN_MILLIS);
            }
        }
    }

    private void readLoop() {
        log.debug("Reader thread started");
        try {
            while (readerRunning) {
                String payload = inbound.poll(READER_POLL_MILLIS, TimeUnit.MILLISECONDS);
                if (payload != null && readerRunning) {
                    dispatch(payload);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.debug("Reader thread stopped");
    }

    private void dispatch(String payload) {
        if (log.isTraceEnabled()) {
            log.trace("Received: {}", payload);
        }
        try {
            codec.decode(payload).ifPresent(message -> {
                if (message instanceof TradeFeedMessageCodec.TradeMessage tradeMessage) {
                    tradeReceived.publish(tradeMessage.trade());
                } else if (message instanceof TradeFeedMessageCodec.SubscriptionMessage subscription) {
                    subscriptionConfirmed.publish(subscription.response());
                }
            });
        } catch (RuntimeException e) {
            log.error("Failed to process feed message: {}", payload, e);
        }
    }

    private void onSessionEnded(WebSocketSession session, String reason) {
        WebSocketSession current = currentSession.get();
        if (current == null || !current.getId().equals(session.getId())) {
            return;
        }
        if (!currentSession.compareAndSet(current, null) || closing) {
            return;
        }
        log.warn("Connection to {} lost: {}", uri, reason);
        lostSinceLastConnect.set(true);
        connectionLost.publish(ConnectionEvent.lost(reason));
    }

    /**
     * Container-facing handler for one connect attempt. Runs on WebSocket container threads.
     */
    private final class FeedHandler extends TextWebSocketHandler {

        private final long attempt;
        private volatile boolean installed;

        FeedHandler(long attempt) {
            this.attempt = attempt;
        }

        @Override
        public void afterConnectionEstablished(WebSocketSession session) {
            synchronized (sessionLock) {
                if (awaitedAttempt == attempt) {
                    currentSession.set(new ConcurrentWebSocketSessionDecorator(
                        session,
                        (int) settings.getSendTimeLimit().toMillis(),
                        settings.getSendBufferSizeLimit()));
                    installed = true;
                    return;
                }
            }
            log.info("Closing WebSocket session {} of abandoned connect attempt {}", session.getId(), attempt);
            closeQuietly(session, CloseStatus.GOING_AWAY.withReason("Connect attempt abandoned"));
        }

        @Override
        protected void handleTextMessage(WebSocketSession session, TextMessage message) {
            if (installed) {
                inbound.offer(message.getPayload());
            }
        }

        @Override
        public void handleTransportError(WebSocketSession session, Throwable exception) {
            log.warn("Transport error on {}: {}", uri, exception.getMessage());
            if (!session.isOpen()) {
                onSessionEnded(session, exception.getMessage());
            }
        }

        @Override
        public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
            log.info("WebSocket to {} closed: {}", uri, status);
            onSessionEnded(session, status.toString());
        }
    }
}
