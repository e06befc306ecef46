package com.fintech.trades.push;

import com.fintech.trades.config.TradeRelayProperties;
import com.fintech.trades.domain.ConnectionEvent;
import com.fintech.trades.domain.Trade;
import com.fintech.trades.service.TradeDataService;
import com.fintech.trades.util.Registration;
import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.EventFactory;
import com.lmax.disruptor.ExceptionHandler;
import com.lmax.disruptor.InsufficientCapacityException;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.messaging.simp.SimpMessageSendingOperations;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fans relay events out to push-channel clients through an LMAX Disruptor ring buffer.
 *
 * The feed's reader thread only claims a slot and returns; a single consumer thread
 * performs the STOMP sends. When the ring buffer is full the event is dropped and
 * counted, so a slow push consumer can never stall trade ingestion.
 *
 * Destinations:
 * - {@code /topic/trades.{SYMBOL}} for trades, in arrival order
 * - {@code /topic/status} for connection lost/restored
 */
@Component
public class TradeBroadcaster {

    private static final Logger log = LoggerFactory.getLogger(TradeBroadcaster.class);

    static final String TRADES_DESTINATION_PREFIX = "/topic/trades.";
    static final String STATUS_DESTINATION = "/topic/status";

    private final SimpMessageSendingOperations messagingTemplate;
    private final TradeDataService tradeDataService;
    private final TradeRelayProperties properties;

    // Prometheus metrics
    private final AtomicLong eventsPublished = new AtomicLong(0);
    private final AtomicLong eventsDropped = new AtomicLong(0);
    private final AtomicLong sendFailures = new AtomicLong(0);

    private Disruptor<PushEvent> disruptor;
    private RingBuffer<PushEvent> ringBuffer;
    private List<Registration> registrations = List.of();

    public TradeBroadcaster(
            SimpMessageSendingOperations messagingTemplate,
            TradeDataService tradeDataService,
            TradeRelayProperties properties,
            MeterRegistry meterRegistry) {
        this.messagingTemplate = messagingTemplate;
        this.tradeDataService = tradeDataService;
        this.properties = properties;

        meterRegistry.gauge("trades.broadcast.published", eventsPublished);
        meterRegistry.gauge("trades.broadcast.dropped", eventsDropped);
        meterRegistry.gauge("trades.broadcast.send.failures", sendFailures);
    }

    @PostConstruct
    public void start() {
        int bufferSize = properties.getBroadcast().getBufferSize();

        EventFactory<PushEvent> eventFactory = PushEvent::new;

        ThreadFactory threadFactory = new ThreadFactory() {
            private final AtomicInteger counter = new AtomicInteger(0);

            @Override
            public Thread newThread(Runnable r) {
                Thread thread = new Thread(r);
                thread.setName("trade-broadcaster-" + counter.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            }
        };

        WaitStrategy waitStrategy = createWaitStrategy();
        disruptor = new Disruptor<>(
            eventFactory,
            bufferSize,
            threadFactory,
            ProducerType.MULTI,  // reader thread plus reconnect thread publish status
            waitStrategy
        );

        disruptor.handleEventsWith(this::handleEvent);

        disruptor.setDefaultExceptionHandler(new ExceptionHandler<PushEvent>() {
            @Override
            public void handleEventException(Throwable ex, long sequence, PushEvent event) {
                log.error("Exception broadcasting to {} at sequence {}", event.destination, sequence, ex);
            }

            @Override
            public void handleOnStartException(Throwable ex) {
                log.error("Exception during broadcaster startup", ex);
            }

            @Override
            public void handleOnShutdownException(Throwable ex) {
                log.error("Exception during broadcaster shutdown", ex);
            }
        });

        ringBuffer = disruptor.start();

        registrations = List.of(
            tradeDataService.tradeReceived().subscribe(this::publishTrade),
            tradeDataService.connectionLost().subscribe(this::publishStatus),
            tradeDataService.connectionRestored().subscribe(this::publishStatus)
        );

        log.info("Trade broadcaster started: bufferSize={}, waitStrategy={}",
            bufferSize, waitStrategy.getClass().getSimpleName());
    }

    public boolean publishTrade(Trade trade) {
        return tryPublish(TRADES_DESTINATION_PREFIX + trade.symbol().wireValue(), trade);
    }

    public boolean publishStatus(ConnectionEvent event) {
        return tryPublish(STATUS_DESTINATION, event);
    }

    /**
     * Claims a ring buffer slot without blocking.
     *
     * @return false if the buffer was full and the event dropped
     */
    boolean tryPublish(String destination, Object payload) {
        try {
            long sequence = ringBuffer.tryNext();
            try {
                PushEvent event = ringBuffer.get(sequence);
                event.destination = destination;
                event.payload = payload;
            } finally {
                ringBuffer.publish(sequence);
            }
            eventsPublished.incrementAndGet();
            return true;
        } catch (InsufficientCapacityException e) {
            long dropped = eventsDropped.incrementAndGet();
            if (dropped == 1 || dropped % 1000 == 0) {
                log.warn("Broadcast ring buffer full, {} event(s) dropped so far", dropped);
            }
            return false;
        }
    }

    private void handleEvent(PushEvent event, long sequence, boolean endOfBatch) {
        if (event.payload == null) {
            return;
        }
        try {
            messagingTemplate.convertAndSend(event.destination, event.payload);
        } catch (RuntimeException e) {
            sendFailures.incrementAndGet();
            log.warn("Failed to push to {}: {}", event.destination, e.getMessage());
        } finally {
            // Release the reference held by the pre-allocated slot
            event.destination = null;
            event.payload = null;
        }
        if (endOfBatch && log.isTraceEnabled()) {
            log.trace("Broadcast batch ended at sequence {}", sequence);
        }
    }

    @PreDestroy
    public void shutdown() {
        registrations.forEach(Registration::remove);
        registrations = List.of();
        if (disruptor != null) {
            log.info("Shutting down trade broadcaster...");
            disruptor.shutdown();
            disruptor = null;
            log.info("Trade broadcaster shutdown complete");
        }
    }

    private WaitStrategy createWaitStrategy() {
        return waitStrategyFor(properties.getBroadcast().getWaitStrategy());
    }

    /**
     * The consumer spends its time in STOMP sends, so only parking strategies are
     * offered; anything else falls back to BLOCKING.
     */
    static WaitStrategy waitStrategyFor(String strategy) {
        return switch (strategy.toUpperCase()) {
            case "BLOCKING" -> new BlockingWaitStrategy();
            case "SLEEPING" -> new SleepingWaitStrategy();
            default -> {
                log.warn("Unknown wait strategy: {}, using BLOCKING", strategy);
                yield new BlockingWaitStrategy();
            }
        };
    }

    public long getEventsDropped() {
        return eventsDropped.get();
    }

    public long getEventsPublished() {
        return eventsPublished.get();
    }

    public long getRemainingCapacity() {
        return ringBuffer.remainingCapacity();
    }

    /** Pre-allocated ring buffer slot. */
    private static class PushEvent {
        String destination;
        Object payload;
    }
}
