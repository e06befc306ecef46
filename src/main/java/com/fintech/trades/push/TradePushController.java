package com.fintech.trades.push;

import com.fintech.trades.domain.Symbol;
import com.fintech.trades.push.PushMessages.SubscriptionReply;
import com.fintech.trades.push.PushMessages.SubscriptionRequest;
import com.fintech.trades.service.TradeDataService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.annotation.SendToUser;
import org.springframework.stereotype.Controller;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

import java.util.Set;

/**
 * STOMP endpoints through which push clients (un)subscribe to a symbol's trades.
 *
 * Trades themselves are delivered on {@code /topic/trades.{symbol}} by
 * {@link TradeBroadcaster}; these endpoints only maintain the relay's reference
 * counts. Replies go to {@code /user/queue/replies} of the requesting session.
 */
@Controller
public class TradePushController {

    private static final Logger log = LoggerFactory.getLogger(TradePushController.class);

    private final TradeDataService tradeDataService;
    private final ClientSubscriptionRegistry registry;

    public TradePushController(TradeDataService tradeDataService, ClientSubscriptionRegistry registry) {
        this.tradeDataService = tradeDataService;
        this.registry = registry;
    }

    @MessageMapping("/trades.subscribe")
    @SendToUser(value = "/queue/replies", broadcast = false)
    public SubscriptionReply subscribe(
            @Payload SubscriptionRequest request,
            @Header(SimpMessageHeaderAccessor.SESSION_ID_HEADER) String sessionId) {
        Symbol symbol;
        try {
            symbol = validate(request);
        } catch (IllegalArgumentException e) {
            log.warn("Rejected subscribe from session {}: {}", sessionId, e.getMessage());
            return SubscriptionReply.error(e.getMessage());
        }

        if (registry.add(sessionId, symbol)) {
            tradeDataService.subscribeToTrades(symbol);
            log.info("Session {} subscribed to {}", sessionId, symbol);
        }
        return SubscriptionReply.ok("subscribed", symbol.wireValue());
    }

    @MessageMapping("/trades.unsubscribe")
    @SendToUser(value = "/queue/replies", broadcast = false)
    public SubscriptionReply unsubscribe(
            @Payload SubscriptionRequest request,
            @Header(SimpMessageHeaderAccessor.SESSION_ID_HEADER) String sessionId) {
        Symbol symbol;
        try {
            symbol = validate(request);
        } catch (IllegalArgumentException e) {
            log.warn("Rejected unsubscribe from session {}: {}", sessionId, e.getMessage());
            return SubscriptionReply.error(e.getMessage());
        }

        if (registry.remove(sessionId, symbol)) {
            tradeDataService.unsubscribeFromTrades(symbol);
            log.info("Session {} unsubscribed from {}", sessionId, symbol);
        }
        return SubscriptionReply.ok("unsubscribed", symbol.wireValue());
    }

    /**
     * Releases everything a closed session still held.
     */
    @EventListener
    public void onSessionDisconnect(SessionDisconnectEvent event) {
        releaseSession(event.getSessionId());
    }

    void releaseSession(String sessionId) {
        Set<Symbol> held = registry.removeSession(sessionId);
        if (!held.isEmpty()) {
            log.info("Session {} disconnected, releasing {}", sessionId, held);
            held.forEach(tradeDataService::unsubscribeFromTrades);
        }
    }

    private static Symbol validate(SubscriptionRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Request body is required");
        }
        if (!PushMessages.TRADES_CHANNEL.equalsIgnoreCase(request.channel())) {
            throw new IllegalArgumentException("Unsupported channel: " + request.channel());
        }
        return Symbol.fromWireValue(request.symbol());
    }
}
