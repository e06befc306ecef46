package com.fintech.trades.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;

/**
 * STOMP push channel for downstream clients.
 *
 * - connect: {@code /ws} (SockJS fallback)
 * - subscribe to trades: {@code /topic/trades.BTC-USD}
 * - connection status: {@code /topic/status}
 * - requests: {@code /app/trades.subscribe}, {@code /app/trades.unsubscribe}
 * - replies: {@code /user/queue/replies}
 */
@Configuration
@EnableWebSocketMessageBroker
public class MessagingConfig implements WebSocketMessageBrokerConfigurer {

    @Override
    public void configureMessageBroker(MessageBrokerRegistry config) {
        config.enableSimpleBroker("/topic", "/queue");  // In-memory broker
        config.setApplicationDestinationPrefixes("/app");
        config.setUserDestinationPrefix("/user");
    }

    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        registry.addEndpoint("/ws")
            .setAllowedOriginPatterns("*")
            .withSockJS();
    }
}
