package com.fintech.trades.feed;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fintech.trades.domain.FeedEvent;
import com.fintech.trades.domain.Side;
import com.fintech.trades.domain.SubscriptionResponse;
import com.fintech.trades.domain.Symbol;
import com.fintech.trades.domain.Trade;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * JSON codec for the exchange's {@code trades} channel.
 *
 * Outbound:
 * <pre>
 * {"action":"subscribe","channel":"trades","symbol":"BTC-USD","token":"..."}
 * </pre>
 * Inbound trade:
 * <pre>
 * {"seqnum":21,"event":"updated","channel":"trades","symbol":"BTC-USD",
 *  "timestamp":"2019-08-13T11:30:06.100140Z","side":"sell","qty":8.5E-5,
 *  "price":11252.4,"trade_id":"12884909920"}
 * </pre>
 * Heartbeats, other channels and unknown events decode to empty. A trade message with
 * missing or invalid fields also decodes to empty and is logged, so a partial trade
 * can never be produced.
 */
public class TradeFeedMessageCodec {

    private static final Logger log = LoggerFactory.getLogger(TradeFeedMessageCodec.class);

    static final String CHANNEL = "trades";

    private final ObjectMapper objectMapper;

    public TradeFeedMessageCodec(ObjectMapper objectMapper) {
        // Decimal fields must not round-trip through double
        this.objectMapper = objectMapper.copy().enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
    }

    /**
     * Messages the relay acts on.
     */
    public interface FeedMessage { }

    public record TradeMessage(Trade trade) implements FeedMessage { }

    public record SubscriptionMessage(SubscriptionResponse response) implements FeedMessage { }

    public String encodeSubscribe(Symbol symbol, String token) {
        return encode("subscribe", symbol, token);
    }

    public String encodeUnsubscribe(Symbol symbol, String token) {
        return encode("unsubscribe", symbol, token);
    }

    private String encode(String action, Symbol symbol, String token) {
        ObjectNode request = objectMapper.createObjectNode()
            .put("action", action)
            .put("channel", CHANNEL)
            .put("symbol", symbol.wireValue());
        if (token != null && !token.isBlank()) {
            request.put("token", token);
        }
        try {
            return objectMapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode " + action + " request for " + symbol, e);
        }
    }

    public Optional<FeedMessage> decode(String payload) {
        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            log.warn("Dropping unparseable feed message: {}", e.getOriginalMessage());
            return Optional.empty();
        }
        if (root == null || !root.isObject()) {
            log.warn("Dropping non-object feed message: {}", payload);
            return Optional.empty();
        }

        Optional<FeedEvent> event = FeedEvent.fromWireValue(text(root, "event"));
        if (event.isEmpty()) {
            log.debug("Ignoring feed message without a known event: {}", payload);
            return Optional.empty();
        }
        String channel = text(root, "channel");
        if (channel != null && !CHANNEL.equals(channel)) {
            log.debug("Ignoring message on channel {}", channel);
            return Optional.empty();
        }

        if (event.get().isSubscriptionAck()) {
            return Optional.of(decodeSubscription(root, event.get()));
        }
        return decodeTrade(root, event.get(), payload).map(TradeMessage::new);
    }

    private SubscriptionMessage decodeSubscription(JsonNode root, FeedEvent event) {
        Symbol symbol = null;
        String symbolText = text(root, "symbol");
        if (symbolText != null) {
            try {
                symbol = Symbol.fromWireValue(symbolText);
            } catch (IllegalArgumentException e) {
                log.warn("Subscription {} for unknown symbol {}", event.wireValue(), symbolText);
            }
        }
        return new SubscriptionMessage(
            new SubscriptionResponse(root.path("seqnum").asInt(0), event, symbol, text(root, "text")));
    }

    private Optional<Trade> decodeTrade(JsonNode root, FeedEvent event, String payload) {
        try {
            return Optional.of(new Trade(
                root.path("seqnum").asInt(0),
                event,
                Symbol.fromWireValue(required(root, "symbol")),
                parseTimestamp(required(root, "timestamp")),
                Side.fromWireValue(required(root, "side")),
                decimal(root, "qty"),
                decimal(root, "price"),
                required(root, "trade_id")
            ));
        } catch (IllegalArgumentException e) {
            log.warn("Dropping invalid trade message ({}): {}", e.getMessage(), payload);
            return Optional.empty();
        }
    }

    private static Instant parseTimestamp(String value) {
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid timestamp '" + value + "'", e);
        }
    }

    private static BigDecimal decimal(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            throw new IllegalArgumentException("Missing field '" + field + "'");
        }
        if (node.isNumber()) {
            return node.decimalValue();
        }
        try {
            return new BigDecimal(node.asText());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Field '" + field + "' is not a number: " + node.asText(), e);
        }
    }

    private static String required(JsonNode root, String field) {
        String value = text(root, field);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing field '" + field + "'");
        }
        return value;
    }

    private static String text(JsonNode root, String field) {
        JsonNode node = root.get(field);
        return node == null || node.isNull() ? null : node.asText();
    }
}
