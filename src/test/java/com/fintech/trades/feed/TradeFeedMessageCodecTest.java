package com.fintech.trades.feed;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.trades.domain.FeedEvent;
import com.fintech.trades.domain.Side;
import com.fintech.trades.domain.SubscriptionResponse;
import com.fintech.trades.domain.Symbol;
import com.fintech.trades.domain.Trade;
import com.fintech.trades.feed.TradeFeedMessageCodec.FeedMessage;
import com.fintech.trades.feed.TradeFeedMessageCodec.SubscriptionMessage;
import com.fintech.trades.feed.TradeFeedMessageCodec.TradeMessage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("TradeFeedMessageCodec Tests")
class TradeFeedMessageCodecTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final TradeFeedMessageCodec codec = new TradeFeedMessageCodec(objectMapper);

    @Nested
    @DisplayName("Encoding")
    class Encoding {

        @Test
        @DisplayName("Subscribe request carries action, channel, symbol and token")
        void subscribe() throws Exception {
            JsonNode json = objectMapper.readTree(codec.encodeSubscribe(Symbol.BTC_USD, "secret"));

            assertThat(json.get("action").asText()).isEqualTo("subscribe");
            assertThat(json.get("channel").asText()).isEqualTo("trades");
            assertThat(json.get("symbol").asText()).isEqualTo("BTC-USD");
            assertThat(json.get("token").asText()).isEqualTo("secret");
        }

        @Test
        @DisplayName("Token is omitted when not configured")
        void unsubscribeWithoutToken() throws Exception {
            JsonNode json = objectMapper.readTree(codec.encodeUnsubscribe(Symbol.ETH_USD, " "));

            assertThat(json.get("action").asText()).isEqualTo("unsubscribe");
            assertThat(json.get("symbol").asText()).isEqualTo("ETH-USD");
            assertThat(json.has("token")).isFalse();
        }
    }

    @Nested
    @DisplayName("Decoding trades")
    class DecodingTrades {

        @Test
        @DisplayName("Decodes an updated trade without losing decimal precision")
        void decodesTrade() {
            String payload = """
                {"seqnum":21,"event":"updated","channel":"trades","symbol":"BTC-USD",
                 "timestamp":"2019-08-13T11:30:06.100140Z","side":"sell","qty":8.5E-5,
                 "price":11252.4,"trade_id":"12884909920"}
                """;

            Trade trade = decodeTrade(payload);

            assertThat(trade.sequenceNumber()).isEqualTo(21);
            assertThat(trade.event()).isEqualTo(FeedEvent.UPDATED);
            assertThat(trade.symbol()).isEqualTo(Symbol.BTC_USD);
            assertThat(trade.timestamp()).isEqualTo(Instant.parse("2019-08-13T11:30:06.100140Z"));
            assertThat(trade.side()).isEqualTo(Side.SELL);
            assertThat(trade.quantity()).isEqualByComparingTo(new BigDecimal("0.000085"));
            assertThat(trade.price()).isEqualByComparingTo(new BigDecimal("11252.4"));
            assertThat(trade.tradeId()).isEqualTo("12884909920");
        }

        @Test
        @DisplayName("Accepts snapshot trades and numeric fields sent as strings")
        void decodesSnapshotWithStringNumbers() {
            String payload = """
                {"seqnum":3,"event":"snapshot","channel":"trades","symbol":"eth-usd",
                 "timestamp":"2026-10-17T10:00:00.000001+00:00","side":"buy","qty":"1.25",
                 "price":"2500.10","trade_id":"e-1"}
                """;

            Trade trade = decodeTrade(payload);

            assertThat(trade.event()).isEqualTo(FeedEvent.SNAPSHOT);
            assertThat(trade.symbol()).isEqualTo(Symbol.ETH_USD);
            assertThat(trade.side()).isEqualTo(Side.BUY);
            assertThat(trade.quantity()).isEqualByComparingTo("1.25");
        }

        @ParameterizedTest(name = "{0}")
        @ValueSource(strings = {
            "{\"event\":\"updated\",\"channel\":\"trades\",\"timestamp\":\"2026-10-17T10:00:00Z\",\"side\":\"buy\",\"qty\":1,\"price\":1,\"trade_id\":\"x\"}",
            "{\"event\":\"updated\",\"channel\":\"trades\",\"symbol\":\"BTC-USD\",\"timestamp\":\"yesterday\",\"side\":\"buy\",\"qty\":1,\"price\":1,\"trade_id\":\"x\"}",
            "{\"event\":\"updated\",\"channel\":\"trades\",\"symbol\":\"BTC-USD\",\"timestamp\":\"2026-10-17T10:00:00Z\",\"side\":\"hold\",\"qty\":1,\"price\":1,\"trade_id\":\"x\"}",
            "{\"event\":\"updated\",\"channel\":\"trades\",\"symbol\":\"BTC-USD\",\"timestamp\":\"2026-10-17T10:00:00Z\",\"side\":\"buy\",\"price\":1,\"trade_id\":\"x\"}",
            "{\"event\":\"updated\",\"channel\":\"trades\",\"symbol\":\"BTC-USD\",\"timestamp\":\"2026-10-17T10:00:00Z\",\"side\":\"buy\",\"qty\":-1,\"price\":1,\"trade_id\":\"x\"}",
            "{\"event\":\"updated\",\"channel\":\"trades\",\"symbol\":\"BTC-USD\",\"timestamp\":\"2026-10-17T10:00:00Z\",\"side\":\"buy\",\"qty\":1,\"price\":\"abc\",\"trade_id\":\"x\"}",
            "{\"event\":\"updated\",\"channel\":\"trades\",\"symbol\":\"BTC-USD\",\"timestamp\":\"2026-10-17T10:00:00Z\",\"side\":\"buy\",\"qty\":1,\"price\":1}",
            "{\"event\":\"updated\",\"channel\":\"trades\",\"symbol\":\"XRP-USD\",\"timestamp\":\"2026-10-17T10:00:00Z\",\"side\":\"buy\",\"qty\":1,\"price\":1,\"trade_id\":\"x\"}"
        })
        @DisplayName("Invalid trades decode to empty")
        void invalidTrades(String payload) {
            assertThat(codec.decode(payload)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Decoding acknowledgements")
    class DecodingAcks {

        @Test
        @DisplayName("Decodes a subscribed acknowledgement")
        void subscribed() {
            SubscriptionResponse response = decodeAck(
                "{\"seqnum\":1,\"event\":\"subscribed\",\"channel\":\"trades\",\"symbol\":\"BTC-USD\"}");

            assertThat(response.event()).isEqualTo(FeedEvent.SUBSCRIBED);
            assertThat(response.symbol()).isEqualTo(Symbol.BTC_USD);
            assertThat(response.sequenceNumber()).isEqualTo(1);
        }

        @Test
        @DisplayName("Rejection keeps the text and tolerates a missing symbol")
        void rejected() {
            SubscriptionResponse response = decodeAck(
                "{\"seqnum\":2,\"event\":\"rejected\",\"channel\":\"trades\",\"text\":\"Invalid token\"}");

            assertThat(response.event()).isEqualTo(FeedEvent.REJECTED);
            assertThat(response.symbol()).isNull();
            assertThat(response.text()).isEqualTo("Invalid token");
        }
    }

    @ParameterizedTest(name = "{0}")
    @ValueSource(strings = {
        "not json",
        "[1,2,3]",
        "{\"seqnum\":5,\"event\":\"heartbeat\",\"channel\":\"heartbeat\"}",
        "{\"seqnum\":6,\"channel\":\"trades\"}",
        "{\"seqnum\":7,\"event\":\"updated\",\"channel\":\"prices\",\"symbol\":\"BTC-USD\"}"
    })
    @DisplayName("Ignores unparseable, unknown and foreign-channel messages")
    void ignored(String payload) {
        assertThat(codec.decode(payload)).isEmpty();
    }

    private Trade decodeTrade(String payload) {
        Optional<FeedMessage> message = codec.decode(payload);
        assertThat(message).containsInstanceOf(TradeMessage.class);
        return ((TradeMessage) message.orElseThrow()).trade();
    }

    private SubscriptionResponse decodeAck(String payload) {
        Optional<FeedMessage> message = codec.decode(payload);
        assertThat(message).containsInstanceOf(SubscriptionMessage.class);
        return ((SubscriptionMessage) message.orElseThrow()).response();
    }
}
