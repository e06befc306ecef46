package com.fintech.trades.api;

import com.fintech.trades.domain.Trade;
import io.swagger.v3.oas.annotations.media.Schema;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Cached trades for one symbol, most recent first.
 */
@Schema(description = "Cached trades for a symbol ordered by timestamp descending")
public record TradesResponse(

    @Schema(description = "Instrument", example = "BTC-USD")
    String symbol,

    @Schema(description = "Number of trades returned", example = "2")
    int count,

    @Schema(description = "Trades, most recent first")
    List<TradeDto> trades
) {

    public static TradesResponse fromTrades(String symbol, List<Trade> trades) {
        List<TradeDto> dtos = trades.stream().map(TradeDto::fromTrade).toList();
        return new TradesResponse(symbol, dtos.size(), dtos);
    }

    @Schema(description = "Single trade print")
    public record TradeDto(
        @Schema(description = "Exchange trade id", example = "12884909920")
        String tradeId,

        @Schema(description = "Execution time (UTC)", example = "2019-08-13T11:30:06.100140Z")
        Instant timestamp,

        @Schema(description = "Aggressor side", example = "sell")
        String side,

        @Schema(description = "Execution price", example = "11252.4")
        BigDecimal price,

        @Schema(description = "Executed quantity", example = "0.000085")
        BigDecimal quantity,

        @Schema(description = "Upstream sequence number", example = "21")
        int sequenceNumber
    ) {
        static TradeDto fromTrade(Trade trade) {
            return new TradeDto(
                trade.tradeId(),
                trade.timestamp(),
                trade.side().wireValue(),
                trade.price(),
                trade.quantity(),
                trade.sequenceNumber());
        }
    }
}
