package com.fintech.trades.api;

import com.fintech.trades.config.TradeRelayProperties;
import com.fintech.trades.domain.Symbol;
import com.fintech.trades.domain.Trade;
import com.fintech.trades.service.TradeDataService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Min;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;

/**
 * REST API for cached trades, relay status and feed control.
 */
@RestController
@RequestMapping("/api/v1")
@Validated
@Tag(name = "Trades", description = "Recent trade queries and relay control")
public class TradeController {

    private static final Logger log = LoggerFactory.getLogger(TradeController.class);

    private final TradeDataService tradeDataService;
    private final TradeRelayProperties properties;
    private final MeterRegistry meterRegistry;

    public TradeController(
            TradeDataService tradeDataService,
            TradeRelayProperties properties,
            MeterRegistry meterRegistry) {
        this.tradeDataService = tradeDataService;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
    }

    /**
     * GET /api/v1/trades
     *
     * Most recent cached trades, optionally strictly before a timestamp.
     */
    @Operation(
        summary = "Get recent trades",
        description = """
            Returns up to `count` cached trades for a symbol, most recent first.
            With `before`, only trades strictly older than that instant are returned,
            which allows paging backwards through the cache.

            **Example Request:**
            ```
            GET /api/v1/trades?symbol=BTC-USD&count=50&before=2026-10-17T10:30:00Z
            ```
            """
    )
    @ApiResponses(value = {
        @ApiResponse(
            responseCode = "200",
            description = "Trades returned (possibly empty)",
            content = @Content(
                mediaType = "application/json",
                schema = @Schema(implementation = TradesResponse.class),
                examples = @ExampleObject(
                    name = "Sample Response",
                    value = """
                        {
                          "symbol": "BTC-USD",
                          "count": 1,
                          "trades": [
                            {
                              "tradeId": "12884909920",
                              "timestamp": "2019-08-13T11:30:06.100140Z",
                              "side": "sell",
                              "price": 11252.4,
                              "quantity": 0.000085,
                              "sequenceNumber": 21
                            }
                          ]
                        }
                        """
                )
            )
        ),
        @ApiResponse(
            responseCode = "400",
            description = "Unsupported symbol, invalid count or timestamp",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    @GetMapping("/trades")
    public ResponseEntity<TradesResponse> getRecentTrades(
            @Parameter(description = "Instrument, e.g. BTC-USD", example = "BTC-USD", required = true)
            @RequestParam String symbol,

            @Parameter(description = "Maximum number of trades to return", example = "100")
            @RequestParam(required = false)
            @Min(value = 0, message = "Count must be >= 0")
            Integer count,

            @Parameter(description = "Only trades strictly before this ISO-8601 instant", example = "2026-10-17T10:30:00Z")
            @RequestParam(required = false)
            Instant before) {

        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            Symbol parsed = Symbol.fromWireValue(symbol);
            int limit = resolveCount(count);

            List<Trade> trades = before == null
                ? tradeDataService.getRecentTrades(parsed, limit)
                : tradeDataService.getRecentTrades(parsed, limit, before);

            log.debug("Recent trades query: symbol={}, count={}, before={}, results={}",
                parsed, limit, before, trades.size());
            return ResponseEntity.ok(TradesResponse.fromTrades(parsed.wireValue(), trades));

        } finally {
            sample.stop(meterRegistry.timer("api.trades.request.time", "endpoint", "recent"));
        }
    }

    /**
     * GET /api/v1/trades/since
     *
     * Most recent cached trades strictly after a timestamp.
     */
    @Operation(
        summary = "Get trades since an instant",
        description = "Returns up to `count` cached trades strictly newer than `after`, most recent first."
    )
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Trades returned (possibly empty)",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = TradesResponse.class))),
        @ApiResponse(responseCode = "400", description = "Unsupported symbol, invalid count or timestamp",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class)))
    })
    @GetMapping("/trades/since")
    public ResponseEntity<TradesResponse> getTradesSince(
            @Parameter(description = "Instrument, e.g. BTC-USD", example = "BTC-USD", required = true)
            @RequestParam String symbol,

            @Parameter(description = "Only trades strictly after this ISO-8601 instant",
                example = "2026-10-17T10:00:00Z", required = true)
            @RequestParam Instant after,

            @Parameter(description = "Maximum number of trades to return", example = "100")
            @RequestParam(required = false)
            @Min(value = 0, message = "Count must be >= 0")
            Integer count) {

        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            Symbol parsed = Symbol.fromWireValue(symbol);
            List<Trade> trades = tradeDataService.getTradesSince(parsed, resolveCount(count), after);
            return ResponseEntity.ok(TradesResponse.fromTrades(parsed.wireValue(), trades));
        } finally {
            sample.stop(meterRegistry.timer("api.trades.request.time", "endpoint", "since"));
        }
    }

    /**
     * DELETE /api/v1/trades
     *
     * Administrative reset of one symbol's cache.
     */
    @Operation(summary = "Clear cached trades", description = "Drops all cached trades and seen trade ids for a symbol.")
    @DeleteMapping("/trades")
    public ResponseEntity<Void> clearTrades(
            @Parameter(description = "Instrument, e.g. BTC-USD", example = "BTC-USD", required = true)
            @RequestParam String symbol) {
        Symbol parsed = Symbol.fromWireValue(symbol);
        tradeDataService.clearTrades(parsed);
        log.info("Cleared cached trades for {}", parsed);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Get supported symbols")
    @GetMapping("/symbols")
    public ResponseEntity<List<String>> getSymbols() {
        return ResponseEntity.ok(Arrays.stream(Symbol.values()).map(Symbol::wireValue).toList());
    }

    @Operation(summary = "Get relay status",
        description = "Upstream connectivity, backoff delay, subscription reference counts and cache sizes.")
    @GetMapping("/status")
    public ResponseEntity<StatusResponse> getStatus() {
        return ResponseEntity.ok(StatusResponse.from(tradeDataService));
    }

    /**
     * POST /api/v1/feed/start
     *
     * Connecting may take arbitrarily long while the exchange is unreachable, so the
     * request is accepted and the connect runs in the background.
     */
    @Operation(summary = "Start the upstream feed", description = "Starts connecting in the background.")
    @ApiResponse(responseCode = "202", description = "Start accepted")
    @PostMapping("/feed/start")
    public ResponseEntity<StatusResponse> startFeed() {
        log.info("Feed start requested via API");
        tradeDataService.startAsync();
        return ResponseEntity.accepted().body(StatusResponse.from(tradeDataService));
    }

    @Operation(summary = "Stop the upstream feed", description = "Cancels reconnects and disconnects.")
    @PostMapping("/feed/stop")
    public ResponseEntity<StatusResponse> stopFeed() {
        log.info("Feed stop requested via API");
        tradeDataService.stop();
        return ResponseEntity.ok(StatusResponse.from(tradeDataService));
    }

    private int resolveCount(Integer count) {
        if (count == null) {
            return properties.getCache().getDefaultQueryCount();
        }
        int max = properties.getCache().getMaxQueryCount();
        if (count > max) {
            throw new IllegalArgumentException(String.format("Count must be <= %d, got %d", max, count));
        }
        return count;
    }
}
