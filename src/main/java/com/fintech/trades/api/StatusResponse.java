package com.fintech.trades.api;

import com.fintech.trades.service.TradeDataService;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Relay status snapshot.
 */
@Schema(description = "Upstream connection, subscription and cache status")
public record StatusResponse(

    @Schema(description = "Whether the relay has been started", example = "true")
    boolean running,

    @Schema(description = "Live upstream connectivity", example = "true")
    boolean connected,

    @Schema(description = "Connection state", example = "CONNECTED")
    String connectionState,

    @Schema(description = "Current reconnect backoff delay in seconds", example = "5.0")
    double backoffDelaySeconds,

    @Schema(description = "Consumer reference count per subscribed symbol")
    Map<String, Integer> subscriptions,

    @Schema(description = "Cached trade count per symbol")
    Map<String, Integer> cachedTrades,

    @Schema(description = "Duplicate trades received and ignored", example = "3")
    long duplicateTrades
) {

    public static StatusResponse from(TradeDataService service) {
        Map<String, Integer> subscriptions = new LinkedHashMap<>();
        service.getSubscriptionCounts().forEach((symbol, count) -> subscriptions.put(symbol.wireValue(), count));

        Map<String, Integer> cached = new LinkedHashMap<>();
        service.getCachedTradeCounts().forEach((symbol, count) -> cached.put(symbol.wireValue(), count));

        return new StatusResponse(
            service.isRunning(),
            service.isConnected(),
            service.getConnectionState().name(),
            service.getCurrentBackoffDelay().toMillis() / 1000.0,
            subscriptions,
            cached,
            service.getDuplicateTrades());
    }
}
