package com.fintech.trades.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI document for the trade API.
 *
 * - Swagger UI: http://localhost:8080/swagger-ui/index.html
 * - OpenAPI JSON: http://localhost:8080/v3/api-docs
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI tradeRelayOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Trade Relay Service API")
                        .description("""
                                Relays real-time trades from the Blockchain.com Exchange feed.

                                **Features:**
                                - Recent-trade queries per symbol (count, before, since)
                                - Automatic reconnect with exponential backoff
                                - Reference-counted upstream subscriptions
                                - STOMP push channel at /ws (topics /topic/trades.{symbol}, /topic/status)
                                """)
                        .version("1.0.0"))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:8080")
                                .description("Local Development Server")
                ));
    }
}
