package com.fintech.marketfeed.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration for API documentation.
 *
 * Access the interactive API documentation at:
 * - Swagger UI: http://localhost:8080/swagger-ui/index.html
 * - OpenAPI JSON: http://localhost:8080/v3/api-docs
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI marketFeedOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Market Feed Aggregator API")
                        .description("""
                                Multi-exchange market data polling and aggregated queries.

                                **Features:**
                                - Periodic ticker polling per configured (exchange, symbol)
                                - CSV and JSON ticker files per exchange
                                - Concurrent ticker, order book, trades and market info queries
                                - Symbol and instrument type discovery

                                **Tech Stack:**
                                - LMAX Disruptor (single-writer persistence hand-off)
                                - Resilience4j circuit breakers around vendor calls
                                - Spring Boot 3.2
                                """)
                        .version("1.0.0"))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:8080")
                                .description("Local Development Server")
                ));
    }
}
