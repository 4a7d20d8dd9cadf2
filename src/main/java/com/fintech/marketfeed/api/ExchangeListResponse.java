package com.fintech.marketfeed.api;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

/**
 * Source ids configured for polling in this run.
 */
@Schema(description = "Configured exchanges")
public record ExchangeListResponse(
    @Schema(description = "Source ids in configuration order", example = "[\"binance_spot\", \"bybit\"]")
    List<String> exchanges
) {}
