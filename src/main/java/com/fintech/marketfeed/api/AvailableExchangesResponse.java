package com.fintech.marketfeed.api;

import com.fintech.marketfeed.domain.ExchangeAvailability;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(description = "Every known exchange with its availability flags")
public record AvailableExchangesResponse(
    List<ExchangeAvailability> exchanges
) {}
