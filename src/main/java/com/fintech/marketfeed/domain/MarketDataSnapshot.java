package com.fintech.marketfeed.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merged result of an aggregated market data query. A facet that failed is null
 * and has an entry in {@code errors} keyed by facet name. A trades facet that
 * succeeded with no trades is an empty list, not null.
 */
public record MarketDataSnapshot(
    String exchange,
    String symbol,
    Ticker ticker,
    OrderBook orderbook,
    List<Trade> trades,
    @JsonProperty("market_info") InstrumentDirectoryEntry marketInfo,
    Map<String, String> errors
) {

    public static final String FACET_TICKER = "ticker";
    public static final String FACET_ORDERBOOK = "orderbook";
    public static final String FACET_TRADES = "trades";
    public static final String FACET_MARKET_INFO = "market_info";

    public MarketDataSnapshot {
        errors = Collections.unmodifiableMap(new LinkedHashMap<>(errors));
        trades = trades == null ? null : List.copyOf(trades);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
