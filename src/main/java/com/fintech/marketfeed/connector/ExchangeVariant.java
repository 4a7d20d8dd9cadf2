package com.fintech.marketfeed.connector;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of sources the built-in vendor connectivity layer can talk to.
 */
public enum ExchangeVariant {

    BINANCE_SPOT("binance_spot"),
    BINANCE_USDM("binance_usdm"),
    BYBIT("bybit"),
    OKX("okx"),
    KRAKEN_SPOT("kraken_spot"),
    GEMINI("gemini"),
    SIMULATED("sim");

    private final String id;

    ExchangeVariant(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    /**
     * Resolves a source id. Lookup is case-insensitive and treats '-' as '_'.
     */
    public static Optional<ExchangeVariant> fromId(String sourceId) {
        if (sourceId == null) {
            return Optional.empty();
        }
        String key = sourceId.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        return Arrays.stream(values())
            .filter(variant -> variant.id.equals(key))
            .findFirst();
    }
}
