package com.fintech.marketfeed.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Aggressor side of a trade.
 */
public enum TradeSide {

    BUY("buy"),
    SELL("sell");

    private final String wireName;

    TradeSide(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Case-insensitive lookup. Returns empty for anything other than buy/sell.
     */
    public static Optional<TradeSide> fromWireName(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "buy" -> Optional.of(BUY);
            case "sell" -> Optional.of(SELL);
            default -> Optional.empty();
        };
    }
}
