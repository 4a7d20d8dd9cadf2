package com.fintech.marketfeed.domain;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fintech.marketfeed.util.MillisInstantSerializer;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * Canonical public trade.
 *
 * @param source Source id
 * @param symbol Unified instrument symbol
 * @param id Source-assigned trade id, null when the vendor does not expose one
 * @param price Execution price
 * @param size Executed base quantity
 * @param side Aggressor side
 * @param timestamp Execution time (UTC, millisecond precision)
 */
public record Trade(
    String source,
    String symbol,
    String id,
    BigDecimal price,
    BigDecimal size,
    TradeSide side,
    @JsonSerialize(using = MillisInstantSerializer.class) Instant timestamp
) {

    public Trade {
        Objects.requireNonNull(source, "Source cannot be null");
        Objects.requireNonNull(symbol, "Symbol cannot be null");
        Objects.requireNonNull(price, "Price cannot be null");
        Objects.requireNonNull(size, "Size cannot be null");
        Objects.requireNonNull(side, "Side cannot be null");
        Objects.requireNonNull(timestamp, "Timestamp cannot be null");
    }
}
