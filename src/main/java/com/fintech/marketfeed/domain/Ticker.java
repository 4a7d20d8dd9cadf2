package com.fintech.marketfeed.domain;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fintech.marketfeed.util.MillisInstantSerializer;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * Canonical 24h ticker snapshot for one instrument on one source.
 * Numeric fields are nullable: a value the vendor did not report stays absent
 * instead of being defaulted to zero.
 *
 * @param source Source id (e.g. "binance_spot")
 * @param symbol Unified instrument symbol (e.g. "BTC/USDT")
 * @param last Last traded price
 * @param bid Best bid
 * @param ask Best ask
 * @param high 24h high
 * @param low 24h low
 * @param volume 24h base volume
 * @param percentage 24h change in percent
 * @param vwap 24h volume weighted average price
 * @param timestamp Capture time (UTC, millisecond precision)
 */
public record Ticker(
    String source,
    String symbol,
    BigDecimal last,
    BigDecimal bid,
    BigDecimal ask,
    BigDecimal high,
    BigDecimal low,
    BigDecimal volume,
    BigDecimal percentage,
    BigDecimal vwap,
    @JsonSerialize(using = MillisInstantSerializer.class) Instant timestamp
) {

    public Ticker {
        Objects.requireNonNull(source, "Source cannot be null");
        Objects.requireNonNull(symbol, "Symbol cannot be null");
        Objects.requireNonNull(timestamp, "Timestamp cannot be null");
    }

    /** Returns true if the vendor reported a last price. */
    public boolean hasPrice() {
        return last != null;
    }
}
