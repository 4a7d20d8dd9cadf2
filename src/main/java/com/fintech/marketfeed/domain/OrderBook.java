package com.fintech.marketfeed.domain;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fintech.marketfeed.util.MillisInstantSerializer;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Full order book snapshot. Each poll replaces the previous snapshot; there are
 * no incremental updates.
 *
 * @param source Source id
 * @param symbol Unified instrument symbol
 * @param sequence Vendor sequence/nonce, null when the vendor has none
 * @param bids Bid levels, best (highest) price first
 * @param asks Ask levels, best (lowest) price first
 * @param timestamp Snapshot time (UTC, millisecond precision)
 */
public record OrderBook(
    String source,
    String symbol,
    Long sequence,
    List<PriceLevel> bids,
    List<PriceLevel> asks,
    @JsonSerialize(using = MillisInstantSerializer.class) Instant timestamp
) {

    /**
     * Validates side ordering: bids strictly non-increasing, asks non-decreasing.
     */
    public OrderBook {
        Objects.requireNonNull(source, "Source cannot be null");
        Objects.requireNonNull(symbol, "Symbol cannot be null");
        Objects.requireNonNull(timestamp, "Timestamp cannot be null");
        bids = List.copyOf(bids);
        asks = List.copyOf(asks);

        for (int i = 1; i < bids.size(); i++) {
            if (bids.get(i).price().compareTo(bids.get(i - 1).price()) > 0) {
                throw new IllegalArgumentException("Bids must be sorted by descending price");
            }
        }
        for (int i = 1; i < asks.size(); i++) {
            if (asks.get(i).price().compareTo(asks.get(i - 1).price()) < 0) {
                throw new IllegalArgumentException("Asks must be sorted by ascending price");
            }
        }
    }

    public boolean isEmpty() {
        return bids.isEmpty() && asks.isEmpty();
    }
}
