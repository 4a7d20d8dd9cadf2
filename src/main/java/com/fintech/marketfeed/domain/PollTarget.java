package com.fintech.marketfeed.domain;

import java.time.Duration;
import java.util.Objects;

/**
 * Unit of scheduling: one symbol on one source with its own refresh interval.
 */
public record PollTarget(
    String source,
    String symbol,
    Duration interval
) {

    public PollTarget {
        Objects.requireNonNull(source, "Source cannot be null");
        Objects.requireNonNull(symbol, "Symbol cannot be null");
        Objects.requireNonNull(interval, "Interval cannot be null");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Interval must be positive: " + interval);
        }
    }

    /** Returns "source:symbol", used for logging and thread names. */
    public String key() {
        return source + ":" + symbol;
    }
}
