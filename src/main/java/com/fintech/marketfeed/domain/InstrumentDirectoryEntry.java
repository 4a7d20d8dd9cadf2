package com.fintech.marketfeed.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One tradable instrument as listed by a source or the symbol directory.
 *
 * @param name Symbol name as the listing reports it
 * @param base Base currency
 * @param quote Quote currency
 * @param type Instrument type (spot, future, swap, option, ...)
 * @param active Trading status, null when the listing does not report it
 */
public record InstrumentDirectoryEntry(
    String name,
    String base,
    String quote,
    String type,
    @JsonProperty("active") Boolean active
) {

    public InstrumentDirectoryEntry {
        Objects.requireNonNull(name, "Name cannot be null");
    }
}
