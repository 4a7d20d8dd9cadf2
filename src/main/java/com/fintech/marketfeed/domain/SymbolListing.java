package com.fintech.marketfeed.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Symbols of a single instrument type on one source.
 */
public record SymbolListing(
    String exchange,
    @JsonProperty("instrument_type") String instrumentType,
    List<InstrumentDirectoryEntry> symbols,
    @JsonProperty("total_symbols") int totalSymbols
) implements DirectoryResult {

    public static SymbolListing of(String exchange, String instrumentType, List<InstrumentDirectoryEntry> symbols) {
        return new SymbolListing(exchange, instrumentType, List.copyOf(symbols), symbols.size());
    }
}
