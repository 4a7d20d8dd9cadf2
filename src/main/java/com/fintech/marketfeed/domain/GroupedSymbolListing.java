package com.fintech.marketfeed.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Symbols of every instrument type on one source, grouped by type with per-type counts.
 */
public record GroupedSymbolListing(
    String exchange,
    @JsonProperty("instrument_types") Map<String, TypeGroup> instrumentTypes,
    @JsonProperty("total_symbols") int totalSymbols
) implements DirectoryResult {

    /**
     * Builds the grouped listing, keeping the order in which types were supplied.
     */
    public static GroupedSymbolListing of(String exchange, Map<String, List<InstrumentDirectoryEntry>> byType) {
        Map<String, TypeGroup> groups = new LinkedHashMap<>();
        int total = 0;
        for (Map.Entry<String, List<InstrumentDirectoryEntry>> entry : byType.entrySet()) {
            List<InstrumentDirectoryEntry> symbols = List.copyOf(entry.getValue());
            groups.put(entry.getKey(), new TypeGroup(symbols.size(), symbols));
            total += symbols.size();
        }
        return new GroupedSymbolListing(exchange, Collections.unmodifiableMap(groups), total);
    }

    public record TypeGroup(int count, List<InstrumentDirectoryEntry> symbols) {
    }
}
