package com.fintech.marketfeed.directory;

import com.fintech.marketfeed.domain.InstrumentDirectoryEntry;
import com.fintech.marketfeed.error.ConnectorException;

import java.util.List;

/**
 * Secondary source of instrument listings, independent of the connectors.
 */
public interface SymbolDirectoryProvider {

    /** True if the directory lists instruments for the source id. */
    boolean supports(String sourceId);

    /** Exchange names the directory knows, in its own naming. */
    List<String> exchanges();

    /** Instrument types the directory offers for the source, default type first. */
    List<String> instrumentTypes(String sourceId);

    /**
     * @throws ConnectorException if the directory cannot be reached or answers with an error
     */
    List<InstrumentDirectoryEntry> fetchSymbols(String sourceId, String instrumentType);
}
