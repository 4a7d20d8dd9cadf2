package com.fintech.marketfeed.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fintech.marketfeed.config.FeedConfiguration;
import com.fintech.marketfeed.connector.ConnectorRegistry;
import com.fintech.marketfeed.directory.SymbolDirectoryProvider;
import com.fintech.marketfeed.domain.DirectoryResult;
import com.fintech.marketfeed.domain.GroupedSymbolListing;
import com.fintech.marketfeed.domain.InstrumentDirectoryEntry;
import com.fintech.marketfeed.domain.SymbolListing;
import com.fintech.marketfeed.error.MarketFeedException;
import com.fintech.marketfeed.error.NormalizationException;
import com.fintech.marketfeed.error.UnknownSourceException;
import com.fintech.marketfeed.normalization.MarketDataNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Symbol listings per source and instrument type.
 *
 * The symbol directory answers for every source it covers, configured or not.
 * Other configured sources are answered from their connector's market listing.
 */
public class SymbolDirectoryService {

    private static final Logger log = LoggerFactory.getLogger(SymbolDirectoryService.class);

    static final String DEFAULT_TYPE = "spot";
    private static final String ALL = "all";

    /** Directory type names folded onto the connector's spot/swap/future vocabulary. */
    private static final Map<String, String> TYPE_ALIASES = Map.of(
        "perpetual", "swap",
        "linear", "swap",
        "usdm_futures", "swap",
        "perpetual_swap", "swap",
        "futures", "future",
        "ccy_pair", "spot"
    );

    private final FeedConfiguration configuration;
    private final ConnectorRegistry connectors;
    private final MarketDataNormalizer normalizer;
    private final SymbolDirectoryProvider directory;

    public SymbolDirectoryService(FeedConfiguration configuration,
                                  ConnectorRegistry connectors,
                                  MarketDataNormalizer normalizer,
                                  SymbolDirectoryProvider directory) {
        this.configuration = configuration;
        this.connectors = connectors;
        this.normalizer = normalizer;
        this.directory = directory;
    }

    /** True if the symbol directory is enabled and covers the source. */
    public boolean directorySupports(String source) {
        return configuration.symbolDirectory().enabled() && directory.supports(source);
    }

    /** Directory exchange names, empty when the directory is disabled. */
    public List<String> directoryExchanges() {
        return configuration.symbolDirectory().enabled() ? directory.exchanges() : List.of();
    }

    /**
     * Instrument types that can be listed for the source, default type first.
     *
     * @throws UnknownSourceException if neither a connector nor the directory covers the source
     */
    public List<String> listInstrumentTypes(String source) {
        requireKnown(source);
        if (directorySupports(source)) {
            return directory.instrumentTypes(source);
        }
        Set<String> types = new LinkedHashSet<>();
        for (InstrumentDirectoryEntry entry : connectorMarkets(source)) {
            if (entry.type() != null) {
                types.add(entry.type());
            }
        }
        if (types.isEmpty()) {
            return List.of(DEFAULT_TYPE);
        }
        List<String> ordered = new ArrayList<>(types);
        if (ordered.remove(DEFAULT_TYPE)) {
            ordered.add(0, DEFAULT_TYPE);
        }
        return ordered;
    }

    /**
     * Symbols of one instrument type, or of every type grouped when {@code allTypes} is set.
     *
     * @param instrumentType type to list, {@code spot} when null or blank
     */
    public DirectoryResult listSymbols(String source, String instrumentType, boolean allTypes) {
        return allTypes ? listAllSymbols(source) : listSymbols(source, instrumentType);
    }

    public SymbolListing listSymbols(String source, String instrumentType) {
        requireKnown(source);
        String type = instrumentType == null || instrumentType.isBlank()
            ? DEFAULT_TYPE
            : instrumentType.trim().toLowerCase(Locale.ROOT);

        List<InstrumentDirectoryEntry> symbols = directorySupports(source)
            ? directory.fetchSymbols(source, type)
            : filterByType(connectorMarkets(source), type);

        log.debug("Listed {} {} symbols for {}", symbols.size(), type, source);
        return SymbolListing.of(source, type, symbols);
    }

    /**
     * Every instrument type with its symbols. A type that cannot be fetched
     * contributes an empty list instead of failing the whole listing.
     */
    public GroupedSymbolListing listAllSymbols(String source) {
        requireKnown(source);
        Map<String, List<InstrumentDirectoryEntry>> byType = new LinkedHashMap<>();

        if (directorySupports(source)) {
            for (String type : directory.instrumentTypes(source)) {
                try {
                    byType.put(type, directory.fetchSymbols(source, type));
                } catch (MarketFeedException e) {
                    log.warn("Failed to fetch {} symbols for {}: {}", type, source, e.getMessage());
                    byType.put(type, List.of());
                }
            }
        } else {
            for (InstrumentDirectoryEntry entry : connectorMarkets(source)) {
                String type = entry.type() != null ? entry.type() : DEFAULT_TYPE;
                byType.computeIfAbsent(type, t -> new ArrayList<>()).add(entry);
            }
        }
        return GroupedSymbolListing.of(source, byType);
    }

    private void requireKnown(String source) {
        if (!connectors.contains(source) && !directorySupports(source)) {
            throw new UnknownSourceException(source);
        }
    }

    private List<InstrumentDirectoryEntry> connectorMarkets(String source) {
        JsonNode markets = connectors.get(source).fetchMarkets();
        List<InstrumentDirectoryEntry> entries = new ArrayList<>();
        for (JsonNode market : markets) {
            try {
                entries.add(normalizer.toDirectoryEntry(market, DEFAULT_TYPE));
            } catch (NormalizationException e) {
                log.debug("Skipping market entry from {}: {}", source, e.getMessage());
            }
        }
        return entries;
    }

    static List<InstrumentDirectoryEntry> filterByType(List<InstrumentDirectoryEntry> entries, String type) {
        if (ALL.equals(type)) {
            return entries;
        }
        String wanted = TYPE_ALIASES.getOrDefault(type, type);
        List<InstrumentDirectoryEntry> matching = new ArrayList<>();
        for (InstrumentDirectoryEntry entry : entries) {
            if (entry.type() != null && wanted.equalsIgnoreCase(entry.type())) {
                matching.add(entry);
            }
        }
        return matching;
    }
}
