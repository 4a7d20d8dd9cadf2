package com.fintech.marketfeed.directory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fintech.marketfeed.domain.InstrumentDirectoryEntry;
import com.fintech.marketfeed.error.ConnectorException;
import com.fintech.marketfeed.error.NormalizationException;
import com.fintech.marketfeed.normalization.MarketDataNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * GoMarket symbol directory: {@code GET /api/symbols/{exchange}/{type}} returning
 * {@code {"symbols": [{"name", "base", "quote"}, ...]}}.
 */
public class GoMarketSymbolDirectory implements SymbolDirectoryProvider {

    private static final Logger log = LoggerFactory.getLogger(GoMarketSymbolDirectory.class);

    static final String SOURCE = "gomarket";

    private final RestClient restClient;
    private final MarketDataNormalizer normalizer;

    public GoMarketSymbolDirectory(RestClient restClient, MarketDataNormalizer normalizer) {
        this.restClient = restClient;
        this.normalizer = normalizer;
    }

    @Override
    public boolean supports(String sourceId) {
        return GoMarketRoutes.EXCHANGE_INSTRUMENT_TYPES.containsKey(GoMarketRoutes.exchangeFor(sourceId));
    }

    @Override
    public List<String> exchanges() {
        return List.copyOf(new TreeSet<>(GoMarketRoutes.EXCHANGE_INSTRUMENT_TYPES.keySet()));
    }

    @Override
    public List<String> instrumentTypes(String sourceId) {
        return GoMarketRoutes.EXCHANGE_INSTRUMENT_TYPES.getOrDefault(GoMarketRoutes.exchangeFor(sourceId), List.of("spot"));
    }

    @Override
    public List<InstrumentDirectoryEntry> fetchSymbols(String sourceId, String instrumentType) {
        String exchange = GoMarketRoutes.exchangeFor(sourceId);
        String type = GoMarketRoutes.instrumentTypeFor(exchange, instrumentType);

        JsonNode response;
        try {
            response = restClient.get()
                .uri("/api/symbols/{exchange}/{type}", exchange, type)
                .retrieve()
                .body(JsonNode.class);
        } catch (RestClientException e) {
            throw new ConnectorException(SOURCE,
                String.format("Symbol directory request for %s/%s failed: %s", exchange, type, e.getMessage()), e);
        }

        JsonNode symbols = response == null ? null : response.get("symbols");
        if (symbols == null || symbols.isNull()) {
            return List.of();
        }
        if (!symbols.isArray()) {
            throw new ConnectorException(SOURCE, "Symbol directory returned malformed listing for " + exchange + "/" + type);
        }

        List<InstrumentDirectoryEntry> entries = new ArrayList<>(symbols.size());
        for (JsonNode symbol : symbols) {
            try {
                entries.add(normalizer.toDirectoryEntry(symbol, type));
            } catch (NormalizationException e) {
                log.debug("Skipping directory entry for {}/{}: {}", exchange, type, e.getMessage());
            }
        }
        log.debug("Symbol directory returned {} {} symbols for {}", entries.size(), type, exchange);
        return entries;
    }
}
