package com.fintech.marketfeed.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fintech.marketfeed.config.FeedConfiguration;
import com.fintech.marketfeed.connector.ConnectorRegistry;
import com.fintech.marketfeed.connector.ExchangeConnector;
import com.fintech.marketfeed.connector.ExchangeVariant;
import com.fintech.marketfeed.domain.ExchangeAvailability;
import com.fintech.marketfeed.domain.InstrumentDirectoryEntry;
import com.fintech.marketfeed.domain.MarketDataSnapshot;
import com.fintech.marketfeed.domain.OrderBook;
import com.fintech.marketfeed.domain.Ticker;
import com.fintech.marketfeed.domain.Trade;
import com.fintech.marketfeed.error.ConnectorException;
import com.fintech.marketfeed.error.NormalizationException;
import com.fintech.marketfeed.ingestion.TickerEventPublisher;
import com.fintech.marketfeed.normalization.MarketDataNormalizer;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * On-demand path: single-ticker fetches and the multi-facet market data query.
 *
 * A market data query fetches ticker, order book, recent trades and market info
 * concurrently. Every facet succeeds or fails on its own; failures and facets
 * still running when the shared deadline passes are reported in the result's
 * error map instead of failing the whole query.
 */
public class MarketDataQueryService {

    private static final Logger log = LoggerFactory.getLogger(MarketDataQueryService.class);

    private final FeedConfiguration configuration;
    private final ConnectorRegistry connectors;
    private final MarketDataNormalizer normalizer;
    private final TickerEventPublisher publisher;
    private final SymbolDirectoryService symbolDirectory;
    private final ExecutorService queryExecutor;
    private final MeterRegistry meterRegistry;

    public MarketDataQueryService(FeedConfiguration configuration,
                                  ConnectorRegistry connectors,
                                  MarketDataNormalizer normalizer,
                                  TickerEventPublisher publisher,
                                  SymbolDirectoryService symbolDirectory,
                                  ExecutorService queryExecutor,
                                  MeterRegistry meterRegistry) {
        this.configuration = configuration;
        this.connectors = connectors;
        this.normalizer = normalizer;
        this.publisher = publisher;
        this.symbolDirectory = symbolDirectory;
        this.queryExecutor = queryExecutor;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Fetches and normalizes a fresh ticker and queues it for persistence.
     *
     * @throws com.fintech.marketfeed.error.UnknownSourceException if the source is not configured
     * @throws ConnectorException if the vendor call fails
     * @throws NormalizationException if the payload cannot be normalized
     */
    public Ticker triggerFetch(String source, String symbol) {
        requireSymbol(symbol);
        ExchangeConnector connector = connectors.get(source);

        Ticker ticker = normalizer.toTicker(connector.fetchTicker(symbol), source, symbol);
        if (!publisher.tryPublish(ticker)) {
            log.warn("Fetched ticker for {} {} not persisted: buffer full", source, symbol);
        }
        log.info("On-demand ticker {} {} last={}", source, symbol, ticker.last());
        return ticker;
    }

    /**
     * Ticker, order book, trades and market info for one symbol, each facet
     * isolated. Never throws for a facet failure.
     *
     * @throws com.fintech.marketfeed.error.UnknownSourceException if the source is not configured
     */
    public MarketDataSnapshot queryMarketData(String source, String symbol) {
        requireSymbol(symbol);
        ExchangeConnector connector = connectors.get(source);
        FeedConfiguration.QuerySettings query = configuration.query();

        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            Future<Ticker> ticker = queryExecutor.submit(
                () -> normalizer.toTicker(connector.fetchTicker(symbol), source, symbol));
            Future<OrderBook> orderBook = queryExecutor.submit(
                () -> normalizer.toOrderBook(connector.fetchOrderBook(symbol, query.orderBookDepth()), source, symbol));
            Future<List<Trade>> trades = queryExecutor.submit(
                () -> normalizer.toTrades(connector.fetchTrades(symbol, query.tradesLimit()), source, symbol));
            Future<InstrumentDirectoryEntry> marketInfo = queryExecutor.submit(
                marketInfoFacet(connector, symbol));

            long deadline = System.nanoTime() + query.facetTimeout().toNanos();
            Map<String, String> errors = new LinkedHashMap<>();

            MarketDataSnapshot snapshot = new MarketDataSnapshot(
                source,
                symbol,
                await(MarketDataSnapshot.FACET_TICKER, ticker, deadline, errors),
                await(MarketDataSnapshot.FACET_ORDERBOOK, orderBook, deadline, errors),
                await(MarketDataSnapshot.FACET_TRADES, trades, deadline, errors),
                await(MarketDataSnapshot.FACET_MARKET_INFO, marketInfo, deadline, errors),
                errors
            );

            if (snapshot.hasErrors()) {
                log.warn("Market data query {} {} completed with failed facets: {}", source, symbol, errors);
            }
            return snapshot;

        } finally {
            sample.stop(meterRegistry.timer("marketfeed.query.time", "source", source));
        }
    }

    /** Source ids configured for this run, in configuration order. */
    public List<String> listConfiguredSources() {
        return configuration.sourceIds();
    }

    /**
     * Every source id known to the connectivity layer or the symbol directory,
     * with the three availability facts for each.
     */
    public List<ExchangeAvailability> listAvailableSources() {
        List<ExchangeAvailability> available = new ArrayList<>();
        Set<String> covered = new LinkedHashSet<>();

        for (ExchangeVariant variant : ExchangeVariant.values()) {
            String id = variant.id();
            boolean directory = symbolDirectory.directorySupports(id);
            available.add(new ExchangeAvailability(id, true, configuration.isConfigured(id), directory));
            covered.add(id);
        }
        for (String exchange : symbolDirectory.directoryExchanges()) {
            boolean routedFromVariant = false;
            for (ExchangeVariant variant : ExchangeVariant.values()) {
                if (variant.id().startsWith(exchange + "_")) {
                    routedFromVariant = true;
                    break;
                }
            }
            if (!covered.contains(exchange) && !routedFromVariant) {
                available.add(new ExchangeAvailability(exchange, false, false, true));
            }
        }
        return available;
    }

    private Callable<InstrumentDirectoryEntry> marketInfoFacet(ExchangeConnector connector, String symbol) {
        return () -> {
            for (JsonNode market : connector.fetchMarkets()) {
                JsonNode name = market.get("symbol");
                if (name != null && symbol.equalsIgnoreCase(name.asText())) {
                    return normalizer.toDirectoryEntry(market, null);
                }
            }
            throw new ConnectorException(connector.sourceId(),
                "Symbol " + symbol + " is not listed on " + connector.sourceId());
        };
    }

    private <T> T await(String facet, Future<T> future, long deadlineNanos, Map<String, String> errors) {
        try {
            long remaining = Math.max(0, deadlineNanos - System.nanoTime());
            return future.get(remaining, TimeUnit.NANOSECONDS);

        } catch (TimeoutException e) {
            future.cancel(true);
            return failed(facet, "Timed out after " + configuration.query().facetTimeout().toMillis() + " ms", errors);

        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (!(cause instanceof ConnectorException) && !(cause instanceof NormalizationException)) {
                log.error("Unexpected failure in {} facet", facet, cause);
            }
            return failed(facet, cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName(), errors);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return failed(facet, "Interrupted", errors);
        }
    }

    private <T> T failed(String facet, String message, Map<String, String> errors) {
        errors.put(facet, message);
        meterRegistry.counter("marketfeed.query.facet.failures", "facet", facet).increment();
        return null;
    }

    private static void requireSymbol(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("Symbol is required");
        }
    }
}
