package com.fintech.marketfeed.api;

import com.fintech.marketfeed.domain.DirectoryResult;
import com.fintech.marketfeed.domain.MarketDataSnapshot;
import com.fintech.marketfeed.domain.Ticker;
import com.fintech.marketfeed.service.MarketDataQueryService;
import com.fintech.marketfeed.service.SymbolDirectoryService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API over the configured exchanges: listings, symbol directory,
 * aggregated market data and on-demand ticker fetches.
 *
 * Symbols travel as a query parameter because unified symbols contain '/'.
 */
@RestController
@RequestMapping("/api/v1/exchanges")
@Validated
@Tag(name = "Exchanges", description = "Exchange discovery and market data queries")
public class ExchangeController {

    private static final Logger log = LoggerFactory.getLogger(ExchangeController.class);

    private static final String EXCHANGE_PATTERN = "^[a-zA-Z0-9_-]{1,40}$";

    private final MarketDataQueryService queryService;
    private final SymbolDirectoryService symbolDirectory;
    private final MeterRegistry meterRegistry;

    public ExchangeController(MarketDataQueryService queryService,
                              SymbolDirectoryService symbolDirectory,
                              MeterRegistry meterRegistry) {
        this.queryService = queryService;
        this.symbolDirectory = symbolDirectory;
        this.meterRegistry = meterRegistry;
    }

    @Operation(summary = "List configured exchanges",
        description = "Source ids configured for polling in this run, in configuration order.")
    @ApiResponse(responseCode = "200", description = "Configured exchanges",
        content = @Content(mediaType = "application/json",
            examples = @ExampleObject(value = """
                { "exchanges": ["binance_spot", "bybit"] }
                """)))
    @GetMapping("/configured")
    public ResponseEntity<ExchangeListResponse> getConfigured() {
        return ResponseEntity.ok(new ExchangeListResponse(queryService.listConfiguredSources()));
    }

    @Operation(summary = "List every known exchange",
        description = """
            Every exchange id the service knows, with three independent flags:
            a built-in connector exists (`supported`), it is configured for polling
            (`configured`), and the symbol directory covers it (`symbol_directory`).
            """)
    @ApiResponse(responseCode = "200", description = "Availability per exchange",
        content = @Content(mediaType = "application/json",
            examples = @ExampleObject(value = """
                { "exchanges": [
                    { "id": "binance_spot", "supported": true, "configured": true, "symbol_directory": true },
                    { "id": "sim", "supported": true, "configured": false, "symbol_directory": false },
                    { "id": "deribit", "supported": false, "configured": false, "symbol_directory": true }
                ] }
                """)))
    @GetMapping("/available")
    public ResponseEntity<AvailableExchangesResponse> getAvailable() {
        return ResponseEntity.ok(new AvailableExchangesResponse(queryService.listAvailableSources()));
    }

    @Operation(summary = "List instrument types of an exchange")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Instrument types",
            content = @Content(mediaType = "application/json",
                schema = @Schema(implementation = InstrumentTypesResponse.class))),
        @ApiResponse(responseCode = "404", description = "Unknown exchange",
            content = @Content(mediaType = "application/json",
                schema = @Schema(implementation = ErrorResponse.class)))
    })
    @GetMapping("/{exchange}/instrument-types")
    public ResponseEntity<InstrumentTypesResponse> getInstrumentTypes(
            @Parameter(description = "Exchange id", example = "okx")
            @PathVariable
            @Pattern(regexp = EXCHANGE_PATTERN, message = "Exchange id must be 1-40 letters, digits, '_' or '-'")
            String exchange) {

        return ResponseEntity.ok(InstrumentTypesResponse.of(exchange, symbolDirectory.listInstrumentTypes(exchange)));
    }

    @Operation(summary = "List symbols of an exchange",
        description = """
            Symbols of one instrument type (default `spot`), or with `all_types=true`
            every instrument type grouped with per-type counts. In grouped mode a type
            that cannot be fetched is returned with an empty list.
            """)
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Symbol listing",
            content = @Content(mediaType = "application/json",
                examples = {
                    @ExampleObject(name = "Single type", value = """
                        { "exchange": "okx", "instrument_type": "spot", "total_symbols": 1,
                          "symbols": [ { "name": "BTC-USDT", "base": "BTC", "quote": "USDT", "type": "spot" } ] }
                        """),
                    @ExampleObject(name = "All types", value = """
                        { "exchange": "okx", "total_symbols": 1,
                          "instrument_types": { "spot": { "count": 1, "symbols": [ { "name": "BTC-USDT" } ] },
                                                "option": { "count": 0, "symbols": [] } } }
                        """)
                })),
        @ApiResponse(responseCode = "404", description = "Unknown exchange",
            content = @Content(mediaType = "application/json",
                schema = @Schema(implementation = ErrorResponse.class))),
        @ApiResponse(responseCode = "502", description = "Symbol source unavailable",
            content = @Content(mediaType = "application/json",
                schema = @Schema(implementation = ErrorResponse.class)))
    })
    @GetMapping("/{exchange}/symbols")
    public ResponseEntity<DirectoryResult> getSymbols(
            @Parameter(description = "Exchange id", example = "okx")
            @PathVariable
            @Pattern(regexp = EXCHANGE_PATTERN, message = "Exchange id must be 1-40 letters, digits, '_' or '-'")
            String exchange,

            @Parameter(description = "Instrument type (spot, swap, futures, option, ...)", example = "spot")
            @RequestParam(name = "instrument_type", required = false)
            String instrumentType,

            @Parameter(description = "List every instrument type, grouped", example = "false")
            @RequestParam(name = "all_types", defaultValue = "false")
            boolean allTypes) {

        return ResponseEntity.ok(symbolDirectory.listSymbols(exchange, instrumentType, allTypes));
    }

    @Operation(summary = "Aggregated market data for one symbol",
        description = """
            Fetches ticker, order book, recent trades and market info concurrently.
            Facets fail independently: a failed or timed out facet is null and is
            described under `errors`, keyed by facet name. The call itself succeeds
            as long as the exchange is configured.
            """)
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Merged facets with per-facet errors",
            content = @Content(mediaType = "application/json",
                schema = @Schema(implementation = MarketDataSnapshot.class),
                examples = @ExampleObject(value = """
                    { "exchange": "binance_spot", "symbol": "BTC/USDT",
                      "ticker": { "source": "binance_spot", "symbol": "BTC/USDT", "last": 35012.5,
                                  "timestamp": "2025-12-09T10:30:00.123Z" },
                      "orderbook": null,
                      "trades": [],
                      "market_info": { "name": "BTC/USDT", "base": "BTC", "quote": "USDT", "type": "spot", "active": true },
                      "errors": { "orderbook": "Timed out after 5000 ms" } }
                    """))),
        @ApiResponse(responseCode = "400", description = "Missing or blank symbol",
            content = @Content(mediaType = "application/json",
                schema = @Schema(implementation = ErrorResponse.class))),
        @ApiResponse(responseCode = "404", description = "Exchange not configured",
            content = @Content(mediaType = "application/json",
                schema = @Schema(implementation = ErrorResponse.class)))
    })
    @GetMapping("/{exchange}/market-data")
    public ResponseEntity<MarketDataSnapshot> getMarketData(
            @Parameter(description = "Configured exchange id", example = "binance_spot")
            @PathVariable
            @Pattern(regexp = EXCHANGE_PATTERN, message = "Exchange id must be 1-40 letters, digits, '_' or '-'")
            String exchange,

            @Parameter(description = "Unified symbol", example = "BTC/USDT", required = true)
            @RequestParam
            @NotBlank(message = "Symbol is required and cannot be blank")
            String symbol) {

        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            MarketDataSnapshot snapshot = queryService.queryMarketData(exchange, symbol.trim());
            log.debug("Market data query: exchange={}, symbol={}, errors={}", exchange, symbol, snapshot.errors().keySet());
            return ResponseEntity.ok(snapshot);
        } finally {
            sample.stop(meterRegistry.timer("api.market-data.request.time", "exchange", exchange));
        }
    }

    @Operation(summary = "Fetch and persist a fresh ticker",
        description = "Fetches the ticker now, queues it for the exchange's ticker files and returns it.")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Fetched ticker",
            content = @Content(mediaType = "application/json",
                schema = @Schema(implementation = Ticker.class))),
        @ApiResponse(responseCode = "404", description = "Exchange not configured",
            content = @Content(mediaType = "application/json",
                schema = @Schema(implementation = ErrorResponse.class))),
        @ApiResponse(responseCode = "502", description = "Exchange call failed",
            content = @Content(mediaType = "application/json",
                schema = @Schema(implementation = ErrorResponse.class)))
    })
    @PostMapping("/{exchange}/ticker")
    public ResponseEntity<Ticker> fetchTicker(
            @Parameter(description = "Configured exchange id", example = "binance_spot")
            @PathVariable
            @Pattern(regexp = EXCHANGE_PATTERN, message = "Exchange id must be 1-40 letters, digits, '_' or '-'")
            String exchange,

            @Parameter(description = "Unified symbol", example = "BTC/USDT", required = true)
            @RequestParam
            @NotBlank(message = "Symbol is required and cannot be blank")
            String symbol) {

        return ResponseEntity.ok(queryService.triggerFetch(exchange, symbol.trim()));
    }
}
