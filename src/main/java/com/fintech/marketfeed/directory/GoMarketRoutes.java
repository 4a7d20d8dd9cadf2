package com.fintech.marketfeed.directory;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Naming tables of the GoMarket symbol directory: which instrument types each
 * exchange publishes, how other type names fall back onto those, and how
 * source ids route onto directory exchange names.
 */
final class GoMarketRoutes {

    static final Map<String, List<String>> EXCHANGE_INSTRUMENT_TYPES = Map.ofEntries(
        Map.entry("okx", List.of("spot", "margin", "swap", "futures", "option")),
        Map.entry("deribit", List.of("future", "future_combo", "option", "option_combo", "spot")),
        Map.entry("bybit", List.of("spot", "linear", "inverse", "option")),
        Map.entry("binance", List.of("spot", "usdm_futures", "coinm_futures", "option")),
        Map.entry("cryptocom", List.of("ccy_pair", "perpetual_swap", "future")),
        Map.entry("kraken", List.of("spot", "futures")),
        Map.entry("kucoin", List.of("spot", "margin", "futures")),
        Map.entry("bitstamp", List.of("spot")),
        Map.entry("bitmex", List.of("all")),
        Map.entry("coinbase_intl", List.of("all")),
        Map.entry("coinbase", List.of("spot")),
        Map.entry("mexc", List.of("spot", "futures")),
        Map.entry("gemini", List.of("all")),
        Map.entry("htx", List.of("spot")),
        Map.entry("bitfinex", List.of("all")),
        Map.entry("hyperliquid", List.of("spot", "perpetual")),
        Map.entry("blofin", List.of("all")),
        Map.entry("gateio", List.of("spot", "futures")),
        Map.entry("bitget", List.of("spot", "futures")),
        Map.entry("bitso", List.of("spot"))
    );

    /** Type names an exchange does not publish, mapped onto one it does. */
    static final Map<String, Map<String, String>> MISSING_INSTRUMENT_TYPES = Map.of(
        "okx", Map.of("perpetual", "swap", "linear", "swap", "usdm_futures", "swap", "all", "swap"),
        "bybit", Map.of("perpetual", "linear", "swap", "linear", "usdm_futures", "linear", "all", "linear"),
        "hyperliquid", Map.of("margin", "spot", "swap", "perpetual", "all", "perpetual",
            "linear", "perpetual", "usdm_futures", "perpetual"),
        "blofin", Map.of("perpetual", "all", "swap", "all", "spot", "all", "linear", "all", "usdm_futures", "all"),
        "bitmex", Map.of("perpetual", "all", "swap", "all", "spot", "all", "linear", "all", "usdm_futures", "all"),
        "kucoin", Map.of("perpetual", "futures", "swap", "futures", "all", "futures",
            "linear", "futures", "usdm_futures", "futures"),
        "binance", Map.of("perpetual", "usdm_futures", "swap", "usdm_futures", "spot", "spot",
            "linear", "usdm_futures", "all", "usdm_futures"),
        "gateio", Map.of("perpetual", "futures", "swap", "futures", "all", "futures",
            "linear", "futures", "usdm_futures", "futures"),
        "bitget", Map.of("perpetual", "futures", "swap", "futures", "all", "futures",
            "linear", "futures", "usdm_futures", "futures")
    );

    /** Source ids whose directory exchange name differs from the id. */
    static final Map<String, String> SYMBOL_ROUTES = Map.ofEntries(
        Map.entry("kucoinspot", "kucoin"),
        Map.entry("kucoinfutures", "kucoin"),
        Map.entry("kucoinmargin", "kucoin"),
        Map.entry("kucoin_spot", "kucoin"),
        Map.entry("kucoin_futures", "kucoin"),
        Map.entry("binancespot", "binance"),
        Map.entry("binance_spot", "binance"),
        Map.entry("binanceoptions", "binance"),
        Map.entry("binancecoinm", "binance"),
        Map.entry("binance_coinm", "binance"),
        Map.entry("binanceusdm", "binance"),
        Map.entry("binance_usdm", "binance"),
        Map.entry("mexcspot", "mexc"),
        Map.entry("mexcfutures", "mexc"),
        Map.entry("krakenspot", "kraken"),
        Map.entry("kraken_spot", "kraken"),
        Map.entry("krakenfutures", "kraken"),
        Map.entry("kraken_futures", "kraken")
    );

    private GoMarketRoutes() {
    }

    /** Directory exchange name for a source id. */
    static String exchangeFor(String sourceId) {
        String key = sourceId.toLowerCase(Locale.ROOT);
        return SYMBOL_ROUTES.getOrDefault(key, key);
    }

    /**
     * Directory type to request for an exchange: the type itself when published,
     * its fallback mapping otherwise, else the exchange's first type, else spot.
     */
    static String instrumentTypeFor(String exchange, String instrumentType) {
        List<String> published = EXCHANGE_INSTRUMENT_TYPES.get(exchange);
        if (published == null) {
            return "spot";
        }
        if (instrumentType != null) {
            String type = instrumentType.toLowerCase(Locale.ROOT);
            if (published.contains(type)) {
                return type;
            }
            String mapped = MISSING_INSTRUMENT_TYPES.getOrDefault(exchange, Map.of()).get(type);
            if (mapped != null) {
                return mapped;
            }
        }
        return published.get(0);
    }
}
