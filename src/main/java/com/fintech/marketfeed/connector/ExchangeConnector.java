package com.fintech.marketfeed.connector;

import com.fasterxml.jackson.databind.JsonNode;
import com.fintech.marketfeed.error.ConnectorException;

/**
 * Capability set every market data source satisfies.
 *
 * Implementations speak one vendor's public API and return the unified raw
 * payload shape (ticker {@code last/bid/ask/...}, book {@code bids/asks/nonce},
 * trade {@code id/price/amount/side/timestamp}, market {@code symbol/base/quote/type/active}).
 * Mapping onto canonical records is left to the normalizer.
 *
 * All methods throw {@link ConnectorException} on network failures, vendor error
 * statuses or payloads the variant cannot interpret.
 */
public interface ExchangeConnector {

    /** Source id this connector serves, e.g. {@code binance_spot}. */
    String sourceId();

    JsonNode fetchTicker(String symbol);

    JsonNode fetchOrderBook(String symbol, int depth);

    /** Array of the most recent trades, at most {@code limit} entries. */
    JsonNode fetchTrades(String symbol, int limit);

    /** Array of every market listed by the source. */
    JsonNode fetchMarkets();
}
