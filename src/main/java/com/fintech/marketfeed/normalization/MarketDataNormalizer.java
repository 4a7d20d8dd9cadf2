package com.fintech.marketfeed.normalization;

import com.fasterxml.jackson.databind.JsonNode;
import com.fintech.marketfeed.domain.InstrumentDirectoryEntry;
import com.fintech.marketfeed.domain.OrderBook;
import com.fintech.marketfeed.domain.PriceLevel;
import com.fintech.marketfeed.domain.Ticker;
import com.fintech.marketfeed.domain.Trade;
import com.fintech.marketfeed.domain.TradeSide;
import com.fintech.marketfeed.error.NormalizationException;
import com.fintech.marketfeed.util.TimestampConverter;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Maps unified raw vendor payloads onto the canonical records.
 *
 * Stateless apart from the capture clock. Optional fields the payload does not
 * carry stay null; required fields that are missing or malformed raise
 * {@link NormalizationException}. Field aliases absorb schema drift between
 * vendors (e.g. {@code amount}/{@code qty}/{@code size}).
 */
@Component
public class MarketDataNormalizer {

    private final Clock clock;

    public MarketDataNormalizer() {
        this(Clock.systemUTC());
    }

    public MarketDataNormalizer(Clock clock) {
        this.clock = clock;
    }

    /**
     * Raw ticker to canonical ticker. A payload without a timestamp is stamped
     * with the capture time.
     */
    public Ticker toTicker(JsonNode raw, String source, String symbol) {
        requireObject(raw, "ticker", source, symbol);

        return new Ticker(
            source,
            symbol,
            decimal(raw, "last", "close"),
            decimal(raw, "bid"),
            decimal(raw, "ask"),
            decimal(raw, "high"),
            decimal(raw, "low"),
            decimal(raw, "baseVolume", "volume"),
            decimal(raw, "percentage"),
            decimal(raw, "vwap"),
            timestampOrNow(raw)
        );
    }

    /**
     * Raw trade to canonical trade. Side must be buy or sell (any case).
     *
     * @param symbol unified symbol, or null to take it from the payload
     */
    public Trade toTrade(JsonNode raw, String source, String symbol) {
        requireObject(raw, "trade", source, symbol);

        String resolvedSymbol = symbol != null ? symbol : text(raw, "symbol", "instrument", "pair");
        if (resolvedSymbol == null) {
            throw new NormalizationException("Trade from " + source + " has no symbol");
        }

        BigDecimal price = decimal(raw, "price");
        if (price == null) {
            throw new NormalizationException("Trade from " + source + " for " + resolvedSymbol + " has no price");
        }
        BigDecimal size = decimal(raw, "amount", "qty", "size");
        if (size == null) {
            throw new NormalizationException("Trade from " + source + " for " + resolvedSymbol + " has no size");
        }

        String rawSide = text(raw, "side");
        TradeSide side = TradeSide.fromWireName(rawSide)
            .orElseThrow(() -> new NormalizationException(
                "Unrecognized trade side '" + rawSide + "' from " + source + " for " + resolvedSymbol));

        Instant timestamp = timestamp(raw);
        if (timestamp == null) {
            throw new NormalizationException("Trade from " + source + " for " + resolvedSymbol + " has no timestamp");
        }

        return new Trade(source, resolvedSymbol, text(raw, "id", "trade_id", "tid"), price, size, side, timestamp);
    }

    /**
     * Raw trade array to canonical trades, preserving payload order.
     */
    public List<Trade> toTrades(JsonNode raw, String source, String symbol) {
        if (raw == null || !raw.isArray()) {
            throw new NormalizationException("Trades payload from " + source + " for " + symbol + " is not an array");
        }
        List<Trade> trades = new ArrayList<>(raw.size());
        for (JsonNode node : raw) {
            trades.add(toTrade(node, source, symbol));
        }
        return trades;
    }

    /**
     * Raw book to canonical snapshot. Bids are re-sorted descending and asks
     * ascending regardless of the order the vendor used.
     */
    public OrderBook toOrderBook(JsonNode raw, String source, String symbol) {
        requireObject(raw, "order book", source, symbol);

        List<PriceLevel> bids = levels(raw.get("bids"), source, symbol);
        List<PriceLevel> asks = levels(raw.get("asks"), source, symbol);
        bids.sort(Comparator.comparing(PriceLevel::price).reversed());
        asks.sort(Comparator.comparing(PriceLevel::price));

        BigDecimal sequence = decimal(raw, "nonce", "sequence", "seq");

        return new OrderBook(
            source,
            symbol,
            sequence == null ? null : toLong(sequence, source, symbol),
            bids,
            asks,
            timestampOrNow(raw)
        );
    }

    /**
     * Raw market listing entry to directory entry.
     *
     * @param defaultType type to report when the payload has none
     */
    public InstrumentDirectoryEntry toDirectoryEntry(JsonNode raw, String defaultType) {
        if (raw == null || !raw.isObject()) {
            throw new NormalizationException("Market entry is not an object");
        }
        String name = text(raw, "symbol", "name");
        if (name == null) {
            throw new NormalizationException("Market entry has no symbol: " + raw);
        }
        String type = text(raw, "type");
        JsonNode active = raw.get("active");
        return new InstrumentDirectoryEntry(
            name,
            text(raw, "base"),
            text(raw, "quote"),
            type != null ? type : defaultType,
            active == null || active.isNull() ? null : active.asBoolean()
        );
    }

    private List<PriceLevel> levels(JsonNode side, String source, String symbol) {
        List<PriceLevel> levels = new ArrayList<>();
        if (side == null || side.isNull()) {
            return levels;
        }
        if (!side.isArray()) {
            throw new NormalizationException("Order book side from " + source + " for " + symbol + " is not an array");
        }
        for (JsonNode level : side) {
            BigDecimal price;
            BigDecimal size;
            if (level.isArray() && level.size() >= 2) {
                price = toDecimal(level.get(0), "price");
                size = toDecimal(level.get(1), "size");
            } else if (level.isObject()) {
                price = decimal(level, "price");
                size = decimal(level, "amount", "size", "qty");
            } else {
                throw new NormalizationException("Malformed order book level from " + source + ": " + level);
            }
            if (price == null || size == null) {
                throw new NormalizationException("Order book level from " + source + " for " + symbol + " is incomplete: " + level);
            }
            levels.add(new PriceLevel(price, size));
        }
        return levels;
    }

    private Instant timestampOrNow(JsonNode raw) {
        Instant timestamp = timestamp(raw);
        return timestamp != null ? timestamp : TimestampConverter.truncate(clock.instant());
    }

    private Instant timestamp(JsonNode raw) {
        JsonNode node = first(raw, "timestamp", "datetime");
        if (node == null) {
            return null;
        }
        try {
            if (node.isNumber()) {
                return TimestampConverter.fromEpoch(node.decimalValue());
            }
            if (node.isTextual()) {
                return node.asText().isBlank() ? null : TimestampConverter.parse(node.asText());
            }
        } catch (IllegalArgumentException | ArithmeticException e) {
            throw new NormalizationException("Invalid timestamp: " + node, e);
        }
        throw new NormalizationException("Invalid timestamp: " + node);
    }

    private static void requireObject(JsonNode raw, String kind, String source, String symbol) {
        if (raw == null || !raw.isObject()) {
            throw new NormalizationException("Raw " + kind + " from " + source + " for " + symbol + " is not an object");
        }
    }

    private static BigDecimal decimal(JsonNode raw, String... fields) {
        JsonNode node = first(raw, fields);
        return node == null ? null : toDecimal(node, fields[0]);
    }

    private static BigDecimal toDecimal(JsonNode node, String field) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isNumber()) {
            return node.decimalValue();
        }
        if (node.isTextual()) {
            String text = node.asText().trim();
            if (text.isEmpty()) {
                return null;
            }
            try {
                return new BigDecimal(text);
            } catch (NumberFormatException e) {
                throw new NormalizationException("Field '" + field + "' is not numeric: " + text, e);
            }
        }
        throw new NormalizationException("Field '" + field + "' is not numeric: " + node);
    }

    private static String text(JsonNode raw, String... fields) {
        JsonNode node = first(raw, fields);
        if (node == null) {
            return null;
        }
        String text = node.asText();
        return text.isBlank() ? null : text;
    }

    /** First field present with a non-null value. */
    private static JsonNode first(JsonNode raw, String... fields) {
        for (String field : fields) {
            JsonNode node = raw.get(field);
            if (node != null && !node.isNull() && !node.isMissingNode()) {
                return node;
            }
        }
        return null;
    }

    private static long toLong(BigDecimal value, String source, String symbol) {
        try {
            return value.longValueExact();
        } catch (ArithmeticException e) {
            throw new NormalizationException("Order book sequence from " + source + " for " + symbol + " is not an integer: " + value, e);
        }
    }
}
