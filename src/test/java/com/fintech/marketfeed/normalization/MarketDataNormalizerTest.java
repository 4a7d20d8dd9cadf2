package com.fintech.marketfeed.normalization;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.marketfeed.connector.ConnectorFactory;
import com.fintech.marketfeed.domain.InstrumentDirectoryEntry;
import com.fintech.marketfeed.domain.OrderBook;
import com.fintech.marketfeed.domain.PriceLevel;
import com.fintech.marketfeed.domain.Ticker;
import com.fintech.marketfeed.domain.Trade;
import com.fintech.marketfeed.domain.TradeSide;
import com.fintech.marketfeed.error.NormalizationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("MarketDataNormalizer Tests")
class MarketDataNormalizerTest {

    private static final Instant NOW = Instant.parse("2025-12-09T10:30:00.123456Z");

    private final ObjectMapper mapper = ConnectorFactory.vendorObjectMapper();
    private MarketDataNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new MarketDataNormalizer(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private JsonNode json(String text) throws Exception {
        return mapper.readTree(text);
    }

    @Test
    @DisplayName("Ticker keeps the vendor's decimal text exactly")
    void testTickerDecimals() throws Exception {
        Ticker ticker = normalizer.toTicker(json("""
            {"symbol":"BTC/USDT","last":"35012.50","bid":35012.4,"ask":"35012.6",
             "high":"35500","low":"34000.10","baseVolume":"1234.5000","percentage":"-1.25",
             "timestamp":1733740200123}
            """), "binance_spot", "BTC/USDT");

        assertThat(ticker.last().toPlainString()).isEqualTo("35012.50");
        assertThat(ticker.bid()).isEqualByComparingTo("35012.4");
        assertThat(ticker.volume().toPlainString()).isEqualTo("1234.5000");
        assertThat(ticker.percentage()).isEqualByComparingTo("-1.25");
        assertThat(ticker.vwap()).isNull();
        assertThat(ticker.timestamp()).isEqualTo(Instant.ofEpochMilli(1733740200123L));
    }

    @Test
    @DisplayName("Ticker without timestamp is stamped with capture time at millisecond precision")
    void testTickerCaptureTime() throws Exception {
        Ticker ticker = normalizer.toTicker(json("{\"close\":\"100\"}"), "sim", "BTC/USDT");

        assertThat(ticker.last()).isEqualByComparingTo("100");
        assertThat(ticker.timestamp()).isEqualTo(Instant.parse("2025-12-09T10:30:00.123Z"));
    }

    @Test
    @DisplayName("Ticker with no price is still a ticker")
    void testTickerWithoutPrice() throws Exception {
        Ticker ticker = normalizer.toTicker(json("{\"last\":null,\"bid\":\"\"}"), "sim", "BTC/USDT");

        assertThat(ticker.hasPrice()).isFalse();
        assertThat(ticker.bid()).isNull();
    }

    @Test
    @DisplayName("Non-numeric ticker field is a normalization failure")
    void testTickerGarbage() throws Exception {
        assertThatThrownBy(() -> normalizer.toTicker(json("{\"last\":\"abc\"}"), "sim", "BTC/USDT"))
            .isInstanceOf(NormalizationException.class)
            .hasMessageContaining("last");
    }

    @Test
    @DisplayName("Non-object ticker payload is rejected")
    void testTickerNotObject() throws Exception {
        assertThatThrownBy(() -> normalizer.toTicker(json("[]"), "sim", "BTC/USDT"))
            .isInstanceOf(NormalizationException.class);
    }

    @ParameterizedTest(name = "side={0}")
    @ValueSource(strings = {"buy", "BUY", "Buy", " buy "})
    @DisplayName("Trade side is case-insensitive")
    void testTradeSideCase(String side) throws Exception {
        Trade trade = normalizer.toTrade(json("""
            {"id":"1","price":"100.5","amount":"0.25","side":"%s","timestamp":"2025-12-09T10:30:00.123Z"}
            """.formatted(side)), "bybit", "BTC/USDT");

        assertThat(trade.side()).isEqualTo(TradeSide.BUY);
    }

    @Test
    @DisplayName("Trade field aliases are accepted")
    void testTradeAliases() throws Exception {
        Trade trade = normalizer.toTrade(json("""
            {"trade_id":"t-9","price":100,"qty":"0.010","side":"sell","datetime":"2025-12-09T10:30:00.123Z"}
            """), "okx", "BTC/USDT");

        assertThat(trade.id()).isEqualTo("t-9");
        assertThat(trade.size().toPlainString()).isEqualTo("0.010");
        assertThat(trade.side()).isEqualTo(TradeSide.SELL);
    }

    @Test
    @DisplayName("Unknown trade side is a normalization failure")
    void testTradeUnknownSide() throws Exception {
        assertThatThrownBy(() -> normalizer.toTrade(json("""
            {"price":"1","amount":"1","side":"hold","timestamp":1733740200123}
            """), "sim", "BTC/USDT"))
            .isInstanceOf(NormalizationException.class)
            .hasMessageContaining("hold");
    }

    @Test
    @DisplayName("Trade without timestamp is rejected")
    void testTradeRequiresTimestamp() throws Exception {
        assertThatThrownBy(() -> normalizer.toTrade(json("""
            {"price":"1","amount":"1","side":"buy"}
            """), "sim", "BTC/USDT"))
            .isInstanceOf(NormalizationException.class);
    }

    @Test
    @DisplayName("Empty trade array yields an empty list")
    void testEmptyTrades() throws Exception {
        assertThat(normalizer.toTrades(json("[]"), "sim", "BTC/USDT")).isEmpty();
    }

    @Test
    @DisplayName("Order book sides are sorted and levels accept both shapes")
    void testOrderBookSorting() throws Exception {
        OrderBook book = normalizer.toOrderBook(json("""
            {"bids":[["99","1"],{"price":"100","size":"2"},["98.5","3"]],
             "asks":[["102","1"],["101","2"]],
             "nonce":42,"timestamp":1733740200123}
            """), "kraken_spot", "BTC/USD");

        assertThat(book.bids()).extracting(PriceLevel::price)
            .containsExactly(new BigDecimal("100"), new BigDecimal("99"), new BigDecimal("98.5"));
        assertThat(book.asks()).extracting(PriceLevel::price)
            .containsExactly(new BigDecimal("101"), new BigDecimal("102"));
        assertThat(book.sequence()).isEqualTo(42L);
    }

    @Test
    @DisplayName("Empty order book is valid")
    void testEmptyOrderBook() throws Exception {
        OrderBook book = normalizer.toOrderBook(json("{\"bids\":[],\"asks\":[]}"), "sim", "BTC/USDT");

        assertThat(book.isEmpty()).isTrue();
        assertThat(book.sequence()).isNull();
    }

    @Test
    @DisplayName("Incomplete order book level is rejected")
    void testOrderBookIncompleteLevel() throws Exception {
        assertThatThrownBy(() -> normalizer.toOrderBook(json("{\"bids\":[[\"100\"]],\"asks\":[]}"), "sim", "BTC/USDT"))
            .isInstanceOf(NormalizationException.class);
    }

    @Test
    @DisplayName("Directory entry falls back to the default type")
    void testDirectoryEntry() throws Exception {
        InstrumentDirectoryEntry entry = normalizer.toDirectoryEntry(
            json("{\"name\":\"BTC-USDT\",\"base\":\"BTC\",\"quote\":\"USDT\"}"), "spot");

        assertThat(entry.name()).isEqualTo("BTC-USDT");
        assertThat(entry.type()).isEqualTo("spot");
        assertThat(entry.active()).isNull();
    }

    @Test
    @DisplayName("Trades keep payload order")
    void testTradesOrder() throws Exception {
        List<Trade> trades = normalizer.toTrades(json("""
            [{"id":"2","price":"1","amount":"1","side":"buy","timestamp":2000},
             {"id":"1","price":"1","amount":"1","side":"sell","timestamp":1000}]
            """), "sim", "BTC/USDT");

        assertThat(trades).extracting(Trade::id).containsExactly("2", "1");
    }
}
