package com.fintech.marketfeed.domain;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.json.JsonTest;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@JsonTest
@DisplayName("Canonical record JSON Tests")
class CanonicalRecordJsonTest {

    private static final Instant WHOLE_SECOND = Instant.parse("2024-12-09T10:30:00Z");

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    @DisplayName("Ticker timestamp on a whole second keeps three fraction digits")
    void testTickerWholeSecond() {
        Ticker ticker = new Ticker("kraken_spot", "BTC/USD", new BigDecimal("97000.1"),
            null, null, null, null, null, null, null, WHOLE_SECOND);

        JsonNode json = objectMapper.valueToTree(ticker);

        assertThat(json.get("timestamp").asText()).isEqualTo("2024-12-09T10:30:00.000Z");
    }

    @Test
    @DisplayName("Trade and order book timestamps use the same millisecond format")
    void testTradeAndOrderBook() {
        Trade trade = new Trade("gemini", "BTC/USD", "42", new BigDecimal("97000"), new BigDecimal("0.01"),
            TradeSide.BUY, WHOLE_SECOND.plusMillis(5));
        OrderBook book = new OrderBook("gemini", "BTC/USD", null,
            List.of(new PriceLevel(new BigDecimal("96999"), BigDecimal.ONE)),
            List.of(new PriceLevel(new BigDecimal("97001"), BigDecimal.ONE)),
            WHOLE_SECOND);

        assertThat(objectMapper.valueToTree(trade).get("timestamp").asText()).isEqualTo("2024-12-09T10:30:00.005Z");
        assertThat(objectMapper.valueToTree(book).get("timestamp").asText()).isEqualTo("2024-12-09T10:30:00.000Z");
    }
}
