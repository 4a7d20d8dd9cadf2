package com.fintech.marketfeed.live;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.marketfeed.domain.Ticker;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.Instant;

import static com.fintech.marketfeed.live.LiveSubscriptionsTest.SETTINGS;
import static com.fintech.marketfeed.live.LiveSubscriptionsTest.openSession;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DisplayName("LiveTickerBroadcaster Tests")
class LiveTickerBroadcasterTest {

    private final ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();

    private LiveSubscriptions subscriptions;
    private SimpleMeterRegistry meterRegistry;
    private LiveTickerBroadcaster broadcaster;

    @BeforeEach
    void setUp() {
        subscriptions = new LiveSubscriptions(SETTINGS);
        meterRegistry = new SimpleMeterRegistry();
        broadcaster = new LiveTickerBroadcaster(subscriptions, mapper, SETTINGS, meterRegistry);
    }

    @AfterEach
    void tearDown() {
        broadcaster.shutdown();
    }

    private static Ticker ticker(String symbol) {
        return new Ticker("binance_spot", symbol, new BigDecimal("35012.50"),
            null, null, null, null, null, null, null, Instant.parse("2024-12-09T10:30:00Z"));
    }

    @Test
    @DisplayName("Subscribers receive tickers of their instrument only")
    void testDeliversToSubscribers() throws Exception {
        WebSocketSession session = openSession("a");
        subscriptions.register(session);
        subscriptions.subscribe("a", "btc-usdt");

        broadcaster.onTicker(ticker("ETH/USDT"));
        broadcaster.onTicker(ticker("BTC/USDT"));

        ArgumentCaptor<TextMessage> captor = ArgumentCaptor.forClass(TextMessage.class);
        verify(session, timeout(2_000)).sendMessage(captor.capture());
        verify(session, after(200).times(1)).sendMessage(any());

        JsonNode event = mapper.readTree(captor.getValue().getPayload());
        assertThat(event.get("type").asText()).isEqualTo("ticker");
        assertThat(event.get("exchange").asText()).isEqualTo("binance_spot");
        assertThat(event.get("instrument").asText()).isEqualTo("BTC/USDT");
        assertThat(event.get("data").get("timestamp").asText()).isEqualTo("2024-12-09T10:30:00.000Z");
        assertThat(meterRegistry.counter("marketfeed.live.events", "outcome", "sent").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Tickers without subscribers are not queued")
    void testNoSubscribers() {
        broadcaster.onTicker(ticker("BTC/USDT"));

        assertThat(meterRegistry.counter("marketfeed.live.events", "outcome", "dropped").count()).isZero();
        assertThat(meterRegistry.counter("marketfeed.live.events", "outcome", "sent").count()).isZero();
    }

    @Test
    @DisplayName("A client whose socket fails is dropped and closed")
    void testFailingClientDropped() throws Exception {
        WebSocketSession broken = openSession("broken");
        doThrow(new IOException("Broken pipe")).when(broken).sendMessage(any());
        subscriptions.register(broken);
        subscriptions.subscribe("broken", "BTC/USDT");

        broadcaster.onTicker(ticker("BTC/USDT"));

        verify(broken, timeout(2_000)).close(CloseStatus.SERVER_ERROR);
        assertThat(subscriptions.hasSubscribers("BTC/USDT")).isFalse();
        assertThat(meterRegistry.counter("marketfeed.live.events", "outcome", "failed").count()).isEqualTo(1.0);
    }
}
