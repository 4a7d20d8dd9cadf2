package com.fintech.marketfeed.connector;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fintech.marketfeed.error.ConnectorException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@DisplayName("GuardedConnector Tests")
class GuardedConnectorTest {

    private ExchangeConnector delegate;
    private GuardedConnector guarded;

    @BeforeEach
    void setUp() {
        delegate = mock(ExchangeConnector.class);
        when(delegate.sourceId()).thenReturn("bybit");

        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
            .slidingWindowSize(4)
            .minimumNumberOfCalls(4)
            .failureRateThreshold(50)
            .waitDurationInOpenState(Duration.ofMinutes(1))
            .build();
        guarded = new GuardedConnector(delegate,
            CircuitBreaker.of("query-bybit", GuardedConnector.breakerConfig(config)));
    }

    @Test
    @DisplayName("Successful calls pass through untouched")
    void testPassThrough() {
        when(delegate.fetchTicker("BTC/USDT")).thenReturn(JsonNodeFactory.instance.objectNode().put("last", "1"));

        assertThat(guarded.fetchTicker("BTC/USDT").get("last").asText()).isEqualTo("1");
        assertThat(guarded.sourceId()).isEqualTo("bybit");
    }

    @Test
    @DisplayName("Unexpected runtime failures are wrapped as ConnectorException")
    void testWrapsRuntimeFailures() {
        when(delegate.fetchTrades("BTC/USDT", 5)).thenThrow(new IllegalStateException("socket closed"));

        assertThatThrownBy(() -> guarded.fetchTrades("BTC/USDT", 5))
            .isInstanceOf(ConnectorException.class)
            .hasMessageContaining("socket closed")
            .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("ConnectorException from the vendor is rethrown as is")
    void testRethrowsConnectorException() {
        ConnectorException failure = new ConnectorException("bybit", "HTTP 503");
        when(delegate.fetchMarkets()).thenThrow(failure);

        assertThatThrownBy(() -> guarded.fetchMarkets()).isSameAs(failure);
    }

    @Test
    @DisplayName("Open breaker rejects calls without reaching the vendor")
    void testOpenBreakerFailsFast() {
        when(delegate.fetchOrderBook(anyString(), anyInt())).thenThrow(new ConnectorException("bybit", "HTTP 503"));

        for (int i = 0; i < 4; i++) {
            assertThatThrownBy(() -> guarded.fetchOrderBook("BTC/USDT", 10)).isInstanceOf(ConnectorException.class);
        }
        assertThat(guarded.circuitState()).isEqualTo(CircuitBreaker.State.OPEN);

        assertThatThrownBy(() -> guarded.fetchOrderBook("BTC/USDT", 10))
            .isInstanceOf(ConnectorException.class)
            .hasMessageContaining("open");
        verify(delegate, times(4)).fetchOrderBook("BTC/USDT", 10);
    }

    @Test
    @DisplayName("Client errors are rethrown without counting against the breaker")
    void testClientErrorsNotRecorded() {
        when(delegate.fetchTicker("BTCUSDT")).thenThrow(
            ConnectorException.clientError("bybit", "Unsupported symbol format 'BTCUSDT'"));

        for (int i = 0; i < 8; i++) {
            assertThatThrownBy(() -> guarded.fetchTicker("BTCUSDT"))
                .isInstanceOf(ConnectorException.class)
                .hasMessageContaining("Unsupported symbol format");
        }

        assertThat(guarded.circuitState()).isEqualTo(CircuitBreaker.State.CLOSED);
        verify(delegate, times(8)).fetchTicker("BTCUSDT");
    }
}
