package com.fintech.marketfeed.connector;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fintech.marketfeed.config.FeedConfiguration;
import com.fintech.marketfeed.config.MarketFeedProperties;
import com.fintech.marketfeed.domain.PollTarget;
import com.fintech.marketfeed.error.ConnectorException;
import com.fintech.marketfeed.error.UnknownSourceException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DisplayName("ConnectorRegistry Tests")
class ConnectorRegistryTest {

    private ExchangeConnector vendor;
    private CircuitBreakerRegistry breakers;
    private ConnectorRegistry registry;
    private PollTarget healthy;
    private PollTarget delisted;

    @BeforeEach
    void setUp() {
        MarketFeedProperties properties = new MarketFeedProperties();
        MarketFeedProperties.Source source = new MarketFeedProperties.Source();
        source.setSymbols(List.of("BTC/USDT", "DELISTED/USDT"));
        properties.getSources().put("binance_spot", source);
        FeedConfiguration configuration = FeedConfiguration.from(properties, name -> null);

        vendor = mock(ExchangeConnector.class);
        when(vendor.sourceId()).thenReturn("binance_spot");
        when(vendor.fetchTicker("BTC/USDT")).thenReturn(JsonNodeFactory.instance.objectNode().put("last", "35000.10"));
        when(vendor.fetchTicker("DELISTED/USDT")).thenThrow(new ConnectorException("binance_spot", "HTTP 503"));

        ConnectorFactory factory = mock(ConnectorFactory.class);
        when(factory.create(any())).thenReturn(vendor);

        // Same breaker settings as application.yml
        breakers = CircuitBreakerRegistry.of(CircuitBreakerConfig.custom()
            .slidingWindowSize(20)
            .minimumNumberOfCalls(10)
            .failureRateThreshold(50)
            .waitDurationInOpenState(Duration.ofSeconds(30))
            .build());
        registry = new ConnectorRegistry(configuration, factory, breakers);

        healthy = configuration.pollTargets().get(0);
        delisted = configuration.pollTargets().get(1);
    }

    @Test
    @DisplayName("A failing poll target opens only its own breaker")
    void testPollTargetsAreIsolated() {
        for (int i = 0; i < 12; i++) {
            assertThat(registry.forTarget(healthy).fetchTicker("BTC/USDT").get("last").asText()).isEqualTo("35000.10");
            assertThatThrownBy(() -> registry.forTarget(delisted).fetchTicker("DELISTED/USDT"))
                .isInstanceOf(ConnectorException.class);
        }

        assertThat(breakers.circuitBreaker("poll-binance_spot:DELISTED/USDT").getState())
            .isEqualTo(CircuitBreaker.State.OPEN);
        assertThat(breakers.circuitBreaker("poll-binance_spot:BTC/USDT").getState())
            .isEqualTo(CircuitBreaker.State.CLOSED);
        assertThat(breakers.circuitBreaker("query-binance_spot").getState())
            .isEqualTo(CircuitBreaker.State.CLOSED);

        registry.forTarget(healthy).fetchTicker("BTC/USDT");
        registry.get("binance_spot").fetchTicker("BTC/USDT");
        verify(vendor, times(14)).fetchTicker("BTC/USDT");
    }

    @Test
    @DisplayName("Malformed symbols on the query path never open the breaker")
    void testClientErrorsIgnored() {
        when(vendor.fetchTicker("BTCUSDT")).thenThrow(
            ConnectorException.clientError("binance_spot", "Unsupported symbol format 'BTCUSDT'"));

        for (int i = 0; i < 25; i++) {
            assertThatThrownBy(() -> registry.get("binance_spot").fetchTicker("BTCUSDT"))
                .isInstanceOf(ConnectorException.class)
                .hasMessageContaining("Unsupported symbol format");
        }

        assertThat(breakers.circuitBreaker("query-binance_spot").getState())
            .isEqualTo(CircuitBreaker.State.CLOSED);
        assertThat(registry.get("binance_spot").fetchTicker("BTC/USDT").get("last").asText()).isEqualTo("35000.10");
    }

    @Test
    @DisplayName("Unknown sources are rejected")
    void testUnknownSource() {
        assertThat(registry.contains("binance_spot")).isTrue();
        assertThat(registry.contains("kraken_spot")).isFalse();
        assertThatThrownBy(() -> registry.get("kraken_spot")).isInstanceOf(UnknownSourceException.class);
        assertThatThrownBy(() -> registry.forTarget(new PollTarget("kraken_spot", "BTC/USD", Duration.ofSeconds(5))))
            .isInstanceOf(UnknownSourceException.class);
    }
}
