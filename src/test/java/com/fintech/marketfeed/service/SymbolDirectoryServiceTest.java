package com.fintech.marketfeed.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.marketfeed.config.FeedConfiguration;
import com.fintech.marketfeed.config.MarketFeedProperties;
import com.fintech.marketfeed.connector.ConnectorFactory;
import com.fintech.marketfeed.connector.ConnectorRegistry;
import com.fintech.marketfeed.connector.ExchangeConnector;
import com.fintech.marketfeed.directory.SymbolDirectoryProvider;
import com.fintech.marketfeed.domain.GroupedSymbolListing;
import com.fintech.marketfeed.domain.InstrumentDirectoryEntry;
import com.fintech.marketfeed.domain.SymbolListing;
import com.fintech.marketfeed.error.ConnectorException;
import com.fintech.marketfeed.error.UnknownSourceException;
import com.fintech.marketfeed.normalization.MarketDataNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@DisplayName("SymbolDirectoryService Tests")
class SymbolDirectoryServiceTest {

    private final ObjectMapper mapper = ConnectorFactory.vendorObjectMapper();

    private ExchangeConnector connector;
    private SymbolDirectoryProvider directory;

    @BeforeEach
    void setUp() throws Exception {
        connector = mock(ExchangeConnector.class);
        when(connector.sourceId()).thenReturn("okx");
        when(connector.fetchMarkets()).thenReturn(mapper.readTree("""
            [{"symbol":"BTC/USDT","base":"BTC","quote":"USDT","type":"spot","active":true},
             {"symbol":"BTC/USDT:USDT","base":"BTC","quote":"USDT","type":"swap","active":true},
             {"symbol":"ETH/USDT","base":"ETH","quote":"USDT","type":"spot","active":true}]
            """));

        directory = mock(SymbolDirectoryProvider.class);
        when(directory.supports("okx")).thenReturn(true);
        when(directory.supports("deribit")).thenReturn(true);
        when(directory.instrumentTypes("okx")).thenReturn(List.of("spot", "swap", "option"));
    }

    private SymbolDirectoryService service(boolean directoryEnabled) {
        MarketFeedProperties properties = new MarketFeedProperties();
        MarketFeedProperties.Source source = new MarketFeedProperties.Source();
        source.setSymbols(List.of("BTC/USDT"));
        properties.getSources().put("okx", source);
        properties.getSymbolDirectory().setEnabled(directoryEnabled);
        FeedConfiguration configuration = FeedConfiguration.from(properties, name -> null);
        return new SymbolDirectoryService(configuration, new ConnectorRegistry(List.of(connector)),
            new MarketDataNormalizer(), directory);
    }

    private static InstrumentDirectoryEntry entry(String name, String type) {
        return new InstrumentDirectoryEntry(name, null, null, type, null);
    }

    @Test
    @DisplayName("Without the directory, symbols come from the connector filtered by type")
    void testConnectorFallback() {
        SymbolDirectoryService service = service(false);

        SymbolListing spot = service.listSymbols("okx", null);
        SymbolListing swaps = service.listSymbols("okx", "perpetual");

        assertThat(spot.instrumentType()).isEqualTo("spot");
        assertThat(spot.symbols()).extracting(InstrumentDirectoryEntry::name).containsExactly("BTC/USDT", "ETH/USDT");
        assertThat(spot.totalSymbols()).isEqualTo(2);
        assertThat(swaps.symbols()).extracting(InstrumentDirectoryEntry::name).containsExactly("BTC/USDT:USDT");
        verifyNoInteractions(directory);
    }

    @Test
    @DisplayName("Instrument types from the connector list spot first")
    void testConnectorInstrumentTypes() {
        assertThat(service(false).listInstrumentTypes("okx")).containsExactly("spot", "swap");
    }

    @Test
    @DisplayName("Directory answers for covered exchanges, configured or not")
    void testDirectoryCoverage() {
        when(directory.fetchSymbols("deribit", "option")).thenReturn(List.of(entry("BTC-27DEC24-50000-C", "option")));
        SymbolDirectoryService service = service(true);

        SymbolListing options = service.listSymbols("deribit", "option");

        assertThat(options.exchange()).isEqualTo("deribit");
        assertThat(options.totalSymbols()).isEqualTo(1);
        verify(connector, never()).fetchMarkets();
    }

    @Test
    @DisplayName("Grouped listing keeps a failing type as an empty group")
    void testGroupedListing() {
        when(directory.fetchSymbols("okx", "spot")).thenReturn(List.of(entry("BTC-USDT", "spot"), entry("ETH-USDT", "spot")));
        when(directory.fetchSymbols("okx", "swap")).thenThrow(new ConnectorException("gomarket", "HTTP 503"));
        when(directory.fetchSymbols("okx", "option")).thenReturn(List.of(entry("BTC-USD-241227-50000-C", "option")));

        GroupedSymbolListing listing = service(true).listAllSymbols("okx");

        assertThat(listing.instrumentTypes()).containsOnlyKeys("spot", "swap", "option");
        assertThat(listing.instrumentTypes().get("swap").count()).isZero();
        assertThat(listing.instrumentTypes().get("spot").count()).isEqualTo(2);
        assertThat(listing.totalSymbols()).isEqualTo(3);
    }

    @Test
    @DisplayName("Exchange known to neither connector nor directory is rejected")
    void testUnknownExchange() {
        SymbolDirectoryService service = service(true);

        assertThatThrownBy(() -> service.listSymbols("mtgox", "spot"))
            .isInstanceOf(UnknownSourceException.class);
        assertThatThrownBy(() -> service.listInstrumentTypes("mtgox"))
            .isInstanceOf(UnknownSourceException.class);
    }

    @Test
    @DisplayName("Single-type listing propagates directory failures")
    void testSingleTypeFailure() {
        when(directory.fetchSymbols("okx", "spot")).thenThrow(new ConnectorException("gomarket", "HTTP 503"));

        assertThatThrownBy(() -> service(true).listSymbols("okx", "spot"))
            .isInstanceOf(ConnectorException.class);
    }
}
