package com.fintech.marketfeed.connector;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.JsonNodeFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fintech.marketfeed.config.FeedConfiguration;
import com.fintech.marketfeed.connector.vendor.BinanceConnector;
import com.fintech.marketfeed.connector.vendor.BybitConnector;
import com.fintech.marketfeed.connector.vendor.GeminiConnector;
import com.fintech.marketfeed.connector.vendor.KrakenConnector;
import com.fintech.marketfeed.connector.vendor.OkxConnector;
import com.fintech.marketfeed.connector.vendor.SimulatedConnector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Clock;

/**
 * Builds the raw connector for a configured source.
 */
public class ConnectorFactory {

    private static final Logger log = LoggerFactory.getLogger(ConnectorFactory.class);

    private static final String USER_AGENT = "market-feed-aggregator/1.0";

    private final RestClient.Builder restClientBuilder;
    private final FeedConfiguration.VendorSettings vendor;
    private final ObjectMapper vendorMapper;
    private final Clock clock;

    public ConnectorFactory(RestClient.Builder restClientBuilder, FeedConfiguration.VendorSettings vendor, Clock clock) {
        this.restClientBuilder = restClientBuilder;
        this.vendor = vendor;
        this.vendorMapper = vendorObjectMapper();
        this.clock = clock;
    }

    /**
     * Mapper for vendor payloads: decimals stay {@code BigDecimal} with their
     * trailing zeros so prices are never routed through {@code double}.
     */
    public static ObjectMapper vendorObjectMapper() {
        return JsonMapper.builder()
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
            .configure(JsonNodeFeature.STRIP_TRAILING_BIGDECIMAL_ZEROES, false)
            .build();
    }

    public ExchangeConnector create(FeedConfiguration.SourceConfig source) {
        boolean sandbox = source.sandbox();
        if (source.credentials().isPresent()) {
            log.info("Credentials configured for {}; only public market data endpoints are used", source.id());
        }

        ExchangeConnector connector = switch (source.variant()) {
            case BINANCE_SPOT -> new BinanceConnector(source.id(), false,
                restClient(sandbox ? BinanceConnector.SPOT_TESTNET_URL : BinanceConnector.SPOT_URL, false), vendorMapper);
            case BINANCE_USDM -> new BinanceConnector(source.id(), true,
                restClient(sandbox ? BinanceConnector.USDM_TESTNET_URL : BinanceConnector.USDM_URL, false), vendorMapper);
            case BYBIT -> new BybitConnector(source.id(),
                restClient(sandbox ? BybitConnector.TESTNET_URL : BybitConnector.MAINNET_URL, false), vendorMapper);
            case OKX -> new OkxConnector(source.id(),
                restClient(OkxConnector.BASE_URL, sandbox), vendorMapper);
            case KRAKEN_SPOT -> {
                if (sandbox) {
                    log.warn("Kraken spot has no public sandbox, using production endpoints for {}", source.id());
                }
                yield new KrakenConnector(source.id(), restClient(KrakenConnector.BASE_URL, false), vendorMapper);
            }
            case GEMINI -> new GeminiConnector(source.id(),
                restClient(sandbox ? GeminiConnector.SANDBOX_URL : GeminiConnector.BASE_URL, false), vendorMapper);
            case SIMULATED -> new SimulatedConnector(source.id(), source.symbols(), vendorMapper, clock);
        };

        log.info("Created {} connector for {} (sandbox={})",
            connector.getClass().getSimpleName(), source.id(), sandbox);
        return connector;
    }

    private RestClient restClient(String baseUrl, boolean okxSimulatedTrading) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) vendor.connectTimeout().toMillis());
        requestFactory.setReadTimeout((int) vendor.readTimeout().toMillis());

        RestClient.Builder builder = restClientBuilder.clone()
            .baseUrl(baseUrl)
            .requestFactory(requestFactory)
            .defaultHeader("User-Agent", USER_AGENT);
        if (okxSimulatedTrading) {
            builder.defaultHeader(OkxConnector.SIMULATED_TRADING_HEADER, "1");
        }
        return builder.build();
    }
}
