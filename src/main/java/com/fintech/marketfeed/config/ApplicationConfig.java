package com.fintech.marketfeed.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.marketfeed.connector.ConnectorFactory;
import com.fintech.marketfeed.connector.ConnectorRegistry;
import com.fintech.marketfeed.directory.GoMarketSymbolDirectory;
import com.fintech.marketfeed.directory.SymbolDirectoryProvider;
import com.fintech.marketfeed.ingestion.TickerEventPublisher;
import com.fintech.marketfeed.ingestion.TickerListener;
import com.fintech.marketfeed.normalization.MarketDataNormalizer;
import com.fintech.marketfeed.scheduler.FeedLifecycle;
import com.fintech.marketfeed.scheduler.PollingScheduler;
import com.fintech.marketfeed.service.MarketDataQueryService;
import com.fintech.marketfeed.service.SymbolDirectoryService;
import com.fintech.marketfeed.storage.FileTickerSink;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Spring configuration for core application beans.
 */
@Configuration
public class ApplicationConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public FeedConfiguration feedConfiguration(MarketFeedProperties properties, Environment environment) {
        return FeedConfiguration.from(properties, environment::getProperty);
    }

    @Bean
    public ConnectorRegistry connectorRegistry(FeedConfiguration configuration,
                                               RestClient.Builder restClientBuilder,
                                               CircuitBreakerRegistry circuitBreakerRegistry,
                                               Clock clock) {
        ConnectorFactory factory = new ConnectorFactory(restClientBuilder, configuration.vendor(), clock);
        return new ConnectorRegistry(configuration, factory, circuitBreakerRegistry);
    }

    @Bean
    public FileTickerSink tickerSink(FeedConfiguration configuration, ObjectMapper objectMapper, MeterRegistry meterRegistry) {
        return new FileTickerSink(configuration.persistence(), objectMapper, meterRegistry);
    }

    @Bean
    public TickerEventPublisher tickerEventPublisher(FileTickerSink tickerSink,
                                                     ObjectProvider<TickerListener> listeners,
                                                     FeedConfiguration configuration,
                                                     MeterRegistry meterRegistry) {
        return new TickerEventPublisher(tickerSink, listeners.orderedStream().toList(),
            configuration.persistence(), meterRegistry);
    }

    @Bean
    public PollingScheduler pollingScheduler(FeedConfiguration configuration,
                                             ConnectorRegistry connectorRegistry,
                                             MarketDataNormalizer normalizer,
                                             TickerEventPublisher publisher,
                                             MeterRegistry meterRegistry) {
        return new PollingScheduler(
            configuration.pollTargets(),
            connectorRegistry,
            normalizer,
            publisher,
            configuration.polling().initialDelay(),
            configuration.polling().shutdownTimeout(),
            meterRegistry);
    }

    @Bean
    public FeedLifecycle feedLifecycle(FeedConfiguration configuration, FileTickerSink tickerSink, PollingScheduler pollingScheduler) {
        return new FeedLifecycle(configuration, tickerSink, pollingScheduler);
    }

    @Bean
    public SymbolDirectoryProvider symbolDirectoryProvider(FeedConfiguration configuration,
                                                           RestClient.Builder restClientBuilder,
                                                           MarketDataNormalizer normalizer) {
        FeedConfiguration.VendorSettings vendor = configuration.vendor();
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) vendor.connectTimeout().toMillis());
        requestFactory.setReadTimeout((int) vendor.readTimeout().toMillis());

        RestClient restClient = restClientBuilder.clone()
            .baseUrl(configuration.symbolDirectory().baseUrl())
            .requestFactory(requestFactory)
            .build();
        return new GoMarketSymbolDirectory(restClient, normalizer);
    }

    @Bean
    public SymbolDirectoryService symbolDirectoryService(FeedConfiguration configuration,
                                                         ConnectorRegistry connectorRegistry,
                                                         MarketDataNormalizer normalizer,
                                                         SymbolDirectoryProvider symbolDirectoryProvider) {
        return new SymbolDirectoryService(configuration, connectorRegistry, normalizer, symbolDirectoryProvider);
    }

    /** Worker pool for concurrent facet fetches; each query uses up to four threads. */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService queryExecutor(FeedConfiguration configuration) {
        AtomicInteger counter = new AtomicInteger(0);
        ThreadFactory threads = r -> {
            Thread thread = new Thread(r, "query-facet-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(configuration.query().poolSize(), threads);
    }

    @Bean
    public MarketDataQueryService marketDataQueryService(FeedConfiguration configuration,
                                                         ConnectorRegistry connectorRegistry,
                                                         MarketDataNormalizer normalizer,
                                                         TickerEventPublisher publisher,
                                                         SymbolDirectoryService symbolDirectoryService,
                                                         ExecutorService queryExecutor,
                                                         MeterRegistry meterRegistry) {
        return new MarketDataQueryService(configuration, connectorRegistry, normalizer, publisher,
            symbolDirectoryService, queryExecutor, meterRegistry);
    }
}
