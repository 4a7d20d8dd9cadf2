package com.fintech.marketfeed.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.marketfeed.live.LiveFeedWebSocketHandler;
import com.fintech.marketfeed.live.LiveSubscriptions;
import com.fintech.marketfeed.live.LiveTickerBroadcaster;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Live ticker push to WebSocket subscribers. Disabled with {@code marketfeed.live.enabled=false}.
 */
@Configuration
@ConditionalOnProperty(prefix = "marketfeed.live", name = "enabled", havingValue = "true", matchIfMissing = true)
public class LiveFeedConfig {

    @Bean
    public LiveSubscriptions liveSubscriptions(FeedConfiguration configuration) {
        return new LiveSubscriptions(configuration.live());
    }

    @Bean(destroyMethod = "shutdown")
    public LiveTickerBroadcaster liveTickerBroadcaster(LiveSubscriptions liveSubscriptions,
                                                       ObjectMapper objectMapper,
                                                       FeedConfiguration configuration,
                                                       MeterRegistry meterRegistry) {
        return new LiveTickerBroadcaster(liveSubscriptions, objectMapper, configuration.live(), meterRegistry);
    }

    @Bean
    public LiveFeedWebSocketHandler liveFeedWebSocketHandler(LiveSubscriptions liveSubscriptions, ObjectMapper objectMapper) {
        return new LiveFeedWebSocketHandler(liveSubscriptions, objectMapper);
    }
}
