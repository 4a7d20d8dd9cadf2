package com.fintech.marketfeed.config;

import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.config.MeterFilter;
import io.micrometer.core.instrument.distribution.DistributionStatisticConfig;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Metrics configuration for the polling, persistence and query paths.
 *
 * Timers here measure vendor round trips and facet fan-outs, so histogram
 * buckets span milliseconds to tens of seconds rather than microseconds.
 */
@Configuration
public class MetricsConfiguration {

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> metricsCommonTags() {
        return registry -> {
            registry.config().commonTags(
                "application", "market-feed-aggregator",
                "environment", getEnvironment()
            );

            registry.config().meterFilter(new MeterFilter() {
                @Override
                public DistributionStatisticConfig configure(Meter.Id id, DistributionStatisticConfig config) {
                    if (id.getType() != Meter.Type.TIMER) {
                        return config;
                    }
                    return DistributionStatisticConfig.builder()
                        .percentiles(0.5, 0.95, 0.99)
                        .percentilePrecision(2)
                        // Nanoseconds, 5ms .. 30s
                        .serviceLevelObjectives(
                            Duration.ofMillis(5).toNanos(),
                            Duration.ofMillis(10).toNanos(),
                            Duration.ofMillis(25).toNanos(),
                            Duration.ofMillis(50).toNanos(),
                            Duration.ofMillis(100).toNanos(),
                            Duration.ofMillis(250).toNanos(),
                            Duration.ofMillis(500).toNanos(),
                            Duration.ofSeconds(1).toNanos(),
                            Duration.ofSeconds(2).toNanos(),
                            Duration.ofSeconds(5).toNanos(),
                            Duration.ofSeconds(10).toNanos(),
                            Duration.ofSeconds(30).toNanos()
                        )
                        .percentilesHistogram(true)
                        .expiry(Duration.ofMinutes(2))
                        .bufferLength(3)
                        .build()
                        .merge(config);
                }
            });
        };
    }

    private String getEnvironment() {
        String env = System.getenv("SPRING_PROFILES_ACTIVE");
        return env != null ? env : "local";
    }
}
