package com.fintech.marketfeed.config;

import com.fintech.marketfeed.connector.ExchangeVariant;
import com.fintech.marketfeed.domain.PollTarget;
import com.fintech.marketfeed.error.ConfigurationException;
import com.fintech.marketfeed.scheduler.InitialDelay;
import com.fintech.marketfeed.storage.PersistenceFormat;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Immutable configuration snapshot for one process run.
 * Built once from {@link MarketFeedProperties} and handed by reference to every
 * component that needs it.
 */
public record FeedConfiguration(
    Map<String, SourceConfig> sources,
    Duration defaultInterval,
    PollingSettings polling,
    PersistenceSettings persistence,
    QuerySettings query,
    VendorSettings vendor,
    DirectorySettings symbolDirectory,
    LiveSettings live
) {

    public FeedConfiguration {
        sources = Collections.unmodifiableMap(new LinkedHashMap<>(sources));
    }

    /**
     * Validates the properties and builds the snapshot.
     *
     * @param properties bound properties
     * @param environment lookup for credential fallbacks such as {@code BYBIT_API_KEY}
     * @throws ConfigurationException on unknown source ids, empty symbol lists or non-positive intervals
     */
    public static FeedConfiguration from(MarketFeedProperties properties, UnaryOperator<String> environment) {
        Duration defaultInterval = positiveSeconds(properties.getDefaultIntervalSeconds(), "marketfeed.default-interval-seconds");

        Map<String, SourceConfig> sources = new LinkedHashMap<>();
        for (Map.Entry<String, MarketFeedProperties.Source> entry : properties.getSources().entrySet()) {
            String rawId = entry.getKey();
            MarketFeedProperties.Source source = entry.getValue();

            ExchangeVariant variant = ExchangeVariant.fromId(rawId)
                .orElseThrow(() -> new ConfigurationException("Unsupported exchange in configuration: " + rawId));
            String id = variant.id();
            if (sources.containsKey(id)) {
                throw new ConfigurationException("Exchange configured twice: " + rawId);
            }

            List<String> symbols = new ArrayList<>();
            for (String symbol : source.getSymbols()) {
                if (symbol == null || symbol.isBlank()) {
                    throw new ConfigurationException("Blank symbol configured for exchange " + id);
                }
                String trimmed = symbol.trim();
                if (!symbols.contains(trimmed)) {
                    symbols.add(trimmed);
                }
            }
            if (symbols.isEmpty()) {
                throw new ConfigurationException("No symbols configured for exchange " + id);
            }

            Duration interval = source.getIntervalSeconds() == null
                ? defaultInterval
                : positiveSeconds(source.getIntervalSeconds(), "marketfeed.sources." + id + ".interval-seconds");

            String envPrefix = id.toUpperCase(Locale.ROOT);
            String apiKey = firstNonBlank(source.getApiKey(), environment.apply(envPrefix + "_API_KEY"));
            String apiSecret = firstNonBlank(source.getApiSecret(), environment.apply(envPrefix + "_API_SECRET"));

            sources.put(id, new SourceConfig(id, variant, List.copyOf(symbols), interval, source.isSandbox(),
                new Credentials(apiKey, apiSecret)));
        }

        MarketFeedProperties.Polling polling = properties.getPolling();
        MarketFeedProperties.Persistence persistence = properties.getPersistence();
        MarketFeedProperties.Query query = properties.getQuery();
        MarketFeedProperties.Vendor vendor = properties.getVendor();
        MarketFeedProperties.SymbolDirectory directory = properties.getSymbolDirectory();
        MarketFeedProperties.Live live = properties.getLive();

        if (persistence.getFormats() == null || persistence.getFormats().isEmpty()) {
            throw new ConfigurationException("At least one persistence format is required");
        }
        if (Integer.bitCount(persistence.getRingBufferSize()) != 1) {
            throw new ConfigurationException("marketfeed.persistence.ring-buffer-size must be a power of 2");
        }
        if (query.getOrderBookDepth() <= 0 || query.getTradesLimit() <= 0 || query.getPoolSize() <= 0) {
            throw new ConfigurationException("marketfeed.query depth, trades limit and pool size must be positive");
        }
        if (live.getSendQueueSize() <= 0 || live.getSendBufferSizeLimit() <= 0) {
            throw new ConfigurationException("marketfeed.live send queue and buffer sizes must be positive");
        }

        return new FeedConfiguration(
            sources,
            defaultInterval,
            new PollingSettings(
                polling.isEnabled(),
                Objects.requireNonNullElse(polling.getInitialDelay(), InitialDelay.IMMEDIATE),
                positiveMillis(polling.getShutdownTimeoutMs(), "marketfeed.polling.shutdown-timeout-ms")),
            new PersistenceSettings(
                Path.of(persistence.getDirectory()),
                Collections.unmodifiableSet(EnumSet.copyOf(persistence.getFormats())),
                Math.max(1, persistence.getEscalationThreshold()),
                persistence.getRingBufferSize(),
                persistence.getWaitStrategy()),
            new QuerySettings(
                positiveMillis(query.getFacetTimeoutMs(), "marketfeed.query.facet-timeout-ms"),
                query.getOrderBookDepth(),
                query.getTradesLimit(),
                query.getPoolSize()),
            new VendorSettings(
                positiveMillis(vendor.getConnectTimeoutMs(), "marketfeed.vendor.connect-timeout-ms"),
                positiveMillis(vendor.getReadTimeoutMs(), "marketfeed.vendor.read-timeout-ms")),
            new DirectorySettings(directory.isEnabled(), directory.getBaseUrl()),
            new LiveSettings(
                live.isEnabled(),
                live.getPath(),
                List.of(live.getAllowedOrigins()),
                live.getSendQueueSize(),
                positiveMillis(live.getSendTimeLimitMs(), "marketfeed.live.send-time-limit-ms"),
                live.getSendBufferSizeLimit()));
    }

    /** Source ids in configuration order. */
    public List<String> sourceIds() {
        return List.copyOf(sources.keySet());
    }

    public boolean isConfigured(String sourceId) {
        return sources.containsKey(sourceId);
    }

    /** Every (source, symbol) pair, in configuration order. */
    public List<PollTarget> pollTargets() {
        List<PollTarget> targets = new ArrayList<>();
        for (SourceConfig source : sources.values()) {
            for (String symbol : source.symbols()) {
                targets.add(new PollTarget(source.id(), symbol, source.interval()));
            }
        }
        return List.copyOf(targets);
    }

    private static Duration positiveSeconds(long seconds, String property) {
        if (seconds <= 0) {
            throw new ConfigurationException(property + " must be positive, got " + seconds);
        }
        return Duration.ofSeconds(seconds);
    }

    private static Duration positiveMillis(long millis, String property) {
        if (millis <= 0) {
            throw new ConfigurationException(property + " must be positive, got " + millis);
        }
        return Duration.ofMillis(millis);
    }

    private static String firstNonBlank(String a, String b) {
        if (a != null && !a.isBlank()) {
            return a.trim();
        }
        return b == null || b.isBlank() ? null : b.trim();
    }

    public record SourceConfig(
        String id,
        ExchangeVariant variant,
        List<String> symbols,
        Duration interval,
        boolean sandbox,
        Credentials credentials
    ) {
    }

    /** API credentials. Optional: every public market data call works without them. */
    public record Credentials(String apiKey, String apiSecret) {

        public boolean isPresent() {
            return apiKey != null && apiSecret != null;
        }

        @Override
        public String toString() {
            return "Credentials[present=" + isPresent() + "]";
        }
    }

    public record PollingSettings(boolean enabled, InitialDelay initialDelay, Duration shutdownTimeout) {
    }

    public record PersistenceSettings(
        Path directory,
        Set<PersistenceFormat> formats,
        int escalationThreshold,
        int ringBufferSize,
        String waitStrategy
    ) {
    }

    public record QuerySettings(Duration facetTimeout, int orderBookDepth, int tradesLimit, int poolSize) {
    }

    public record VendorSettings(Duration connectTimeout, Duration readTimeout) {
    }

    public record DirectorySettings(boolean enabled, String baseUrl) {
    }

    public record LiveSettings(
        boolean enabled,
        String path,
        List<String> allowedOrigins,
        int sendQueueSize,
        Duration sendTimeLimit,
        int sendBufferSizeLimit
    ) {
    }
}
