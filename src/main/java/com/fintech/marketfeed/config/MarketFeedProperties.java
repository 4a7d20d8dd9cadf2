package com.fintech.marketfeed.config;

import com.fintech.marketfeed.scheduler.InitialDelay;
import com.fintech.marketfeed.storage.PersistenceFormat;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Externalized configuration for the market feed service.
 * Maps to 'marketfeed.*' properties in application.yml. Converted once into an
 * immutable {@link FeedConfiguration} at startup; nothing else reads this bean.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "marketfeed")
public class MarketFeedProperties {

    private long defaultIntervalSeconds = 5L;
    private Map<String, Source> sources = new LinkedHashMap<>();
    private Polling polling = new Polling();
    private Persistence persistence = new Persistence();
    private Query query = new Query();
    private Vendor vendor = new Vendor();
    private SymbolDirectory symbolDirectory = new SymbolDirectory();
    private Live live = new Live();

    @Data
    public static class Source {
        private List<String> symbols = new ArrayList<>();
        private Long intervalSeconds;  // null = use default-interval-seconds
        private boolean sandbox = false;
        private String apiKey;
        private String apiSecret;
    }

    @Data
    public static class Polling {
        private boolean enabled = true;
        private InitialDelay initialDelay = InitialDelay.IMMEDIATE;
        private long shutdownTimeoutMs = 10_000L;
    }

    @Data
    public static class Persistence {
        private String directory = "data";
        private Set<PersistenceFormat> formats = EnumSet.allOf(PersistenceFormat.class);
        private int escalationThreshold = 3;
        private int ringBufferSize = 1024;
        private String waitStrategy = "BLOCKING";
    }

    @Data
    public static class Query {
        private long facetTimeoutMs = 5_000L;
        private int orderBookDepth = 10;
        private int tradesLimit = 20;
        private int poolSize = 16;
    }

    @Data
    public static class Vendor {
        private long connectTimeoutMs = 5_000L;
        private long readTimeoutMs = 10_000L;
    }

    @Data
    public static class SymbolDirectory {
        private boolean enabled = true;
        private String baseUrl = "https://gomarket-api.goquant.io";
    }

    @Data
    public static class Live {
        private boolean enabled = true;
        private String path = "/ws/v1/live";
        private String[] allowedOrigins = {"*"};
        private int sendQueueSize = 1000;
        private long sendTimeLimitMs = 5_000L;
        private int sendBufferSizeLimit = 512 * 1024;
    }
}
