package com.fintech.marketfeed.connector;

import com.fintech.marketfeed.config.FeedConfiguration;
import com.fintech.marketfeed.domain.PollTarget;
import com.fintech.marketfeed.error.UnknownSourceException;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Source id to connector lookup. Populated in the constructor and read-only afterwards.
 *
 * Every poll target gets its own guarded connector and circuit breaker, so a
 * failing symbol only ever trips its own breaker. On-demand calls for a source
 * share one query breaker that no poll target goes through.
 */
public class ConnectorRegistry {

    private static final Logger log = LoggerFactory.getLogger(ConnectorRegistry.class);

    static final String QUERY_BREAKER_PREFIX = "query-";
    static final String POLL_BREAKER_PREFIX = "poll-";

    private final Map<String, ExchangeConnector> connectors;
    private final Map<PollTarget, ExchangeConnector> pollConnectors;

    public ConnectorRegistry(FeedConfiguration configuration,
                             ConnectorFactory factory,
                             CircuitBreakerRegistry circuitBreakerRegistry) {
        CircuitBreakerConfig breakerConfig = GuardedConnector.breakerConfig(circuitBreakerRegistry.getDefaultConfig());

        Map<String, ExchangeConnector> built = new LinkedHashMap<>();
        Map<PollTarget, ExchangeConnector> polling = new LinkedHashMap<>();
        for (FeedConfiguration.SourceConfig source : configuration.sources().values()) {
            ExchangeConnector raw = factory.create(source);
            built.put(source.id(), new GuardedConnector(raw,
                circuitBreakerRegistry.circuitBreaker(QUERY_BREAKER_PREFIX + source.id(), breakerConfig)));
            for (PollTarget target : configuration.pollTargets()) {
                if (target.source().equals(source.id())) {
                    polling.put(target, new GuardedConnector(raw,
                        circuitBreakerRegistry.circuitBreaker(POLL_BREAKER_PREFIX + target.key(), breakerConfig)));
                }
            }
        }
        this.connectors = Collections.unmodifiableMap(built);
        this.pollConnectors = Collections.unmodifiableMap(polling);
        log.info("Connector registry ready: sources={}, pollTargets={}", connectors.keySet(), pollConnectors.size());
    }

    /** Registry over prebuilt connectors, keyed by their source ids; poll targets use the same instances. */
    public ConnectorRegistry(List<ExchangeConnector> connectors) {
        Map<String, ExchangeConnector> built = new LinkedHashMap<>();
        for (ExchangeConnector connector : connectors) {
            built.put(connector.sourceId(), connector);
        }
        this.connectors = Collections.unmodifiableMap(built);
        this.pollConnectors = Map.of();
    }

    /**
     * Connector for on-demand calls against a source.
     *
     * @throws UnknownSourceException if no connector is registered for the id
     */
    public ExchangeConnector get(String sourceId) {
        ExchangeConnector connector = connectors.get(sourceId);
        if (connector == null) {
            throw new UnknownSourceException(sourceId);
        }
        return connector;
    }

    /**
     * Connector dedicated to one poll target.
     *
     * @throws UnknownSourceException if the target's source is not registered
     */
    public ExchangeConnector forTarget(PollTarget target) {
        ExchangeConnector connector = pollConnectors.get(target);
        return connector != null ? connector : get(target.source());
    }

    public boolean contains(String sourceId) {
        return connectors.containsKey(sourceId);
    }
}
