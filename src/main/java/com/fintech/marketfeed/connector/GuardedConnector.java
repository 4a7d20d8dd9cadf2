package com.fintech.marketfeed.connector;

import com.fasterxml.jackson.databind.JsonNode;
import com.fintech.marketfeed.error.ConnectorException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * Runs vendor calls through one circuit breaker.
 *
 * Anything the delegate throws leaves this class as a {@link ConnectorException};
 * an open breaker fails fast without touching the vendor. Client errors pass
 * through without counting against the breaker.
 */
public class GuardedConnector implements ExchangeConnector {

    private static final Logger log = LoggerFactory.getLogger(GuardedConnector.class);

    private final ExchangeConnector delegate;
    private final CircuitBreaker circuitBreaker;

    public GuardedConnector(ExchangeConnector delegate, CircuitBreaker circuitBreaker) {
        this.delegate = delegate;
        this.circuitBreaker = circuitBreaker;

        circuitBreaker.getEventPublisher()
            .onStateTransition(event ->
                log.warn("Circuit breaker {} changed: {} -> {}",
                    circuitBreaker.getName(),
                    event.getStateTransition().getFromState(),
                    event.getStateTransition().getToState())
            );
    }

    /**
     * Copies a base breaker configuration, ignoring connector client errors.
     */
    public static CircuitBreakerConfig breakerConfig(CircuitBreakerConfig base) {
        return CircuitBreakerConfig.from(base)
            .ignoreException(GuardedConnector::isClientError)
            .build();
    }

    static boolean isClientError(Throwable failure) {
        return failure instanceof ConnectorException connectorException && connectorException.isClientError();
    }

    @Override
    public String sourceId() {
        return delegate.sourceId();
    }

    @Override
    public JsonNode fetchTicker(String symbol) {
        return call("fetchTicker", () -> delegate.fetchTicker(symbol));
    }

    @Override
    public JsonNode fetchOrderBook(String symbol, int depth) {
        return call("fetchOrderBook", () -> delegate.fetchOrderBook(symbol, depth));
    }

    @Override
    public JsonNode fetchTrades(String symbol, int limit) {
        return call("fetchTrades", () -> delegate.fetchTrades(symbol, limit));
    }

    @Override
    public JsonNode fetchMarkets() {
        return call("fetchMarkets", delegate::fetchMarkets);
    }

    public CircuitBreaker.State circuitState() {
        return circuitBreaker.getState();
    }

    private JsonNode call(String operation, Supplier<JsonNode> supplier) {
        try {
            return circuitBreaker.executeSupplier(supplier);
        } catch (CallNotPermittedException e) {
            throw new ConnectorException(sourceId(),
                "Circuit breaker " + circuitBreaker.getName() + " is open, " + operation + " rejected", e);
        } catch (ConnectorException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ConnectorException(sourceId(),
                operation + " on " + sourceId() + " failed: " + e.getMessage(), e);
        }
    }
}
