package com.fintech.marketfeed.error;

/**
 * Vendor call failed: network error, rate limit, vendor error status, open circuit.
 * Recoverable and isolated to one poll target or one query facet.
 *
 * A client error is a request the vendor can never serve (malformed symbol,
 * unknown instrument, HTTP 4xx other than rate limiting). Client errors say
 * nothing about the vendor's health and are not counted by circuit breakers.
 */
public class ConnectorException extends MarketFeedException {

    private final String source;
    private final boolean clientError;

    public ConnectorException(String source, String message) {
        this(source, message, false, null);
    }

    public ConnectorException(String source, String message, Throwable cause) {
        this(source, message, false, cause);
    }

    public ConnectorException(String source, String message, boolean clientError, Throwable cause) {
        super(message, cause);
        this.source = source;
        this.clientError = clientError;
    }

    public static ConnectorException clientError(String source, String message) {
        return new ConnectorException(source, message, true, null);
    }

    public String getSource() {
        return source;
    }

    public boolean isClientError() {
        return clientError;
    }
}
