package com.fintech.marketfeed.error;

/**
 * Root of the service's exception hierarchy.
 */
public abstract class MarketFeedException extends RuntimeException {

    protected MarketFeedException(String message) {
        super(message);
    }

    protected MarketFeedException(String message, Throwable cause) {
        super(message, cause);
    }
}
