package com.fintech.marketfeed.error;

/**
 * Raw vendor payload is missing a required field or carries a value that cannot
 * be mapped onto the canonical schema.
 */
public class NormalizationException extends MarketFeedException {

    public NormalizationException(String message) {
        super(message);
    }

    public NormalizationException(String message, Throwable cause) {
        super(message, cause);
    }
}
