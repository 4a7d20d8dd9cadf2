package com.fintech.marketfeed.error;

/**
 * Lookup of a source id that this run cannot serve.
 */
public class UnknownSourceException extends MarketFeedException {

    private final String source;

    public UnknownSourceException(String source) {
        super("Unknown or unconfigured exchange: " + source);
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}
