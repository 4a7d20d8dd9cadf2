package com.fintech.marketfeed.error;

/**
 * Invalid startup configuration (unknown source id, malformed interval, ...).
 * Fatal: polling never starts.
 */
public class ConfigurationException extends MarketFeedException {

    public ConfigurationException(String message) {
        super(message);
    }
}
