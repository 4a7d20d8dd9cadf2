package com.fintech.marketfeed.error;

import java.nio.file.Path;

/**
 * A destination file could not be written.
 */
public class PersistenceException extends MarketFeedException {

    private final Path destination;

    public PersistenceException(Path destination, String message, Throwable cause) {
        super(message, cause);
        this.destination = destination;
    }

    public Path getDestination() {
        return destination;
    }
}
