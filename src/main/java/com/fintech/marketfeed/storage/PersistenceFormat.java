package com.fintech.marketfeed.storage;

/**
 * Destination file formats. Each source gets one file per enabled format.
 */
public enum PersistenceFormat {

    CSV("csv"),
    JSON("json");

    private final String extension;

    PersistenceFormat(String extension) {
        this.extension = extension;
    }

    /** Returns the destination file name, e.g. {@code binance_spot_ticker.csv}. */
    public String fileName(String source) {
        return source + "_ticker." + extension;
    }
}
