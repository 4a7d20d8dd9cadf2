package com.fintech.marketfeed.storage;

import com.fintech.marketfeed.domain.Ticker;
import com.fintech.marketfeed.error.PersistenceException;

/**
 * Append-only destination for ticker snapshots, one destination per source.
 */
public interface TickerSink {

    /**
     * Clears everything persisted for the source, leaving an empty destination.
     * Idempotent.
     *
     * @throws PersistenceException if a destination cannot be written
     */
    void reset(String source);

    /**
     * Appends one record to the destination of {@code ticker.source()}.
     *
     * @throws PersistenceException if a destination cannot be written
     */
    void appendTicker(Ticker ticker);
}
