package com.fintech.marketfeed.ingestion;

import com.fintech.marketfeed.domain.Ticker;

/**
 * Receives every ticker after the persistence sink has handled it.
 * Called on the single persistence consumer thread; implementations must not block.
 */
public interface TickerListener {

    void onTicker(Ticker ticker);
}
