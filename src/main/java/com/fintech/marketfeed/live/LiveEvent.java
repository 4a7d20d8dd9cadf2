package com.fintech.marketfeed.live;

import com.fintech.marketfeed.domain.Ticker;

/**
 * Message pushed to live subscribers for one normalized ticker.
 */
public record LiveEvent(
    String type,
    String exchange,
    String instrument,
    Ticker data
) {

    public static final String TYPE_TICKER = "ticker";

    public static LiveEvent ticker(Ticker ticker) {
        return new LiveEvent(TYPE_TICKER, ticker.source(), ticker.symbol(), ticker);
    }
}
