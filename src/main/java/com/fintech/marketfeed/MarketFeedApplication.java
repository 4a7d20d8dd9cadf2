package com.fintech.marketfeed;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Market Feed Aggregator
 *
 * Polls ticker data from configured exchanges, persists it per exchange and
 * answers aggregated market data queries.
 *
 * Key Features:
 * - One independent polling loop per (exchange, symbol)
 * - Vendor payloads normalized into one canonical shape
 * - LMAX Disruptor hand-off to a single file writer (CSV and JSON)
 * - Concurrent per-facet queries with independent failures
 * - Prometheus metrics via actuator
 *
 * @since 1.0.0
 */
@SpringBootApplication
public class MarketFeedApplication {

    public static void main(String[] args) {
        SpringApplication.run(MarketFeedApplication.class, args);
    }
}
