package com.fintech.marketfeed.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Three independent facts about one source id.
 *
 * @param id Source id
 * @param supported A built-in connector exists for it
 * @param configured It is configured for polling in this run
 * @param symbolDirectory The secondary symbol directory covers it
 */
public record ExchangeAvailability(
    String id,
    boolean supported,
    boolean configured,
    @JsonProperty("symbol_directory") boolean symbolDirectory
) {
}
