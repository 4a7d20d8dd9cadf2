package com.fintech.marketfeed.domain;

/**
 * Result of a symbol directory query, either a single instrument type or all
 * types grouped.
 */
public interface DirectoryResult {

    String exchange();

    int totalSymbols();
}
