package com.fintech.marketfeed.domain;

/**
 * Per poll target state machine:
 * {@code IDLE -> FETCHING -> (NORMALIZING -> PERSISTING -> IDLE) | (FAILED -> IDLE)}.
 */
public enum PollState {
    IDLE,
    FETCHING,
    NORMALIZING,
    PERSISTING,
    FAILED
}
