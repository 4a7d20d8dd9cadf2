package com.fintech.marketfeed.scheduler;

/**
 * When a poll target's first tick fires after startup.
 */
public enum InitialDelay {

    /** First tick fires as soon as the scheduler starts. */
    IMMEDIATE,

    /** First tick fires one interval after the scheduler starts. */
    ONE_INTERVAL
}
