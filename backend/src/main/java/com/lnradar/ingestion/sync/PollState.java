package com.lnradar.ingestion.sync;

/**
 * Per-wallet poller state within one tick. Re-entered from {@link #IDLE} on every tick.
 */
public enum PollState {
    IDLE,
    FETCHING,
    DIFFING,
    DONE
}
