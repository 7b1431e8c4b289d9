package com.basepulse.indexer.sync;

/**
 * Lifecycle of one chain's sync loop.
 */
public enum SyncState {
    UNINITIALIZED,
    BACKFILLING,
    LIVE,
    RECONNECTING,
    STOPPED,
    /** Stored checkpoint is above the node's head; needs an operator */
    FAILED
}
