package com.basepulse.indexer.sync;

import lombok.Builder;
import lombok.Getter;

import java.time.LocalDateTime;

/**
 * Snapshot of one chain's sync loop for the status endpoint.
 */
@Getter
@Builder
public class ChainSyncStatus {

    private final Long chainId;
    private final String name;
    private final SyncState state;
    /** Last fully applied block, null before initialization */
    private final Long checkpoint;
    /** Most recent head seen by the loop */
    private final Long head;
    private final String lastError;
    private final LocalDateTime lastBlockAt;
    private final int pendingResyncs;
}
