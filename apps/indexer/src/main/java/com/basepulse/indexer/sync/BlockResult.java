package com.basepulse.indexer.sync;

import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of applying one block's logs.
 */
@Getter
@ToString
public class BlockResult {

    private final long blockNumber;
    /** Events that changed projection state */
    private final int applied;
    /** Events already reflected in the projection, or carrying no state */
    private final int skipped;
    private final int decodeErrors;
    private final int failed;

    public BlockResult(long blockNumber, int applied, int skipped, int decodeErrors, int failed) {
        this.blockNumber = blockNumber;
        this.applied = applied;
        this.skipped = skipped;
        this.decodeErrors = decodeErrors;
        this.failed = failed;
    }

    public static BlockResult empty(long blockNumber) {
        return new BlockResult(blockNumber, 0, 0, 0, 0);
    }

    /**
     * Decode errors are recorded and skipped; only handler failures hold the checkpoint back.
     */
    public boolean isCheckpointable() {
        return failed == 0;
    }
}
