package com.basepulse.indexer.sync;

import lombok.Getter;
import lombok.ToString;

import java.util.OptionalLong;

/**
 * Outcome of applying a fetched block range in order.
 */
@Getter
@ToString
public class RangeResult {

    /** Highest block up to which every block was fully applied; {@code fromBlock - 1} if none */
    private final long lastCompleteBlock;
    /** First block with a handler failure, -1 if none */
    private final long failedBlock;
    private final int blocks;
    private final int applied;
    private final int skipped;
    private final int decodeErrors;
    private final boolean interrupted;

    public RangeResult(long lastCompleteBlock, long failedBlock, int blocks, int applied, int skipped,
                       int decodeErrors, boolean interrupted) {
        this.lastCompleteBlock = lastCompleteBlock;
        this.failedBlock = failedBlock;
        this.blocks = blocks;
        this.applied = applied;
        this.skipped = skipped;
        this.decodeErrors = decodeErrors;
        this.interrupted = interrupted;
    }

    public boolean isComplete() {
        return failedBlock < 0 && !interrupted;
    }

    public OptionalLong failure() {
        return failedBlock < 0 ? OptionalLong.empty() : OptionalLong.of(failedBlock);
    }
}
