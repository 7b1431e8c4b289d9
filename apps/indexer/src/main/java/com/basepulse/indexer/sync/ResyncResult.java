package com.basepulse.indexer.sync;

import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Summary of a historical replay. The checkpoint is never touched by a replay.
 */
@Getter
@ToString
public class ResyncResult {

    private final Long chainId;
    private final long fromBlock;
    private final long toBlock;
    private final int blocks;
    private final int applied;
    private final int skipped;
    private final int decodeErrors;
    private final List<Long> failedBlocks;
    private final boolean interrupted;

    public ResyncResult(Long chainId, long fromBlock, long toBlock, int blocks, int applied, int skipped,
                        int decodeErrors, List<Long> failedBlocks, boolean interrupted) {
        this.chainId = chainId;
        this.fromBlock = fromBlock;
        this.toBlock = toBlock;
        this.blocks = blocks;
        this.applied = applied;
        this.skipped = skipped;
        this.decodeErrors = decodeErrors;
        this.failedBlocks = List.copyOf(failedBlocks);
        this.interrupted = interrupted;
    }
}
