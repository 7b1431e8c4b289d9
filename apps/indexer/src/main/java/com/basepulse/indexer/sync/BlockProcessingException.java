package com.basepulse.indexer.sync;

/**
 * A block could not be fully applied and must be retried from the checkpoint.
 */
public class BlockProcessingException extends RuntimeException {

    private final Long chainId;
    private final long blockNumber;

    public BlockProcessingException(Long chainId, long blockNumber, String message) {
        super(message);
        this.chainId = chainId;
        this.blockNumber = blockNumber;
    }

    public Long getChainId() {
        return chainId;
    }

    public long getBlockNumber() {
        return blockNumber;
    }
}
