package com.basepulse.indexer.service;

/**
 * Thrown when honouring the chain's state would move a checkpoint backwards.
 * Fatal for that chain's sync loop; requires operator intervention.
 */
public class CheckpointRegressionException extends RuntimeException {

    private final Long chainId;
    private final long checkpoint;
    private final long attemptedHeight;

    public CheckpointRegressionException(Long chainId, long checkpoint, long attemptedHeight) {
        super(String.format("Checkpoint regression on chain %d: stored=%d, attempted=%d",
                chainId, checkpoint, attemptedHeight));
        this.chainId = chainId;
        this.checkpoint = checkpoint;
        this.attemptedHeight = attemptedHeight;
    }

    public Long getChainId() {
        return chainId;
    }

    public long getCheckpoint() {
        return checkpoint;
    }

    public long getAttemptedHeight() {
        return attemptedHeight;
    }
}
