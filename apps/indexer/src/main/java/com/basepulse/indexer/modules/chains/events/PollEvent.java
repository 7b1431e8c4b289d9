package com.basepulse.indexer.modules.chains.events;

import lombok.Getter;
import lombok.ToString;

/**
 * Decoded poll contract event. The set of subclasses is closed; consumers dispatch through
 * {@link PollEventVisitor} so a new event type fails compilation until every visitor handles it.
 */
@Getter
@ToString
public abstract class PollEvent {

    private final Long chainId;
    private final long blockNumber;
    private final String txHash;
    private final int logIndex;
    private final long pollId;

    protected PollEvent(Long chainId, long blockNumber, String txHash, int logIndex, long pollId) {
        this.chainId = chainId;
        this.blockNumber = blockNumber;
        this.txHash = txHash;
        this.logIndex = logIndex;
        this.pollId = pollId;
    }

    public abstract <R> R accept(PollEventVisitor<R> visitor);

    /**
     * Natural key of the log that produced this event
     */
    public String getUniqueKey() {
        return txHash + "_" + logIndex;
    }
}
