package com.basepulse.indexer.modules.chains.events;

import lombok.Getter;
import lombok.ToString;

@Getter
@ToString(callSuper = true)
public class Voted extends PollEvent {

    private final String voter;
    private final long optionIndex;

    public Voted(Long chainId, long blockNumber, String txHash, int logIndex, long pollId,
                 String voter, long optionIndex) {
        super(chainId, blockNumber, txHash, logIndex, pollId);
        this.voter = voter;
        this.optionIndex = optionIndex;
    }

    @Override
    public <R> R accept(PollEventVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
