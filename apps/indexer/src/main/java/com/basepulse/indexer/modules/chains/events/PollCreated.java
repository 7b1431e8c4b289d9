package com.basepulse.indexer.modules.chains.events;

import lombok.Getter;
import lombok.ToString;

import java.math.BigInteger;

@Getter
@ToString(callSuper = true)
public class PollCreated extends PollEvent {

    private final String creator;
    private final String question;
    private final BigInteger endTime;

    public PollCreated(Long chainId, long blockNumber, String txHash, int logIndex, long pollId,
                       String creator, String question, BigInteger endTime) {
        super(chainId, blockNumber, txHash, logIndex, pollId);
        this.creator = creator;
        this.question = question;
        this.endTime = endTime;
    }

    @Override
    public <R> R accept(PollEventVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
