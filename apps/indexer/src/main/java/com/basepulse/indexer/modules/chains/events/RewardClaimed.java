package com.basepulse.indexer.modules.chains.events;

import lombok.Getter;
import lombok.ToString;

import java.math.BigInteger;

@Getter
@ToString(callSuper = true)
public class RewardClaimed extends PollEvent {

    private final String claimer;
    private final String token;
    private final BigInteger amount;
    private final BigInteger timestamp;

    public RewardClaimed(Long chainId, long blockNumber, String txHash, int logIndex, long pollId,
                         String claimer, String token, BigInteger amount, BigInteger timestamp) {
        super(chainId, blockNumber, txHash, logIndex, pollId);
        this.claimer = claimer;
        this.token = token;
        this.amount = amount;
        this.timestamp = timestamp;
    }

    @Override
    public <R> R accept(PollEventVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
