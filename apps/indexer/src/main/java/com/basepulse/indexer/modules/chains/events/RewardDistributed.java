package com.basepulse.indexer.modules.chains.events;

import lombok.Getter;
import lombok.ToString;

import java.math.BigInteger;

@Getter
@ToString(callSuper = true)
public class RewardDistributed extends PollEvent {

    private final String recipient;
    private final String token;
    private final BigInteger amount;
    private final BigInteger timestamp;

    public RewardDistributed(Long chainId, long blockNumber, String txHash, int logIndex, long pollId,
                             String recipient, String token, BigInteger amount, BigInteger timestamp) {
        super(chainId, blockNumber, txHash, logIndex, pollId);
        this.recipient = recipient;
        this.token = token;
        this.amount = amount;
        this.timestamp = timestamp;
    }

    @Override
    public <R> R accept(PollEventVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
