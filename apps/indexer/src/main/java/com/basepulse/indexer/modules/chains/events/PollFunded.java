package com.basepulse.indexer.modules.chains.events;

import lombok.Getter;
import lombok.ToString;

import java.math.BigInteger;

@Getter
@ToString(callSuper = true)
public class PollFunded extends PollEvent {

    private final String funder;
    private final String token;
    private final BigInteger amount;

    public PollFunded(Long chainId, long blockNumber, String txHash, int logIndex, long pollId,
                      String funder, String token, BigInteger amount) {
        super(chainId, blockNumber, txHash, logIndex, pollId);
        this.funder = funder;
        this.token = token;
        this.amount = amount;
    }

    @Override
    public <R> R accept(PollEventVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
