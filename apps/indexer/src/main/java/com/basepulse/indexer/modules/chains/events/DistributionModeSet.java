package com.basepulse.indexer.modules.chains.events;

import com.basepulse.indexer.entity.DistributionMode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigInteger;

@Getter
@ToString(callSuper = true)
public class DistributionModeSet extends PollEvent {

    private final DistributionMode mode;
    private final BigInteger timestamp;

    public DistributionModeSet(Long chainId, long blockNumber, String txHash, int logIndex, long pollId,
                               DistributionMode mode, BigInteger timestamp) {
        super(chainId, blockNumber, txHash, logIndex, pollId);
        this.mode = mode;
        this.timestamp = timestamp;
    }

    @Override
    public <R> R accept(PollEventVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
