package com.basepulse.indexer.modules.chains.events;

public interface PollEventVisitor<R> {

    R visit(PollCreated event);

    R visit(PollFunded event);

    R visit(Voted event);

    R visit(DistributionModeSet event);

    R visit(RewardDistributed event);

    R visit(RewardClaimed event);

    R visit(FundsWithdrawn event);
}
