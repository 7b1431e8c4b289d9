package com.basepulse.indexer.sync;

import com.basepulse.indexer.entity.DistributionEventType;
import com.basepulse.indexer.entity.Poll;
import com.basepulse.indexer.modules.chains.events.RewardClaimed;
import com.basepulse.indexer.repository.PollRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

@Slf4j
@Component
@RequiredArgsConstructor
public class RewardClaimedSyncHandler {

    private final PollRepository pollRepository;
    private final DistributionLedgerWriter ledgerWriter;
    private final LeaderboardWriter leaderboardWriter;

    @Transactional
    public boolean handle(RewardClaimed event) {
        Optional<Poll> poll = pollRepository.findByChainIdAndPollId(event.getChainId(), event.getPollId());
        if (poll.isEmpty()) {
            log.warn("RewardClaimed for unknown poll: chain={}, pollId={}, tx={}",
                    event.getChainId(), event.getPollId(), event.getTxHash());
            return false;
        }

        boolean created = ledgerWriter.recordIfAbsent(poll.get(), event, event.getClaimer(), event.getToken(),
                event.getAmount(), DistributionEventType.CLAIMED, event.getTimestamp());
        if (!created) {
            return false;
        }
        leaderboardWriter.addRewards(event.getClaimer(), event.getAmount());
        log.info("RewardClaimed: chain={}, pollId={}, claimer={}, amount={}",
                event.getChainId(), event.getPollId(), event.getClaimer(), event.getAmount());
        return true;
    }
}
