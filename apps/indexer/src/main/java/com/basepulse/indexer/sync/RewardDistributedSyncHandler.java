package com.basepulse.indexer.sync;

import com.basepulse.indexer.entity.DistributionEventType;
import com.basepulse.indexer.entity.Poll;
import com.basepulse.indexer.modules.chains.events.RewardDistributed;
import com.basepulse.indexer.repository.PollRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

@Slf4j
@Component
@RequiredArgsConstructor
public class RewardDistributedSyncHandler {

    private final PollRepository pollRepository;
    private final DistributionLedgerWriter ledgerWriter;
    private final LeaderboardWriter leaderboardWriter;

    @Transactional
    public boolean handle(RewardDistributed event) {
        Optional<Poll> poll = pollRepository.findByChainIdAndPollId(event.getChainId(), event.getPollId());
        if (poll.isEmpty()) {
            log.warn("RewardDistributed for unknown poll: chain={}, pollId={}, tx={}",
                    event.getChainId(), event.getPollId(), event.getTxHash());
            return false;
        }

        boolean created = ledgerWriter.recordIfAbsent(poll.get(), event, event.getRecipient(), event.getToken(),
                event.getAmount(), DistributionEventType.DISTRIBUTED, event.getTimestamp());
        if (!created) {
            return false;
        }
        leaderboardWriter.addRewards(event.getRecipient(), event.getAmount());
        log.info("RewardDistributed: chain={}, pollId={}, recipient={}, amount={}",
                event.getChainId(), event.getPollId(), event.getRecipient(), event.getAmount());
        return true;
    }
}
