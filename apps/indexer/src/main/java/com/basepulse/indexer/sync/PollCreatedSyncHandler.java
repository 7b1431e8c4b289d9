package com.basepulse.indexer.sync;

import com.basepulse.indexer.entity.DistributionMode;
import com.basepulse.indexer.entity.Poll;
import com.basepulse.indexer.modules.chains.events.PollCreated;
import com.basepulse.indexer.repository.PollRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * PollCreated: insert the poll keyed by (chainId, pollId); credit the creator only for a new row.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PollCreatedSyncHandler {

    private final PollRepository pollRepository;
    private final LeaderboardWriter leaderboardWriter;

    @Transactional
    public boolean handle(PollCreated event) {
        if (pollRepository.findByChainIdAndPollId(event.getChainId(), event.getPollId()).isPresent()) {
            log.debug("Poll already exists: chain={}, pollId={}", event.getChainId(), event.getPollId());
            return false;
        }

        Poll poll = new Poll();
        poll.setChainId(event.getChainId());
        poll.setPollId(event.getPollId());
        poll.setCreator(event.getCreator());
        poll.setDistributionMode(DistributionMode.MANUAL_PULL);
        poll.setCreatedBlock(event.getBlockNumber());
        pollRepository.save(poll);

        leaderboardWriter.incrementPollsCreated(event.getCreator());
        log.info("PollCreated: chain={}, pollId={}, creator={}", event.getChainId(), event.getPollId(), event.getCreator());
        return true;
    }
}
