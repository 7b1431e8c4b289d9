package com.basepulse.indexer.sync;

import com.basepulse.indexer.entity.Poll;
import com.basepulse.indexer.modules.chains.events.DistributionModeSet;
import com.basepulse.indexer.repository.PollRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * DistributionModeSet: overwrite the poll's mode. Re-applying the same value is harmless.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DistributionModeSetSyncHandler {

    private final PollRepository pollRepository;

    @Transactional
    public boolean handle(DistributionModeSet event) {
        Optional<Poll> poll = pollRepository.findByChainIdAndPollId(event.getChainId(), event.getPollId());
        if (poll.isEmpty()) {
            log.warn("DistributionModeSet for unknown poll: chain={}, pollId={}, block={}",
                    event.getChainId(), event.getPollId(), event.getBlockNumber());
            return false;
        }

        Poll existing = poll.get();
        if (existing.getDistributionMode() == event.getMode()) {
            return false;
        }
        existing.setDistributionMode(event.getMode());
        pollRepository.save(existing);
        log.info("DistributionModeSet: chain={}, pollId={}, mode={}", event.getChainId(), event.getPollId(), event.getMode());
        return true;
    }
}
