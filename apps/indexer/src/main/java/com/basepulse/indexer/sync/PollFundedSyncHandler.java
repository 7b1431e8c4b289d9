package com.basepulse.indexer.sync;

import com.basepulse.indexer.modules.chains.events.PollFunded;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * PollFunded carries no projected state; funding totals are read from the contract.
 */
@Slf4j
@Component
public class PollFundedSyncHandler {

    public boolean handle(PollFunded event) {
        log.info("PollFunded: chain={}, pollId={}, funder={}, token={}, amount={}",
                event.getChainId(), event.getPollId(), event.getFunder(), event.getToken(), event.getAmount());
        return false;
    }
}
