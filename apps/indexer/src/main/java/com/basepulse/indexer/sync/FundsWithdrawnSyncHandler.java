package com.basepulse.indexer.sync;

import com.basepulse.indexer.entity.DistributionEventType;
import com.basepulse.indexer.entity.Poll;
import com.basepulse.indexer.modules.chains.events.FundsWithdrawn;
import com.basepulse.indexer.repository.PollRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * FundsWithdrawn: ledger row only. Withdrawals are not rewards, so the leaderboard is untouched.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FundsWithdrawnSyncHandler {

    private final PollRepository pollRepository;
    private final DistributionLedgerWriter ledgerWriter;

    @Transactional
    public boolean handle(FundsWithdrawn event) {
        Optional<Poll> poll = pollRepository.findByChainIdAndPollId(event.getChainId(), event.getPollId());
        if (poll.isEmpty()) {
            log.warn("FundsWithdrawn for unknown poll: chain={}, pollId={}, tx={}",
                    event.getChainId(), event.getPollId(), event.getTxHash());
            return false;
        }

        // The event has no timestamp field; the row is stamped with the processing time.
        boolean created = ledgerWriter.recordIfAbsent(poll.get(), event, event.getRecipient(), event.getToken(),
                event.getAmount(), DistributionEventType.WITHDRAWN, null);
        if (created) {
            log.info("FundsWithdrawn: chain={}, pollId={}, recipient={}, amount={}",
                    event.getChainId(), event.getPollId(), event.getRecipient(), event.getAmount());
        }
        return created;
    }
}
