package com.basepulse.indexer.sync;

import com.basepulse.indexer.entity.PollVote;
import com.basepulse.indexer.modules.chains.events.Voted;
import com.basepulse.indexer.repository.PollVoteRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Voted: record the vote keyed by (txHash, logIndex); counters move only for a new record.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class VotedSyncHandler {

    private final PollVoteRepository pollVoteRepository;
    private final LeaderboardWriter leaderboardWriter;

    @Transactional
    public boolean handle(Voted event) {
        if (pollVoteRepository.existsByTxHashAndLogIndex(event.getTxHash(), event.getLogIndex())) {
            log.debug("Vote already counted: txHash={}, logIndex={}", event.getTxHash(), event.getLogIndex());
            return false;
        }
        boolean firstVoteInPoll = !pollVoteRepository.existsByChainIdAndPollIdAndVoter(
                event.getChainId(), event.getPollId(), event.getVoter());

        PollVote vote = new PollVote();
        vote.setChainId(event.getChainId());
        vote.setPollId(event.getPollId());
        vote.setVoter(event.getVoter());
        vote.setOptionIndex(event.getOptionIndex());
        vote.setTxHash(event.getTxHash());
        vote.setLogIndex(event.getLogIndex());
        vote.setBlockNumber(event.getBlockNumber());
        pollVoteRepository.save(vote);

        leaderboardWriter.incrementVotes(event.getVoter(), firstVoteInPoll);
        log.info("Voted: chain={}, pollId={}, voter={}, option={}",
                event.getChainId(), event.getPollId(), event.getVoter(), event.getOptionIndex());
        return true;
    }
}
