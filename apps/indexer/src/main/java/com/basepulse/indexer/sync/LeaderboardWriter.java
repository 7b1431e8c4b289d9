package com.basepulse.indexer.sync;

import com.basepulse.indexer.repository.LeaderboardRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Leaderboard accumulator updates. Callers invoke these only after the gating insert
 * (poll, vote record or ledger row) reported a new row, inside the same transaction.
 * Rows are shared by every chain, so each update is a single atomic upsert.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LeaderboardWriter {

    private final LeaderboardRepository leaderboardRepository;

    public void incrementPollsCreated(String address) {
        leaderboardRepository.accumulate(address.toLowerCase(), BigDecimal.ZERO, 0, 0, 1);
    }

    /**
     * @param firstVoteInPoll whether this is the voter's first counted vote for the poll
     */
    public void incrementVotes(String address, boolean firstVoteInPoll) {
        leaderboardRepository.accumulate(address.toLowerCase(), BigDecimal.ZERO, firstVoteInPoll ? 1 : 0, 1, 0);
    }

    public void addRewards(String address, BigInteger amount) {
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("Negative reward amount for " + address + ": " + amount);
        }
        String normalized = address.toLowerCase();
        leaderboardRepository.accumulate(normalized, new BigDecimal(amount), 0, 0, 0);
        log.debug("Leaderboard rewards for {} increased by {}", normalized, amount);
    }
}
