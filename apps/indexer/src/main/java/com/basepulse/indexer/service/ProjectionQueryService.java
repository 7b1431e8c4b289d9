package com.basepulse.indexer.service;

import com.basepulse.indexer.entity.DistributionLog;
import com.basepulse.indexer.entity.LeaderboardEntry;
import com.basepulse.indexer.entity.Poll;
import com.basepulse.indexer.repository.DistributionLogRepository;
import com.basepulse.indexer.repository.LeaderboardRepository;
import com.basepulse.indexer.repository.PollRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only access to the projection for downstream consumers.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class ProjectionQueryService {

    public static final int DEFAULT_LIMIT = 10;
    public static final int MAX_LIMIT = 100;

    private final PollRepository pollRepository;
    private final DistributionLogRepository distributionLogRepository;
    private final LeaderboardRepository leaderboardRepository;

    public Optional<Poll> findPoll(Long chainId, Long pollId) {
        return pollRepository.findByChainIdAndPollId(chainId, pollId);
    }

    public List<Poll> listPolls(Long chainId) {
        return pollRepository.findByChainIdOrderByPollIdAsc(chainId);
    }

    /**
     * Ledger rows of a poll in chain order; empty when the poll is unknown.
     */
    public List<DistributionLog> distributionsForPoll(Long chainId, Long pollId) {
        return findPoll(chainId, pollId)
                .map(poll -> distributionLogRepository.findByPollIdOrderByBlockNumberAscLogIndexAsc(poll.getId()))
                .orElse(List.of());
    }

    public List<DistributionLog> distributionsForRecipient(String address) {
        return distributionLogRepository.findByRecipientOrderByTimestampDesc(normalize(address));
    }

    public List<LeaderboardEntry> top(LeaderboardMetric metric, int page, int limit) {
        Pageable pageable = PageRequest.of(Math.max(page, 0), clampLimit(limit));
        return switch (metric) {
            case REWARDS -> leaderboardRepository.findAllByOrderByTotalRewardsDesc(pageable);
            case VOTES -> leaderboardRepository.findAllByOrderByTotalVotesDesc(pageable);
            case POLLS_CREATED -> leaderboardRepository.findAllByOrderByPollsCreatedDesc(pageable);
            case PARTICIPATION -> leaderboardRepository.findAllByOrderByPollsParticipatedDesc(pageable);
        };
    }

    /**
     * Top entries for every metric at once.
     */
    public Map<LeaderboardMetric, List<LeaderboardEntry>> comprehensive(int limit) {
        Map<LeaderboardMetric, List<LeaderboardEntry>> result = new EnumMap<>(LeaderboardMetric.class);
        for (LeaderboardMetric metric : LeaderboardMetric.values()) {
            result.put(metric, top(metric, 0, limit));
        }
        return result;
    }

    /**
     * Stats for an address; an address with no activity gets a zero-valued entry that is not persisted.
     */
    public LeaderboardEntry userStats(String address) {
        String normalized = normalize(address);
        return leaderboardRepository.findByAddress(normalized)
                .orElseGet(() -> LeaderboardEntry.empty(normalized));
    }

    /**
     * 1-based rank by total rewards, empty for an address with no activity.
     */
    public Optional<Long> rankByRewards(String address) {
        return leaderboardRepository.findByAddress(normalize(address))
                .map(entry -> leaderboardRepository.countByTotalRewardsGreaterThan(entry.getTotalRewards()) + 1);
    }

    public Optional<Long> rankByVotes(String address) {
        return leaderboardRepository.findByAddress(normalize(address))
                .map(entry -> leaderboardRepository.countByTotalVotesGreaterThan(entry.getTotalVotes()) + 1);
    }

    public Map<String, Object> totals() {
        LeaderboardRepository.LeaderboardTotals totals = leaderboardRepository.aggregateTotals();
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("totalUsers", totals != null ? totals.getTotalUsers().longValue() : 0L);
        result.put("totalRewardsDistributed",
                totals != null ? new BigDecimal(totals.getTotalRewards().toString()).toPlainString() : "0");
        result.put("totalVotes", totals != null ? totals.getTotalVotes().longValue() : 0L);
        result.put("totalPolls", totals != null ? totals.getTotalPolls().longValue() : 0L);
        return result;
    }

    static int clampLimit(int limit) {
        if (limit <= 0) {
            return DEFAULT_LIMIT;
        }
        return Math.min(limit, MAX_LIMIT);
    }

    private static String normalize(String address) {
        if (address == null || address.isBlank()) {
            throw new IllegalArgumentException("address is required");
        }
        return address.trim().toLowerCase();
    }
}
