package com.basepulse.indexer.repository;

import com.basepulse.indexer.entity.LeaderboardEntry;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

@Repository
public interface LeaderboardRepository extends JpaRepository<LeaderboardEntry, Long> {

    Optional<LeaderboardEntry> findByAddress(String address);

    /**
     * Adds the deltas to the address's counters in one statement, creating the row on first activity.
     * Safe against concurrent writers for the same address on other chains.
     */
    @Modifying(flushAutomatically = true)
    @Query(value = "INSERT INTO leaderboard (address, total_rewards, polls_participated, total_votes, polls_created, "
            + "last_updated) VALUES (:address, :rewards, :participated, :votes, :created, now()) "
            + "ON CONFLICT (address) DO UPDATE SET "
            + "total_rewards = leaderboard.total_rewards + EXCLUDED.total_rewards, "
            + "polls_participated = leaderboard.polls_participated + EXCLUDED.polls_participated, "
            + "total_votes = leaderboard.total_votes + EXCLUDED.total_votes, "
            + "polls_created = leaderboard.polls_created + EXCLUDED.polls_created, "
            + "last_updated = now()", nativeQuery = true)
    int accumulate(@Param("address") String address,
                   @Param("rewards") BigDecimal rewards,
                   @Param("participated") int participated,
                   @Param("votes") int votes,
                   @Param("created") int created);

    List<LeaderboardEntry> findAllByOrderByTotalRewardsDesc(Pageable pageable);

    List<LeaderboardEntry> findAllByOrderByTotalVotesDesc(Pageable pageable);

    List<LeaderboardEntry> findAllByOrderByPollsCreatedDesc(Pageable pageable);

    List<LeaderboardEntry> findAllByOrderByPollsParticipatedDesc(Pageable pageable);

    /**
     * Number of addresses with strictly more rewards, used for 1-based ranking
     */
    @Query("SELECT COUNT(l) FROM LeaderboardEntry l WHERE l.totalRewards > ?1")
    long countByTotalRewardsGreaterThan(BigDecimal totalRewards);

    long countByTotalVotesGreaterThan(Integer totalVotes);

    @Query("SELECT COUNT(l) AS totalUsers, COALESCE(SUM(l.totalRewards), 0) AS totalRewards, "
            + "COALESCE(SUM(l.totalVotes), 0) AS totalVotes, COALESCE(SUM(l.pollsCreated), 0) AS totalPolls "
            + "FROM LeaderboardEntry l")
    LeaderboardTotals aggregateTotals();

    interface LeaderboardTotals {

        Number getTotalUsers();

        Number getTotalRewards();

        Number getTotalVotes();

        Number getTotalPolls();
    }
}
