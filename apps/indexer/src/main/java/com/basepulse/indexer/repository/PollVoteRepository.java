package com.basepulse.indexer.repository;

import com.basepulse.indexer.entity.PollVote;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface PollVoteRepository extends JpaRepository<PollVote, Long> {

    boolean existsByTxHashAndLogIndex(String txHash, Integer logIndex);

    boolean existsByChainIdAndPollIdAndVoter(Long chainId, Long pollId, String voter);
}
