package com.basepulse.indexer.repository;

import com.basepulse.indexer.entity.Poll;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface PollRepository extends JpaRepository<Poll, Long> {

    Optional<Poll> findByChainIdAndPollId(Long chainId, Long pollId);

    List<Poll> findByChainIdOrderByPollIdAsc(Long chainId);
}
