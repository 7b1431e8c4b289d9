package com.basepulse.indexer.repository;

import com.basepulse.indexer.entity.DistributionLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface DistributionLogRepository extends JpaRepository<DistributionLog, Long> {

    /**
     * Idempotency check on the ledger's natural key
     */
    boolean existsByTxHashAndLogIndex(String txHash, Integer logIndex);

    List<DistributionLog> findByPollIdOrderByBlockNumberAscLogIndexAsc(Long pollId);

    List<DistributionLog> findByRecipientOrderByTimestampDesc(String recipient);
}
