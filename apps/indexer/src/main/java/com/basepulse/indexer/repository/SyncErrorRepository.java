package com.basepulse.indexer.repository;

import com.basepulse.indexer.entity.SyncError;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface SyncErrorRepository extends JpaRepository<SyncError, Long> {

    Optional<SyncError> findFirstByChainIdAndTxHashAndLogIndexAndErrorTypeAndResolvedFalse(
            Long chainId, String txHash, Integer logIndex, String errorType);

    List<SyncError> findByChainIdAndResolvedFalseOrderByBlockNumberAsc(Long chainId);
}
