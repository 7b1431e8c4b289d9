package com.basepulse.indexer.repository;

import com.basepulse.indexer.modules.chains.model.ChainCheckpoint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Repository for chain checkpoints
 */
@Repository
public interface ChainCheckpointRepository extends JpaRepository<ChainCheckpoint, Long> {

    /**
     * Find checkpoint by chain_id
     */
    Optional<ChainCheckpoint> findByChainId(Long chainId);

    /**
     * Move the checkpoint forward only if the new height is strictly higher.
     *
     * @return number of rows updated, 0 when the stored height is already at or above {@code height}
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE ChainCheckpoint c SET c.lastBlockNumber = :height, c.lastProcessedAt = :now, c.updatedAt = :now "
            + "WHERE c.chainId = :chainId AND c.lastBlockNumber < :height")
    int advanceIfHigher(@Param("chainId") Long chainId,
                        @Param("height") Long height,
                        @Param("now") LocalDateTime now);
}
