package com.basepulse.indexer.service;

import com.basepulse.indexer.modules.chains.model.ChainCheckpoint;
import com.basepulse.indexer.repository.ChainCheckpointRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Service for managing chain checkpoints (last fully applied block)
 */
@Slf4j
@Service
@Transactional
public class ChainCheckpointService {

    private final ChainCheckpointRepository chainCheckpointRepository;

    public ChainCheckpointService(ChainCheckpointRepository chainCheckpointRepository) {
        this.chainCheckpointRepository = chainCheckpointRepository;
    }

    /**
     * Get last processed block number for a chain, empty if the chain was never initialized
     */
    @Transactional(readOnly = true)
    public Optional<Long> load(Long chainId) {
        return chainCheckpointRepository.findByChainId(chainId)
                .map(ChainCheckpoint::getLastBlockNumber);
    }

    /**
     * Seed the checkpoint if it doesn't exist.
     *
     * @return the stored height, which is the existing one when the chain was already initialized
     */
    public long initialize(Long chainId, long height) {
        var existing = chainCheckpointRepository.findByChainId(chainId);
        if (existing.isPresent()) {
            return existing.get().getLastBlockNumber();
        }

        ChainCheckpoint checkpoint = new ChainCheckpoint();
        checkpoint.setChainId(chainId);
        checkpoint.setLastBlockNumber(height);
        checkpoint.setLastProcessedAt(LocalDateTime.now());
        chainCheckpointRepository.save(checkpoint);
        log.info("Initialized checkpoint for chain {} at block {}", chainId, height);
        return height;
    }

    /**
     * Move the checkpoint to {@code height} if it is strictly higher than the stored one.
     * Must only be called after every mutation for blocks up to {@code height} has committed.
     *
     * @return true if the checkpoint moved
     */
    public boolean advance(Long chainId, long height) {
        int updated = chainCheckpointRepository.advanceIfHigher(chainId, height, LocalDateTime.now());
        if (updated == 0) {
            log.debug("Checkpoint for chain {} not advanced to {} (already at or above)", chainId, height);
            return false;
        }
        log.debug("Checkpoint for chain {} advanced to {}", chainId, height);
        return true;
    }

    /**
     * Fail if the stored checkpoint is above the node's head; following the node would mean
     * moving the checkpoint backwards.
     */
    @Transactional(readOnly = true)
    public void verifyNotAhead(Long chainId, long head) {
        Optional<Long> stored = load(chainId);
        if (stored.isPresent() && stored.get() > head) {
            throw new CheckpointRegressionException(chainId, stored.get(), head);
        }
    }
}
