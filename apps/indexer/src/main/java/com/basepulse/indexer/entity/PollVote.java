package com.basepulse.indexer.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * One row per counted Voted log. Its presence is what gates the leaderboard vote counters.
 */
@Data
@Entity
@Table(name = "poll_votes", uniqueConstraints = @UniqueConstraint(name = "poll_votes_tx_hash_log_index_key",
        columnNames = {"tx_hash", "log_index"}))
public class PollVote {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "chain_id", nullable = false)
    private Long chainId;

    /**
     * On-chain poll id
     */
    @Column(name = "poll_id", nullable = false)
    private Long pollId;

    @Column(nullable = false)
    private String voter;

    @Column(name = "option_index", nullable = false)
    private Long optionIndex;

    @Column(name = "tx_hash", nullable = false)
    private String txHash;

    @Column(name = "log_index", nullable = false)
    private Integer logIndex;

    @Column(name = "block_number", nullable = false)
    private Long blockNumber;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
    }
}
