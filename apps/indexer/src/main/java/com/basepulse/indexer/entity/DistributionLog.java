package com.basepulse.indexer.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * Append-only ledger row, one per distribution, claim or withdrawal log.
 */
@Data
@Entity
@Table(name = "distribution_logs", uniqueConstraints = @UniqueConstraint(name = "distribution_logs_tx_hash_log_index_key",
        columnNames = {"tx_hash", "log_index"}))
public class DistributionLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * References polls.id
     */
    @Column(name = "poll_id", nullable = false, updatable = false)
    private Long pollId;

    @Column(nullable = false, updatable = false)
    private String recipient;

    /**
     * Raw uint256 amount in the token's base units
     */
    @Column(nullable = false, updatable = false)
    private String amount;

    @Column(nullable = false, updatable = false)
    private String token;

    @Column(name = "tx_hash", nullable = false, updatable = false)
    private String txHash;

    @Column(name = "log_index", nullable = false, updatable = false)
    private Integer logIndex;

    @Column(name = "block_number", nullable = false, updatable = false)
    private Long blockNumber;

    @Column(name = "event_type", nullable = false, updatable = false)
    private String eventType;

    @Column(nullable = false, updatable = false)
    private LocalDateTime timestamp;
}
