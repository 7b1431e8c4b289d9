package com.basepulse.indexer.modules.chains.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Last block whose events are fully applied, one row per chain
 * Mapped to chain_checkpoint table
 */
@Entity
@Table(name = "chain_checkpoint")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ChainCheckpoint {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "chain_id", nullable = false, unique = true)
    private Long chainId;

    @Column(name = "last_block_number", nullable = false)
    private Long lastBlockNumber;

    @Column(name = "last_processed_at", nullable = false)
    private LocalDateTime lastProcessedAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @PreUpdate
    @PrePersist
    public void updateTimestamp() {
        this.updatedAt = LocalDateTime.now();
        if (this.lastProcessedAt == null) {
            this.lastProcessedAt = this.updatedAt;
        }
    }
}
