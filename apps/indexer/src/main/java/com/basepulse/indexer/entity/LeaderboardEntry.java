package com.basepulse.indexer.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Data
@Entity
@Table(name = "leaderboard")
public class LeaderboardEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true)
    private String address;

    @Column(name = "total_rewards", nullable = false, precision = 78, scale = 0)
    private BigDecimal totalRewards = BigDecimal.ZERO;

    @Column(name = "polls_participated", nullable = false)
    private Integer pollsParticipated = 0;

    @Column(name = "total_votes", nullable = false)
    private Integer totalVotes = 0;

    @Column(name = "polls_created", nullable = false)
    private Integer pollsCreated = 0;

    @Column(name = "last_updated", nullable = false)
    private LocalDateTime lastUpdated;

    @PrePersist
    @PreUpdate
    protected void onWrite() {
        lastUpdated = LocalDateTime.now();
    }

    /**
     * Zero-valued entry for an address with no recorded activity.
     */
    public static LeaderboardEntry empty(String address) {
        LeaderboardEntry entry = new LeaderboardEntry();
        entry.setAddress(address);
        return entry;
    }
}
