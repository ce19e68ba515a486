package com.wagerengine.providers.local;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Registration status and lifetime statistics of one identity in the local registry.
 */
@Entity
@Table(name = "player_profiles")
@Data
@NoArgsConstructor
public class PlayerProfile {

    @Id
    private String identity;

    private boolean banned;

    private long gamesPlayed;

    private long gamesWon;

    private long totalWagered;

    private long totalDeposited;

    private long totalWithdrawn;

    @Column(name = "registered_at")
    private Instant registeredAt;

    public PlayerProfile(String identity) {
        this.identity = identity;
        this.registeredAt = Instant.now();
    }
}
