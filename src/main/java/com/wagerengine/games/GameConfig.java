package com.wagerengine.games;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Parameters of one game type.
 *
 * minBet and maxBet are pegged units; the payout multiplier is in basis points
 * (10000 = 1.0x). {@code minBet <= maxBet} is not enforced here: a config with
 * minBet above maxBet is stored as given and simply accepts no bet.
 */
@Entity
@Table(name = "game_configs")
@Data
@NoArgsConstructor
public class GameConfig {

    /**
     * Game-type tag, e.g. "coin-flip".
     */
    @Id
    private String gameType;

    private long minBet;

    private long maxBet;

    private long payoutMultiplierBps;

    private boolean active;

    private String displayName;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public GameConfig(String gameType, long minBet, long maxBet, long payoutMultiplierBps,
                      boolean active, String displayName) {
        this.gameType = gameType;
        replace(minBet, maxBet, payoutMultiplierBps, active, displayName);
    }

    public void replace(long minBet, long maxBet, long payoutMultiplierBps,
                        boolean active, String displayName) {
        this.minBet = minBet;
        this.maxBet = maxBet;
        this.payoutMultiplierBps = payoutMultiplierBps;
        this.active = active;
        this.displayName = displayName;
        this.updatedAt = Instant.now();
    }

    public boolean accepts(long betAmount) {
        return betAmount >= minBet && betAmount <= maxBet;
    }
}
