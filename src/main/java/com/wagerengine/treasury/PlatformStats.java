package com.wagerengine.treasury;

import com.wagerengine.common.Amounts;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Platform-wide counters and the engine's native reserve.
 *
 * Counters only grow, except {@code totalFeesCollected}, which holds fees accrued since
 * the last successful withdrawal. There is exactly one row.
 */
@Entity
@Table(name = "platform_stats")
@Data
@NoArgsConstructor
public class PlatformStats {

    public static final String SINGLETON_ID = "platform";

    @Id
    private String id;

    private long totalGamesPlayed;

    private long totalVolumeWagered;

    private long totalPayouts;

    /**
     * Pegged units of fee accrued and not yet withdrawn.
     */
    private long totalFeesCollected;

    /**
     * Native asset units held by the engine.
     */
    private long nativeReserve;

    @Version
    private Long version;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public static PlatformStats initial() {
        PlatformStats stats = new PlatformStats();
        stats.id = SINGLETON_ID;
        stats.updatedAt = Instant.now();
        return stats;
    }

    public void recordGame(long betAmount, long fee, long payout) {
        this.totalGamesPlayed = Amounts.add(totalGamesPlayed, 1);
        this.totalVolumeWagered = Amounts.add(totalVolumeWagered, betAmount);
        this.totalFeesCollected = Amounts.add(totalFeesCollected, fee);
        this.totalPayouts = Amounts.add(totalPayouts, payout);
        this.updatedAt = Instant.now();
    }

    public void addReserve(long nativeAmount) {
        this.nativeReserve = Amounts.add(nativeReserve, nativeAmount);
        this.updatedAt = Instant.now();
    }

    public void removeReserve(long nativeAmount) {
        this.nativeReserve = Amounts.subtract(nativeReserve, nativeAmount);
        this.updatedAt = Instant.now();
    }

    public long drainFees() {
        long fees = totalFeesCollected;
        this.totalFeesCollected = 0L;
        this.updatedAt = Instant.now();
        return fees;
    }
}
