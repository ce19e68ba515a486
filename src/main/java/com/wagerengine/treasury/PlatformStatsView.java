package com.wagerengine.treasury;

import lombok.Builder;
import lombok.Value;

/**
 * Read-only snapshot of platform aggregates.
 */
@Value
@Builder
public class PlatformStatsView {
    long totalGamesPlayed;
    long totalVolumeWagered;
    long totalPayouts;
    long totalFeesCollected;
    long nativeReserve;
    /**
     * Pegged units held in custody by the engine; 0 when no minter is linked.
     */
    long custodyBalance;
    /**
     * Sum of all account balances.
     */
    long totalLiabilities;
}
