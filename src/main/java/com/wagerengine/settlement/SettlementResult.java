package com.wagerengine.settlement;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of a settled wager.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SettlementResult {

    private String identity;
    private String gameType;
    private long betAmount;
    private boolean won;
    private long payout;
    private long fee;

    /**
     * Account balance after the stake was taken and any payout credited.
     */
    private long balance;
}
