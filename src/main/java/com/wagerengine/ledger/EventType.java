package com.wagerengine.ledger;

/**
 * Types of engine events.
 *
 * Every accepted state change appends exactly one event of one of these types.
 */
public enum EventType {
    /**
     * Native asset converted into a pegged balance.
     */
    DEPOSIT,

    /**
     * Pegged balance converted back into native asset.
     */
    WITHDRAWAL,

    /**
     * A wager was settled: stake debited, fee accrued, payout credited if won.
     */
    SETTLEMENT,

    /**
     * Accrued platform fees were disbursed to the treasury.
     */
    FEE_COLLECTED,

    /**
     * A game configuration was replaced.
     */
    CONFIG_UPDATED,

    /**
     * The fee treasury sink changed.
     */
    TREASURY_UPDATED,

    /**
     * Minter and/or identity registry were linked or unlinked.
     */
    LINKED,

    PAUSED,

    UNPAUSED,

    CAPABILITY_GRANTED,

    CAPABILITY_REVOKED,

    OWNERSHIP_TRANSFERRED,

    /**
     * Owner added native bankroll and the matching pegged units to custody.
     */
    HOUSE_FUNDED
}
