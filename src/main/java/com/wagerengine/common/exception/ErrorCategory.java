package com.wagerengine.common.exception;

/**
 * Failure classes of the engine. Every category aborts the whole request.
 */
public enum ErrorCategory {
    /**
     * Request is malformed or not allowed in the current state
     * (inactive game, bet out of bounds, insufficient balance, paused, unlinked collaborator).
     */
    PRECONDITION,

    /**
     * Caller is not the owner, lacks a capability, or is not an eligible identity.
     */
    AUTHORIZATION,

    /**
     * Custody pool or native reserve cannot cover the payout, withdrawal or disbursement.
     */
    SOLVENCY,

    /**
     * A counter or amount would overflow or underflow.
     */
    ARITHMETIC
}
