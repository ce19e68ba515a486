package com.wagerengine.access;

/**
 * Capabilities that can be granted to an identity, independent of ownership.
 */
public enum Role {
    /**
     * May report game and deposit statistics to the identity registry.
     */
    GAME_MANAGER,

    /**
     * May mint and burn pegged units.
     */
    MINTER
}
