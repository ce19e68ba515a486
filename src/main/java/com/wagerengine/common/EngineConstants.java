package com.wagerengine.common;

/**
 * Fixed economic parameters of the engine.
 */
public final class EngineConstants {

    /**
     * Platform fee retained on every wager, in basis points (2.5%).
     */
    public static final long HOUSE_EDGE_BPS = 250;

    /**
     * Pegged units issued per native unit.
     */
    public static final long RATIO = 100;

    /**
     * Basis-point denominator, 10000 = 100%.
     */
    public static final long BASIS_POINTS_DENOM = 10_000;

    private EngineConstants() {
    }
}
