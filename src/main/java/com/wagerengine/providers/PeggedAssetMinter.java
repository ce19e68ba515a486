package com.wagerengine.providers;

/**
 * Issuer of the pegged asset.
 *
 * The engine mints pegged units into its own custody when native asset comes in and
 * burns them when native asset goes out. Supply accounting lives entirely on the
 * minter's side.
 *
 * Implementations are Spring beans; the engine links one of them by bean name.
 */
public interface PeggedAssetMinter {

    /**
     * Issue {@code amount} pegged units to {@code holder}.
     *
     * @throws com.wagerengine.common.exception.UnauthorizedCallerException if the engine
     *         is not an authorized minter
     */
    void mint(String holder, long amount);

    /**
     * Destroy {@code amount} pegged units held by {@code holder}.
     *
     * @throws com.wagerengine.common.exception.InsolventReserveException if the holder
     *         holds fewer units
     */
    void burn(String holder, long amount);

    long balanceOf(String holder);

    long totalSupply();

    /**
     * Exact scale-by-100 conversion. Overflow aborts.
     */
    long nativeToGameUnits(long nativeAmount);

    /**
     * Inverse of {@link #nativeToGameUnits}, floor division.
     */
    long gameUnitsToNative(long gameUnits);
}
