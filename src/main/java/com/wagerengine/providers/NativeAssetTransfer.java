package com.wagerengine.providers;

/**
 * Outbound rail for the native asset.
 *
 * Used for withdrawals to players and fee disbursement to the treasury. The engine
 * debits its own native reserve before calling this.
 */
public interface NativeAssetTransfer {

    void transfer(String recipient, long nativeAmount, String reason);
}
