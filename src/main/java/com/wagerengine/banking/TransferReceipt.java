package com.wagerengine.banking;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of a deposit, withdrawal or house funding.
 */
@Value
@Builder
public class TransferReceipt {
    String identity;
    long nativeAmount;
    long peggedAmount;
    /**
     * Account balance after the operation, in pegged units.
     */
    long balance;
}
