package com.wagerengine.common.exception;

/**
 * Thrown when an account balance cannot cover a debit.
 */
public class InsufficientFundsException extends WagerEngineException {

    public InsufficientFundsException(String identity, long required, long available) {
        super(ErrorCategory.PRECONDITION,
            String.format("Insufficient balance for %s. Required: %d, Available: %d",
                identity, required, available));
    }
}
