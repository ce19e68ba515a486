package com.wagerengine.common.exception;

/**
 * Thrown when ledger arithmetic leaves the unsigned 63-bit domain.
 */
public class ArithmeticDomainException extends WagerEngineException {

    public ArithmeticDomainException(String message) {
        super(ErrorCategory.ARITHMETIC, message);
    }

    public ArithmeticDomainException(String message, Throwable cause) {
        super(ErrorCategory.ARITHMETIC, message, cause);
    }
}
