package com.wagerengine.common.exception;

/**
 * Thrown when an amount is zero, negative, or not exactly convertible.
 */
public class InvalidAmountException extends WagerEngineException {

    public InvalidAmountException(String message) {
        super(ErrorCategory.PRECONDITION, message);
    }
}
