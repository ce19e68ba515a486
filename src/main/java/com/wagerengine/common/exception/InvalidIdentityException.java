package com.wagerengine.common.exception;

/**
 * Thrown when an identity argument is missing or blank.
 */
public class InvalidIdentityException extends WagerEngineException {

    public InvalidIdentityException(String field) {
        super(ErrorCategory.PRECONDITION, field + " must not be blank");
    }
}
