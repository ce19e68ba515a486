package com.wagerengine.common.exception;

/**
 * Thrown when the engine's current state does not allow an operation,
 * e.g. no treasury configured or nothing accrued to withdraw.
 */
public class EngineStateException extends WagerEngineException {

    public EngineStateException(String message) {
        super(ErrorCategory.PRECONDITION, message);
    }
}
