package com.wagerengine.common.exception;

/**
 * Thrown when a guarded entry point is entered again before the outer call finished.
 */
public class ReentrantCallException extends WagerEngineException {

    public ReentrantCallException(String operation) {
        super(ErrorCategory.PRECONDITION, "Reentrant call rejected: " + operation);
    }
}
