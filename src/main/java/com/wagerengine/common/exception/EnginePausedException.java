package com.wagerengine.common.exception;

/**
 * Thrown when a money-moving operation is attempted while the engine is paused.
 */
public class EnginePausedException extends WagerEngineException {

    public EnginePausedException(String operation) {
        super(ErrorCategory.PRECONDITION, "Engine is paused, rejected: " + operation);
    }
}
