package com.wagerengine.common.exception;

/**
 * Base exception for all wager engine exceptions.
 */
public class WagerEngineException extends RuntimeException {

    private final ErrorCategory category;

    public WagerEngineException(ErrorCategory category, String message) {
        super(message);
        this.category = category;
    }

    public WagerEngineException(ErrorCategory category, String message, Throwable cause) {
        super(message, cause);
        this.category = category;
    }

    public ErrorCategory getCategory() {
        return category;
    }
}
