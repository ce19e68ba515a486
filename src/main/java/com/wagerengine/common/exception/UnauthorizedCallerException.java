package com.wagerengine.common.exception;

/**
 * Thrown when a caller is not the owner or lacks the capability an operation requires.
 */
public class UnauthorizedCallerException extends WagerEngineException {

    private final String caller;

    public UnauthorizedCallerException(String caller, String requirement) {
        super(ErrorCategory.AUTHORIZATION,
            String.format("Caller %s is not authorized: %s", caller, requirement));
        this.caller = caller;
    }

    public String getCaller() {
        return caller;
    }
}
