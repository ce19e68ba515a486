package com.wagerengine.common.exception;

/**
 * Thrown when the custody pool or the native reserve cannot cover an outflow.
 */
public class InsolventReserveException extends WagerEngineException {

    public InsolventReserveException(String pool, long required, long available) {
        super(ErrorCategory.SOLVENCY,
            String.format("Insufficient %s. Required: %d, Available: %d", pool, required, available));
    }
}
