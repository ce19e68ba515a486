package com.wagerengine.common.exception;

/**
 * Thrown when the identity registry reports an identity as unregistered or banned.
 */
public class IdentityNotEligibleException extends WagerEngineException {

    public IdentityNotEligibleException(String identity) {
        super(ErrorCategory.AUTHORIZATION, "Identity is not eligible to transact: " + identity);
    }
}
