package com.wagerengine.common.exception;

/**
 * Thrown when linking a collaborator name that no bean provides.
 */
public class UnknownCollaboratorException extends WagerEngineException {

    public UnknownCollaboratorException(String kind, String ref, Object available) {
        super(ErrorCategory.PRECONDITION,
            String.format("Unknown %s '%s', available: %s", kind, ref, available));
    }
}
