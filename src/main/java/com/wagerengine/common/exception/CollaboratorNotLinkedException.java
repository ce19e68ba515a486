package com.wagerengine.common.exception;

/**
 * Thrown when an operation needs an external collaborator that is not linked.
 */
public class CollaboratorNotLinkedException extends WagerEngineException {

    public CollaboratorNotLinkedException(String collaborator) {
        super(ErrorCategory.PRECONDITION, collaborator + " is not linked");
    }
}
