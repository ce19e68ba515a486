package com.wagerengine.common.exception;

/**
 * Thrown when no configuration exists for a game type.
 */
public class GameConfigNotFoundException extends WagerEngineException {

    public GameConfigNotFoundException(String gameType) {
        super(ErrorCategory.PRECONDITION, "Game type not configured: " + gameType);
    }
}
