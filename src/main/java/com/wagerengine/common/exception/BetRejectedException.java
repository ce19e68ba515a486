package com.wagerengine.common.exception;

/**
 * Thrown when a wager is not playable against its game configuration.
 */
public class BetRejectedException extends WagerEngineException {

    private final String gameType;

    public BetRejectedException(String gameType, String reason) {
        super(ErrorCategory.PRECONDITION, "Bet rejected for game " + gameType + ": " + reason);
        this.gameType = gameType;
    }

    public String getGameType() {
        return gameType;
    }
}
