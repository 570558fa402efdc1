package com.tugochat.tugochat_api.exception;

public class AlreadyQueuedException extends GameException {

    public AlreadyQueuedException(String playerId) {
        super("Player " + playerId + " is already queued or in a match.");
    }
}
