package com.tugochat.tugochat_api.exception;

public class DuplicateParticipantException extends GameException {

    public DuplicateParticipantException(String playerId) {
        super("Player " + playerId + " already has a live match.");
    }
}
