package com.tugochat.tugochat_api.exception;

public class UnknownMatchException extends GameException {

    public UnknownMatchException(String matchId) {
        super("No live match with id " + matchId + ".");
    }
}
