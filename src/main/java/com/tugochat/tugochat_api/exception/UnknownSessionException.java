package com.tugochat.tugochat_api.exception;

public class UnknownSessionException extends GameException {

    public UnknownSessionException(String sessionId) {
        super("Session " + sessionId + " is not registered or not in a match.");
    }
}
