package com.tugochat.tugochat_api.exception;

public class DeliveryFailedException extends GameException {

    public DeliveryFailedException(String sessionId, String detail) {
        super("Could not deliver to session " + sessionId + ": " + detail);
    }

    public DeliveryFailedException(String sessionId, Throwable cause) {
        super("Could not deliver to session " + sessionId + ": " + cause.getMessage(), cause);
    }
}
