package com.tugochat.tugochat_api.exception;

/**
 * Base class for the recoverable, local failures of the game core.
 * None of these should ever take the process down: callers log and drop,
 * or route the session into the disconnect path.
 */
public abstract class GameException extends RuntimeException {

    protected GameException(String message) {
        super(message);
    }

    protected GameException(String message, Throwable cause) {
        super(message, cause);
    }
}
