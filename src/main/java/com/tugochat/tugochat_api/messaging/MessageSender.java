package com.tugochat.tugochat_api.messaging;

/**
 * Best-effort push to a client by session id.
 */
public interface MessageSender {

    /**
     * @return {@code true} if the message was handed to a live connection,
     *         {@code false} if delivery failed. Never throws.
     */
    boolean send(String sessionId, Object message);
}
