package com.tugochat.tugochat_api.messaging;

import com.tugochat.tugochat_api.exception.DeliveryFailedException;

/**
 * Outbound handle for one connected client.
 */
public interface SessionConnection {

    /** Transport-level id of the underlying connection (differs per reconnect). */
    String connectionId();

    void send(Object payload) throws DeliveryFailedException;
}
