package com.tugochat.tugochat_api.messaging;

import com.tugochat.tugochat_api.exception.DeliveryFailedException;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.messaging.simp.user.SimpUserRegistry;

/**
 * Pushes JSON payloads to {@code /user/queue/game} of a STOMP user whose
 * principal name is the game session id.
 */
public class StompSessionConnection implements SessionConnection {

    public static final String GAME_QUEUE = "/queue/game";

    private final String sessionId;
    private final String connectionId;
    private final SimpMessagingTemplate messagingTemplate;
    private final SimpUserRegistry userRegistry;

    public StompSessionConnection(String sessionId,
                                  String connectionId,
                                  SimpMessagingTemplate messagingTemplate,
                                  SimpUserRegistry userRegistry) {
        this.sessionId = sessionId;
        this.connectionId = connectionId;
        this.messagingTemplate = messagingTemplate;
        this.userRegistry = userRegistry;
    }

    @Override
    public String connectionId() {
        return connectionId;
    }

    @Override
    public void send(Object payload) {
        // The simple broker silently drops messages for users that are gone
        if (userRegistry.getUser(sessionId) == null) {
            throw new DeliveryFailedException(sessionId, "no live STOMP connection");
        }
        try {
            messagingTemplate.convertAndSendToUser(sessionId, GAME_QUEUE, payload);
        } catch (MessagingException e) {
            throw new DeliveryFailedException(sessionId, e);
        }
    }
}
