package com.tugochat.tugochat_api.config;

import com.tugochat.tugochat_api.messaging.InboundEvent;
import com.tugochat.tugochat_api.messaging.StompSessionConnection;
import com.tugochat.tugochat_api.service.GameEventDispatcher;
import com.tugochat.tugochat_api.service.SessionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.messaging.simp.user.SimpUserRegistry;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionConnectedEvent;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

import java.security.Principal;

/**
 * Bridges STOMP connection lifecycle into the session registry.
 */
@Component
public class WebSocketEventListener {
    private static final Logger log = LoggerFactory.getLogger(WebSocketEventListener.class);

    private final SessionRegistry sessionRegistry;
    private final GameEventDispatcher dispatcher;
    private final SimpMessagingTemplate messagingTemplate;
    private final SimpUserRegistry userRegistry;

    public WebSocketEventListener(SessionRegistry sessionRegistry,
                                  GameEventDispatcher dispatcher,
                                  SimpMessagingTemplate messagingTemplate,
                                  SimpUserRegistry userRegistry) {
        this.sessionRegistry = sessionRegistry;
        this.dispatcher = dispatcher;
        this.messagingTemplate = messagingTemplate;
        this.userRegistry = userRegistry;
    }

    @EventListener
    public void onConnected(SessionConnectedEvent event) {
        Principal user = event.getUser();
        if (user == null) {
            log.warn("STOMP connection without a session principal, ignoring");
            return;
        }
        String connectionId = SimpMessageHeaderAccessor.getSessionId(event.getMessage().getHeaders());
        sessionRegistry.register(user.getName(),
                new StompSessionConnection(user.getName(), connectionId, messagingTemplate, userRegistry));
        log.info("Session {} connected", user.getName());
    }

    @EventListener
    public void onDisconnected(SessionDisconnectEvent event) {
        Principal user = event.getUser();
        if (user == null) {
            return;
        }
        // A reconnect under the same session id replaces the connection; the old close is stale
        if (!sessionRegistry.isCurrentConnection(user.getName(), event.getSessionId())) {
            log.debug("Ignoring close of stale connection {} for session {}", event.getSessionId(), user.getName());
            return;
        }
        log.info("Session {} disconnected", user.getName());
        dispatcher.dispatch(new InboundEvent.Disconnect(user.getName()));
    }
}
