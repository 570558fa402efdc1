package com.tugochat.tugochat_api.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tugochat.tugochat_api.messaging.InboundEvent;
import com.tugochat.tugochat_api.model.Player;
import com.tugochat.tugochat_api.service.GameEventDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.messaging.converter.MessageConversionException;
import org.springframework.messaging.handler.annotation.MessageExceptionHandler;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Controller;

import java.security.Principal;
import java.util.Optional;

/**
 * Client messages arrive on {@code /app/game}. The STOMP principal is the
 * game session id assigned at handshake.
 */
@Controller
public class GameSocketController {
    private static final Logger log = LoggerFactory.getLogger(GameSocketController.class);

    private final GameEventDispatcher dispatcher;

    public GameSocketController(GameEventDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @MessageMapping("/game")
    public void onMessage(@Payload ClientMessage message, Principal principal) {
        if (principal == null) {
            log.warn("Game message without a session principal, dropping");
            return;
        }
        Optional<InboundEvent> event = toEvent(principal.getName(), message);
        if (event.isEmpty()) {
            log.warn("Dropping unrecognized message type '{}' from session {}",
                    message == null ? null : message.type(), principal.getName());
            return;
        }
        dispatcher.dispatch(event.get());
    }

    @MessageExceptionHandler(MessageConversionException.class)
    public void onMalformed(MessageConversionException e, Principal principal) {
        log.warn("Dropping malformed message from session {}: {}",
                principal == null ? null : principal.getName(), e.getMessage());
    }

    static Optional<InboundEvent> toEvent(String sessionId, ClientMessage message) {
        if (message == null || message.type() == null) {
            return Optional.empty();
        }
        switch (message.type()) {
            case "join_queue":
                return Optional.of(new InboundEvent.JoinQueue(sessionId, message.player()));
            case "leave_queue":
                return Optional.of(new InboundEvent.LeaveQueue(sessionId));
            case "game_ready":
                return Optional.of(new InboundEvent.GameReady(sessionId, message.roomId()));
            default:
                return Optional.empty();
        }
    }

    // =========================================================================
    // DTOs
    // =========================================================================

    /** {@code player} is only read on join_queue, {@code room_id} only on game_ready. */
    public record ClientMessage(String type, Player player, @JsonProperty("room_id") String roomId) {}
}
