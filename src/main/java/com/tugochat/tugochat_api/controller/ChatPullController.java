package com.tugochat.tugochat_api.controller;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.tugochat.tugochat_api.messaging.InboundEvent;
import com.tugochat.tugochat_api.service.GameEventDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Instant;

/**
 * Ingress for the chat bot: one call per viewer "pull" command.
 * Pulls for channels without a running match are accepted and ignored.
 */
@RestController
@RequestMapping("/api/chat")
@CrossOrigin(origins = "*")
public class ChatPullController {
    private static final Logger log = LoggerFactory.getLogger(ChatPullController.class);

    private final GameEventDispatcher dispatcher;
    private final Clock clock;

    public ChatPullController(GameEventDispatcher dispatcher, Clock clock) {
        this.dispatcher = dispatcher;
        this.clock = clock;
    }

    @PostMapping("/pull")
    public ResponseEntity<?> pull(@RequestBody ChatPullRequest request) {
        if (isBlank(request.channelId()) || isBlank(request.viewerId())) {
            return ResponseEntity.badRequest()
                    .body(new ErrorResponse("channel_id and viewer_id are required"));
        }
        Instant at = request.at() != null ? request.at() : clock.instant();
        log.debug("Pull from {} on channel {}", request.viewerId(), request.channelId());
        dispatcher.dispatch(new InboundEvent.ChatPull(request.channelId(), request.viewerId(), at));
        return ResponseEntity.status(HttpStatus.ACCEPTED).build();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    // =========================================================================
    // DTOs
    // =========================================================================

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record ChatPullRequest(String channelId, String viewerId, Instant at) {}
}
