package com.tugochat.tugochat_api.controller;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.tugochat.tugochat_api.exception.UnknownSessionException;
import com.tugochat.tugochat_api.model.Player;
import com.tugochat.tugochat_api.service.SessionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Called by the login front end once the identity provider has resolved
 * the streamer behind a session. The OAuth exchange itself happens elsewhere.
 */
@RestController
@RequestMapping("/api/auth")
@CrossOrigin(origins = "*")
public class PlayerLoginController {
    private static final Logger log = LoggerFactory.getLogger(PlayerLoginController.class);

    private final SessionRegistry sessionRegistry;

    public PlayerLoginController(SessionRegistry sessionRegistry) {
        this.sessionRegistry = sessionRegistry;
    }

    @PostMapping("/resolved")
    public ResponseEntity<?> resolved(@RequestBody LoginResolved request) {
        if (request.sessionId() == null || request.player() == null || !request.player().isValid()) {
            log.warn("Rejected login resolution for session {}: invalid player", request.sessionId());
            return ResponseEntity.badRequest().body(new ErrorResponse("A valid session_id and player are required"));
        }
        try {
            sessionRegistry.attachPlayer(request.sessionId(), request.player());
        } catch (UnknownSessionException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(new ErrorResponse(e.getMessage()));
        }
        return ResponseEntity.ok(request.player());
    }

    // =========================================================================
    // DTOs
    // =========================================================================

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record LoginResolved(String sessionId, Player player) {}
}
