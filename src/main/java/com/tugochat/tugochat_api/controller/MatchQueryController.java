package com.tugochat.tugochat_api.controller;

import com.tugochat.tugochat_api.service.MatchRegistry;
import com.tugochat.tugochat_api.service.MatchmakingQueue;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api")
@CrossOrigin(origins = "*")
public class MatchQueryController {

    private final MatchRegistry matchRegistry;
    private final MatchmakingQueue matchmakingQueue;

    public MatchQueryController(MatchRegistry matchRegistry, MatchmakingQueue matchmakingQueue) {
        this.matchRegistry = matchRegistry;
        this.matchmakingQueue = matchmakingQueue;
    }

    @GetMapping("/matches/{roomId}")
    public ResponseEntity<?> match(@PathVariable String roomId) {
        return matchRegistry.snapshot(roomId)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(new ErrorResponse("No live match " + roomId)));
    }

    @GetMapping("/queue")
    public Map<String, Integer> queue() {
        return Map.of("size", matchmakingQueue.size());
    }
}
