package com.tugochat.tugochat_api.model;

import java.time.Instant;

/**
 * A player waiting in the matchmaking queue, together with the session that
 * will receive their notifications.
 */
public record QueueEntry(Player player, String sessionId, Instant joinedAt) {

    public String playerId() {
        return player.id();
    }
}
