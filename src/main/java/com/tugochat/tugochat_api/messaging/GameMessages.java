package com.tugochat.tugochat_api.messaging;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.tugochat.tugochat_api.model.EndReason;
import com.tugochat.tugochat_api.model.MatchState;
import com.tugochat.tugochat_api.model.Player;
import com.tugochat.tugochat_api.model.SideId;

/**
 * Outbound payloads pushed to clients on {@code /user/queue/game}.
 *
 * Every payload carries a {@code type} field; field names are snake_case.
 * These shapes are what the browser client renders from, so keep them stable.
 */
public final class GameMessages {

    public static final String QUEUE_JOINED = "queue_joined";
    public static final String QUEUE_LEFT = "queue_left";
    public static final String MATCH_FOUND = "match_found";
    public static final String GAME_STARTED = "game_started";
    public static final String GAME_UPDATE = "game_update";
    public static final String GAME_ENDED = "game_ended";

    private GameMessages() {
    }

    public static Notice queueJoined() {
        return new Notice(QUEUE_JOINED);
    }

    public static Notice queueLeft() {
        return new Notice(QUEUE_LEFT);
    }

    public static Notice gameStarted() {
        return new Notice(GAME_STARTED);
    }

    public static MatchFound matchFound(String roomId, Player opponent, SideId side) {
        return new MatchFound(MATCH_FOUND, roomId, opponent, side);
    }

    public static GameUpdate gameUpdate(GameState state) {
        return new GameUpdate(GAME_UPDATE, state);
    }

    public static GameEnded gameEnded(String winner, EndStats stats) {
        return new GameEnded(GAME_ENDED, winner, stats);
    }

    // =========================================================================
    // Payloads
    // =========================================================================

    /** queue_joined, queue_left and game_started carry nothing beyond their type. */
    public record Notice(String type) {
    }

    /** {@code side} tells the receiving client which end of the rope is theirs. */
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record MatchFound(String type, String roomId, Player opponent, SideId side) {
    }

    /** The browser client hands {@code state} straight to its render function. */
    public record GameUpdate(String type, GameState state) {
    }

    /** Scores are cumulative pull counts; {@code timeRemaining} is in whole seconds. */
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record GameState(
            String roomId,
            double ropePosition,
            int player1Score,
            int player2Score,
            double player1Engagement,
            double player2Engagement,
            long timeRemaining,
            MatchState status
    ) {}

    /** {@code winner} is a player id, or null for a draw. */
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record GameEnded(String type, String winner, EndStats stats) {
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record EndStats(
            EndReason reason,
            double ropePosition,
            long durationSeconds,
            SideStats player1,
            SideStats player2
    ) {}

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record SideStats(
            String playerId,
            int totalPulls,
            int uniquePullers,
            double engagementRate,
            double pullPower
    ) {}
}
