package com.tugochat.tugochat_api.engine;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.tugochat.tugochat_api.model.EndReason;
import com.tugochat.tugochat_api.model.MatchState;

/**
 * Immutable view of a match, republished after every mailbox task so other
 * threads can read it without touching the actor.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MatchSnapshot(
        String roomId,
        MatchState state,
        EndReason endReason,
        double ropePosition,
        int player1Score,
        int player2Score,
        double player1Engagement,
        double player2Engagement,
        long timeRemaining,
        String winner
) {}
