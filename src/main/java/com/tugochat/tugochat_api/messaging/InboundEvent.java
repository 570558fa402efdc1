package com.tugochat.tugochat_api.messaging;

import com.tugochat.tugochat_api.model.Player;

import java.time.Instant;

/**
 * Everything that can arrive at the game core from the outside, one record per
 * message kind. Consumed by {@code GameEventDispatcher#dispatch}.
 */
public sealed interface InboundEvent {

    /** {@code player} may be null, in which case the session's attached player is used. */
    record JoinQueue(String sessionId, Player player) implements InboundEvent {
    }

    record LeaveQueue(String sessionId) implements InboundEvent {
    }

    /** {@code roomId} is optional; when present it must match the session's match. */
    record GameReady(String sessionId, String roomId) implements InboundEvent {
    }

    record ChatPull(String channelId, String viewerId, Instant at) implements InboundEvent {
    }

    record Disconnect(String sessionId) implements InboundEvent {
    }
}
