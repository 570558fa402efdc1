package com.tugochat.tugochat_api.service;

import com.tugochat.tugochat_api.exception.GameException;
import com.tugochat.tugochat_api.messaging.InboundEvent;
import com.tugochat.tugochat_api.messaging.InboundEvent.ChatPull;
import com.tugochat.tugochat_api.messaging.InboundEvent.Disconnect;
import com.tugochat.tugochat_api.messaging.InboundEvent.GameReady;
import com.tugochat.tugochat_api.messaging.InboundEvent.JoinQueue;
import com.tugochat.tugochat_api.messaging.InboundEvent.LeaveQueue;
import com.tugochat.tugochat_api.model.Player;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Single entry point for inbound events: one event, one handler.
 *
 * Every failure here is a benign race or a bad client message. It is logged
 * and dropped, never rethrown to the transport.
 */
@Service
public class GameEventDispatcher {
    private static final Logger log = LoggerFactory.getLogger(GameEventDispatcher.class);

    private final SessionRegistry sessionRegistry;
    private final MatchmakingQueue matchmakingQueue;
    private final MatchRegistry matchRegistry;

    public GameEventDispatcher(SessionRegistry sessionRegistry,
                               MatchmakingQueue matchmakingQueue,
                               MatchRegistry matchRegistry) {
        this.sessionRegistry = sessionRegistry;
        this.matchmakingQueue = matchmakingQueue;
        this.matchRegistry = matchRegistry;
    }

    public void dispatch(InboundEvent event) {
        try {
            if (event instanceof JoinQueue join) {
                onJoinQueue(join);
            } else if (event instanceof LeaveQueue leave) {
                onLeaveQueue(leave);
            } else if (event instanceof GameReady ready) {
                matchRegistry.routeReady(ready.sessionId(), ready.roomId());
            } else if (event instanceof ChatPull pull) {
                matchRegistry.routeChatPull(pull.channelId(), pull.viewerId(), pull.at());
            } else if (event instanceof Disconnect disconnect) {
                onDisconnect(disconnect.sessionId());
            }
        } catch (GameException e) {
            log.warn("Dropped {}: {}", event.getClass().getSimpleName(), e.getMessage());
        }
    }

    @EventListener
    public void onSessionLost(SessionLostEvent event) {
        log.info("Session {} lost, routing through disconnect", event.sessionId());
        dispatch(new Disconnect(event.sessionId()));
    }

    // =========================================================================
    // Handlers
    // =========================================================================

    private void onJoinQueue(JoinQueue join) {
        Player player = join.player() != null
                ? join.player()
                : sessionRegistry.playerFor(join.sessionId()).orElse(null);
        if (player == null || !player.isValid()) {
            log.warn("Dropping join_queue from {}: no valid player identity", join.sessionId());
            return;
        }
        sessionRegistry.attachPlayer(join.sessionId(), player);
        matchmakingQueue.enqueue(player, join.sessionId());
    }

    private void onLeaveQueue(LeaveQueue leave) {
        sessionRegistry.playerFor(leave.sessionId())
                .ifPresent(player -> matchmakingQueue.dequeue(player.id()));
    }

    private void onDisconnect(String sessionId) {
        if (matchmakingQueue.dropSession(sessionId)) {
            log.info("Session {} removed from queue on disconnect", sessionId);
        }
        try {
            matchRegistry.routeDisconnect(sessionId);
        } catch (GameException e) {
            log.debug("Session {} had no live match: {}", sessionId, e.getMessage());
        }
        sessionRegistry.unregister(sessionId);
    }
}
