package com.tugochat.tugochat_api.service;

import com.tugochat.tugochat_api.exception.DeliveryFailedException;
import com.tugochat.tugochat_api.exception.UnknownSessionException;
import com.tugochat.tugochat_api.messaging.MessageSender;
import com.tugochat.tugochat_api.messaging.SessionConnection;
import com.tugochat.tugochat_api.model.Player;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps opaque session ids to their live connection and, once known, the
 * streamer behind them.
 */
@Service
public class SessionRegistry implements MessageSender {
    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

    private final ApplicationEventPublisher eventPublisher;

    // Key: sessionId
    private final Map<String, SessionEntry> sessions = new ConcurrentHashMap<>();

    public SessionRegistry(ApplicationEventPublisher eventPublisher) {
        this.eventPublisher = eventPublisher;
    }

    /**
     * Register (or replace, on reconnect) the connection for a session.
     * A player already attached to the session is kept.
     */
    public void register(String sessionId, SessionConnection connection) {
        sessions.compute(sessionId, (id, existing) ->
                new SessionEntry(connection, existing == null ? null : existing.player()));
        log.debug("Session {} registered on connection {}", sessionId, connection.connectionId());
    }

    public void attachPlayer(String sessionId, Player player) {
        SessionEntry updated = sessions.computeIfPresent(sessionId,
                (id, entry) -> new SessionEntry(entry.connection(), player));
        if (updated == null) {
            throw new UnknownSessionException(sessionId);
        }
        log.info("Session {} resolved to player {} ({})", sessionId, player.username(), player.id());
    }

    public Optional<Player> playerFor(String sessionId) {
        SessionEntry entry = sessions.get(sessionId);
        return entry == null ? Optional.empty() : Optional.ofNullable(entry.player());
    }

    public boolean isRegistered(String sessionId) {
        return sessions.containsKey(sessionId);
    }

    /** True if {@code connectionId} is the connection currently serving the session. */
    public boolean isCurrentConnection(String sessionId, String connectionId) {
        SessionEntry entry = sessions.get(sessionId);
        return entry != null && entry.connection().connectionId().equals(connectionId);
    }

    @Override
    public boolean send(String sessionId, Object message) {
        SessionEntry entry = sessions.get(sessionId);
        if (entry == null) {
            log.warn("Dropping message for unknown session {}", sessionId);
            return false;
        }
        try {
            entry.connection().send(message);
            return true;
        } catch (DeliveryFailedException e) {
            log.warn("Delivery failed: {}", e.getMessage());
            eventPublisher.publishEvent(new SessionLostEvent(sessionId));
            return false;
        }
    }

    public void unregister(String sessionId) {
        if (sessions.remove(sessionId) != null) {
            log.debug("Session {} unregistered", sessionId);
        }
    }

    public int size() {
        return sessions.size();
    }

    private record SessionEntry(SessionConnection connection, Player player) {
    }
}
