package com.tugochat.tugochat_api.service;

import com.tugochat.tugochat_api.config.GameSettings;
import com.tugochat.tugochat_api.engine.MatchEngine;
import com.tugochat.tugochat_api.engine.MatchListener;
import com.tugochat.tugochat_api.engine.MatchSnapshot;
import com.tugochat.tugochat_api.engine.PullAggregator;
import com.tugochat.tugochat_api.engine.Side;
import com.tugochat.tugochat_api.exception.DuplicateParticipantException;
import com.tugochat.tugochat_api.exception.UnknownMatchException;
import com.tugochat.tugochat_api.exception.UnknownSessionException;
import com.tugochat.tugochat_api.messaging.MessageSender;
import com.tugochat.tugochat_api.model.QueueEntry;
import com.tugochat.tugochat_api.model.SideId;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executor;

/**
 * Owns every live match and routes inbound events to the right one.
 *
 * All maps are guarded by this object's monitor. Calls into a match happen
 * outside the monitor; they only enqueue onto the match's mailbox.
 */
@Service
public class MatchRegistry implements MatchListener {
    private static final Logger log = LoggerFactory.getLogger(MatchRegistry.class);

    private final GameSettings settings;
    private final Clock clock;
    private final TaskScheduler scheduler;
    private final Executor workers;
    private final MessageSender sender;

    // Key: matchId
    private final Map<String, MatchEngine> matches = new HashMap<>();

    // Key: playerId, Value: matchId
    private final Map<String, String> matchByPlayer = new HashMap<>();

    // Key: sessionId, Value: matchId (lookup only, never keeps a match alive)
    private final Map<String, String> matchBySession = new HashMap<>();

    // Key: chat channel id, populated while the match is in progress
    private final Map<String, ChannelRoute> routesByChannel = new HashMap<>();

    public MatchRegistry(GameSettings settings,
                         Clock clock,
                         @Qualifier("matchScheduler") TaskScheduler scheduler,
                         @Qualifier("matchScheduler") Executor workers,
                         MessageSender sender) {
        this.settings = settings;
        this.clock = clock;
        this.scheduler = scheduler;
        this.workers = workers;
        this.sender = sender;
    }

    // =========================================================================
    // Creation
    // =========================================================================

    /**
     * Create a match between two queued players. {@code first} becomes player1.
     *
     * @throws DuplicateParticipantException if either player already has a live match
     */
    public String createMatch(QueueEntry first, QueueEntry second) {
        MatchEngine match;
        synchronized (this) {
            for (QueueEntry entry : List.of(first, second)) {
                if (matchByPlayer.containsKey(entry.playerId())) {
                    throw new DuplicateParticipantException(entry.playerId());
                }
            }
            if (first.playerId().equals(second.playerId())) {
                throw new DuplicateParticipantException(first.playerId());
            }

            String matchId = UUID.randomUUID().toString();
            match = new MatchEngine(
                    matchId,
                    newSide(SideId.PLAYER1, first),
                    newSide(SideId.PLAYER2, second),
                    settings, clock, scheduler, workers, sender, this);

            matches.put(matchId, match);
            matchByPlayer.put(first.playerId(), matchId);
            matchByPlayer.put(second.playerId(), matchId);
            matchBySession.put(first.sessionId(), matchId);
            matchBySession.put(second.sessionId(), matchId);
        }
        log.info("Match {} created: {} vs {}", match.getId(),
                first.player().username(), second.player().username());
        match.open();
        return match.getId();
    }

    private Side newSide(SideId id, QueueEntry entry) {
        PullAggregator pulls = new PullAggregator(settings.pullWindow(), settings.pullCooldown());
        return new Side(id, entry.player(), entry.sessionId(), pulls);
    }

    // =========================================================================
    // Routing
    // =========================================================================

    /**
     * @param roomId optional; when given it must name the session's match
     */
    public void routeReady(String sessionId, String roomId) {
        MatchEngine match = matchForSession(sessionId);
        if (roomId != null && !roomId.equals(match.getId())) {
            throw new UnknownMatchException(roomId);
        }
        match.ready(sessionId);
    }

    public void routePull(String matchId, SideId side, String viewerId, Instant at) {
        MatchEngine match;
        synchronized (this) {
            match = matches.get(matchId);
        }
        if (match == null) {
            throw new UnknownMatchException(matchId);
        }
        match.pull(side, viewerId, at);
    }

    /**
     * Route a chat command by the streamer's channel. Channels without a
     * running match are ignored.
     *
     * @return whether the pull was forwarded to a match
     */
    public boolean routeChatPull(String channelId, String viewerId, Instant at) {
        ChannelRoute route;
        synchronized (this) {
            route = routesByChannel.get(channelId);
        }
        if (route == null) {
            log.debug("No running match for channel {}, dropping pull from {}", channelId, viewerId);
            return false;
        }
        try {
            routePull(route.matchId(), route.side(), viewerId, at);
            return true;
        } catch (UnknownMatchException e) {
            log.debug("Channel {} mapped to a match that just ended", channelId);
            return false;
        }
    }

    public void routeDisconnect(String sessionId) {
        matchForSession(sessionId).disconnect(sessionId);
    }

    private MatchEngine matchForSession(String sessionId) {
        synchronized (this) {
            String matchId = matchBySession.get(sessionId);
            if (matchId == null) {
                throw new UnknownSessionException(sessionId);
            }
            MatchEngine match = matches.get(matchId);
            if (match == null) {
                throw new UnknownMatchException(matchId);
            }
            return match;
        }
    }

    // =========================================================================
    // Queries
    // =========================================================================

    public synchronized boolean hasLiveMatch(String playerId) {
        return matchByPlayer.containsKey(playerId);
    }

    public synchronized Optional<String> matchIdForSession(String sessionId) {
        return Optional.ofNullable(matchBySession.get(sessionId));
    }

    public synchronized Optional<MatchSnapshot> snapshot(String matchId) {
        MatchEngine match = matches.get(matchId);
        return match == null ? Optional.empty() : Optional.of(match.snapshot());
    }

    public synchronized int liveMatchCount() {
        return matches.size();
    }

    // =========================================================================
    // MatchListener
    // =========================================================================

    @Override
    public synchronized void matchStarted(MatchEngine match) {
        for (Side side : List.of(match.getPlayer1(), match.getPlayer2())) {
            // A streamer's chat channel is identified by their player id
            routesByChannel.put(side.getPlayer().id(), new ChannelRoute(match.getId(), side.getId()));
        }
    }

    @Override
    public void matchEnded(MatchEngine match) {
        synchronized (this) {
            remove(match);
        }
        log.info("Match {} removed from registry", match.getId());
    }

    private void remove(MatchEngine match) {
        String matchId = match.getId();
        matches.remove(matchId);
        for (Side side : List.of(match.getPlayer1(), match.getPlayer2())) {
            matchByPlayer.remove(side.getPlayer().id(), matchId);
            matchBySession.remove(side.getSessionId(), matchId);
            routesByChannel.remove(side.getPlayer().id(), new ChannelRoute(matchId, side.getId()));
        }
    }

    @PreDestroy
    public void closeAll() {
        List<MatchEngine> live;
        synchronized (this) {
            live = new ArrayList<>(matches.values());
            live.forEach(this::remove);
        }
        live.forEach(MatchEngine::close);
        if (!live.isEmpty()) {
            log.info("Closed {} live matches on shutdown", live.size());
        }
    }

    private record ChannelRoute(String matchId, SideId side) {
    }
}
