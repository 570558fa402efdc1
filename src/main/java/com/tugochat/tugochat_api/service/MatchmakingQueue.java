package com.tugochat.tugochat_api.service;

import com.tugochat.tugochat_api.exception.AlreadyQueuedException;
import com.tugochat.tugochat_api.exception.DuplicateParticipantException;
import com.tugochat.tugochat_api.messaging.GameMessages;
import com.tugochat.tugochat_api.messaging.MessageSender;
import com.tugochat.tugochat_api.model.Player;
import com.tugochat.tugochat_api.model.QueueEntry;
import com.tugochat.tugochat_api.model.SideId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * FIFO matchmaking: whenever two players are waiting, the two that joined
 * earliest are paired. No skill or audience-size matching.
 *
 * The waiting list is guarded by this object's monitor; notifications are
 * sent after the monitor is released.
 */
@Service
public class MatchmakingQueue {
    private static final Logger log = LoggerFactory.getLogger(MatchmakingQueue.class);

    private final MatchRegistry matchRegistry;
    private final MessageSender sender;
    private final Clock clock;

    // Ordered by joinedAt, earliest first
    private final Deque<QueueEntry> waiting = new ArrayDeque<>();

    public MatchmakingQueue(MatchRegistry matchRegistry, MessageSender sender, Clock clock) {
        this.matchRegistry = matchRegistry;
        this.sender = sender;
        this.clock = clock;
    }

    // =========================================================================
    // Join / leave
    // =========================================================================

    /**
     * Add a player to the back of the queue, acknowledge with queue_joined and
     * run a pairing pass.
     *
     * @throws AlreadyQueuedException if the player is already waiting or playing
     */
    public QueueEntry enqueue(Player player, String sessionId) {
        QueueEntry entry;
        synchronized (this) {
            if (find(player.id()).isPresent() || matchRegistry.hasLiveMatch(player.id())) {
                throw new AlreadyQueuedException(player.id());
            }
            entry = new QueueEntry(player, sessionId, clock.instant());
            waiting.addLast(entry);
        }
        log.info("Player {} joined the queue (session {})", player.username(), sessionId);

        sender.send(sessionId, GameMessages.queueJoined());
        pairWaitingPlayers();
        return entry;
    }

    /**
     * Remove a player if present. Absent players are not an error.
     *
     * @return whether an entry was removed
     */
    public boolean dequeue(String playerId) {
        QueueEntry removed = null;
        synchronized (this) {
            Iterator<QueueEntry> it = waiting.iterator();
            while (it.hasNext()) {
                QueueEntry entry = it.next();
                if (entry.playerId().equals(playerId)) {
                    it.remove();
                    removed = entry;
                    break;
                }
            }
        }
        if (removed == null) {
            return false;
        }
        log.info("Player {} left the queue", removed.player().username());
        sender.send(removed.sessionId(), GameMessages.queueLeft());
        return true;
    }

    /** Remove whatever entry a session owns, without notifying it. Used when the session is gone. */
    public synchronized boolean dropSession(String sessionId) {
        return waiting.removeIf(entry -> entry.sessionId().equals(sessionId));
    }

    public synchronized int size() {
        return waiting.size();
    }

    public synchronized boolean isQueued(String playerId) {
        return find(playerId).isPresent();
    }

    // =========================================================================
    // Pairing
    // =========================================================================

    /**
     * Pair waiting players two at a time, earliest first, and tell both of
     * them about their new match.
     */
    public void pairWaitingPlayers() {
        List<Pairing> pairings = new ArrayList<>();
        synchronized (this) {
            while (waiting.size() >= 2) {
                QueueEntry first = waiting.pollFirst();
                QueueEntry second = waiting.pollFirst();
                try {
                    String matchId = matchRegistry.createMatch(first, second);
                    pairings.add(new Pairing(matchId, first, second));
                } catch (DuplicateParticipantException e) {
                    log.warn("Pairing skipped: {}", e.getMessage());
                    // Put back whoever is still free, keeping their place in line
                    boolean secondFree = !matchRegistry.hasLiveMatch(second.playerId());
                    boolean firstFree = !matchRegistry.hasLiveMatch(first.playerId());
                    if (secondFree) {
                        waiting.addFirst(second);
                    }
                    if (firstFree) {
                        waiting.addFirst(first);
                    }
                    if (firstFree && secondFree) {
                        break;
                    }
                }
            }
        }

        for (Pairing pairing : pairings) {
            notifyMatchFound(pairing);
        }
    }

    private void notifyMatchFound(Pairing pairing) {
        QueueEntry first = pairing.first();
        QueueEntry second = pairing.second();
        sender.send(first.sessionId(),
                GameMessages.matchFound(pairing.matchId(), second.player(), SideId.PLAYER1));
        sender.send(second.sessionId(),
                GameMessages.matchFound(pairing.matchId(), first.player(), SideId.PLAYER2));
    }

    private Optional<QueueEntry> find(String playerId) {
        return waiting.stream().filter(entry -> entry.playerId().equals(playerId)).findFirst();
    }

    private record Pairing(String matchId, QueueEntry first, QueueEntry second) {
    }
}
