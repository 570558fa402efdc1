package com.tugochat.tugochat_api.engine;

import com.tugochat.tugochat_api.config.GameSettings;
import com.tugochat.tugochat_api.messaging.GameMessages;
import com.tugochat.tugochat_api.messaging.GameMessages.EndStats;
import com.tugochat.tugochat_api.messaging.GameMessages.GameState;
import com.tugochat.tugochat_api.messaging.MessageSender;
import com.tugochat.tugochat_api.model.EndReason;
import com.tugochat.tugochat_api.model.MatchState;
import com.tugochat.tugochat_api.model.SideId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledFuture;

/**
 * State machine of one tug-of-war match.
 *
 * <pre>
 *   PENDING_READY ──(both ready | grace expired)──► IN_PROGRESS ──► ENDED(reason)
 *         └───────────(both sides gone)──────────────────────────────►┘
 * </pre>
 *
 * Every public method only enqueues onto the match's {@link SerialExecutor};
 * the private handlers run one at a time, so the rope, the pull windows and
 * the state are never touched concurrently. The rope moves in {@link #tick()}
 * and nowhere else.
 */
public class MatchEngine {

    private static final Logger log = LoggerFactory.getLogger(MatchEngine.class);

    private final String id;
    private final Side player1;
    private final Side player2;
    private final GameSettings settings;
    private final Clock clock;
    private final TaskScheduler scheduler;
    private final SerialExecutor mailbox;
    private final MessageSender sender;
    private final MatchListener listener;

    private MatchState state = MatchState.PENDING_READY;
    private EndReason endReason;
    private Side winner;
    private double ropePosition;
    private Instant startedAt;
    private Instant endedAt;

    private ScheduledFuture<?> graceTimer;
    private ScheduledFuture<?> tickTimer;

    private volatile MatchSnapshot snapshot;

    public MatchEngine(String id,
                       Side player1,
                       Side player2,
                       GameSettings settings,
                       Clock clock,
                       TaskScheduler scheduler,
                       Executor workers,
                       MessageSender sender,
                       MatchListener listener) {
        this.id = id;
        this.player1 = player1;
        this.player2 = player2;
        this.settings = settings;
        this.clock = clock;
        this.scheduler = scheduler;
        this.mailbox = new SerialExecutor("match-" + id, workers);
        this.sender = sender;
        this.listener = listener;
        this.snapshot = buildSnapshot(clock.instant());
    }

    // =========================================================================
    // Inbound (thread-safe, asynchronous)
    // =========================================================================

    /** Arm the ready grace timer. Called once by the owner after creation. */
    public void open() {
        submit(() -> {
            if (state != MatchState.PENDING_READY) {
                return;
            }
            Instant deadline = clock.instant().plus(settings.readyGracePeriod());
            graceTimer = scheduler.schedule(() -> submit(this::graceExpired), deadline);
        });
    }

    public void ready(String sessionId) {
        submit(() -> markReady(sessionId));
    }

    public void pull(SideId side, String viewerId, Instant at) {
        submit(() -> recordPull(side, viewerId, at));
    }

    public void disconnect(String sessionId) {
        submit(() -> handleDisconnect(sessionId));
    }

    /** Stop all timers without a final broadcast; used when the owner discards the match. */
    public void close() {
        submit(this::cancelTimers);
    }

    // =========================================================================
    // Read-only accessors (safe from any thread)
    // =========================================================================

    public String getId() {
        return id;
    }

    public Side getPlayer1() {
        return player1;
    }

    public Side getPlayer2() {
        return player2;
    }

    public Side side(SideId sideId) {
        return sideId == SideId.PLAYER1 ? player1 : player2;
    }

    public MatchSnapshot snapshot() {
        return snapshot;
    }

    // =========================================================================
    // Handlers (run on the mailbox only)
    // =========================================================================

    private void markReady(String sessionId) {
        if (state != MatchState.PENDING_READY) {
            log.debug("Ignoring game_ready from {} in match {} (state {})", sessionId, id, state);
            return;
        }
        Side side = sideFor(sessionId).orElse(null);
        if (side == null) {
            log.warn("game_ready from session {} which is not part of match {}", sessionId, id);
            return;
        }
        if (!side.isConnected()) {
            log.info("Session {} is back in match {}", sessionId, id);
            side.setConnected(true);
        }
        side.setReady(true);
        log.debug("Session {} ready in match {}", sessionId, id);

        if (player1.isReady() && player2.isReady()) {
            beginPlay();
        }
    }

    private void graceExpired() {
        if (state != MatchState.PENDING_READY) {
            return;
        }
        log.info("Ready grace period expired for match {}, starting without full acknowledgement", id);
        beginPlay();
    }

    private void beginPlay() {
        cancel(graceTimer);
        graceTimer = null;
        Instant now = clock.instant();

        if (!player1.isConnected() || !player2.isConnected()) {
            Side remaining = player1.isConnected() ? player1 : player2.isConnected() ? player2 : null;
            finish(EndReason.OPPONENT_DISCONNECTED, remaining, now);
            return;
        }

        state = MatchState.IN_PROGRESS;
        startedAt = now;
        log.info("Match {} started: {} vs {}", id, player1.getPlayer().username(), player2.getPlayer().username());

        // Chat routes must exist before clients hear game_started
        listener.matchStarted(this);
        broadcast(GameMessages.gameStarted());

        Duration interval = settings.tickInterval();
        tickTimer = scheduler.scheduleAtFixedRate(() -> submit(this::tick), now.plus(interval), interval);
    }

    private void recordPull(SideId sideId, String viewerId, Instant at) {
        if (state != MatchState.IN_PROGRESS) {
            log.debug("Dropping pull from {} for match {} (state {})", viewerId, id, state);
            return;
        }
        if (!side(sideId).recordPull(viewerId, at)) {
            log.debug("Pull from {} on {} ignored, viewer cooling down", viewerId, sideId.wireName());
        }
    }

    /**
     * One rope update: measure both sides, move and clamp the rope, then
     * check the boundary and the clock.
     */
    private void tick() {
        if (state != MatchState.IN_PROGRESS) {
            return;
        }
        Instant now = clock.instant();
        double power1 = player1.measure(now, settings.baseStrength());
        double power2 = player2.measure(now, settings.baseStrength());

        double boundary = settings.winThreshold();
        ropePosition = FairnessFormula.clamp(
                ropePosition + FairnessFormula.displacement(power1, power2, settings.tickScale()), boundary);
        log.debug("Match {} tick: power1={} power2={} rope={}", id, power1, power2, ropePosition);

        if (ropePosition >= boundary) {
            finish(EndReason.ROPE_REACHED_BOUNDARY, player1, now);
        } else if (ropePosition <= -boundary) {
            finish(EndReason.ROPE_REACHED_BOUNDARY, player2, now);
        } else if (elapsed(now).compareTo(settings.duration()) >= 0) {
            finish(EndReason.TIME_EXPIRED, leader(), now);
        } else {
            broadcast(gameUpdate(now));
        }
    }

    private void handleDisconnect(String sessionId) {
        Side side = sideFor(sessionId).orElse(null);
        if (side == null || state == MatchState.ENDED) {
            return;
        }
        side.setConnected(false);
        side.setReady(false);
        Side other = opponentOf(side);

        if (state == MatchState.IN_PROGRESS) {
            log.info("Session {} left match {} mid-game", sessionId, id);
            finish(EndReason.OPPONENT_DISCONNECTED, other, clock.instant());
        } else if (!other.isConnected()) {
            log.info("Both sessions left match {} before it started", id);
            finish(EndReason.OPPONENT_DISCONNECTED, null, clock.instant());
        } else {
            log.info("Session {} left match {} before it started, readiness forfeited", sessionId, id);
        }
    }

    private void finish(EndReason reason, Side winningSide, Instant now) {
        state = MatchState.ENDED;
        endReason = reason;
        winner = winningSide;
        endedAt = now;
        cancelTimers();

        String winnerId = winningSide == null ? null : winningSide.getPlayer().id();
        log.info("Match {} ended: reason={}, winner={}, rope={}", id, reason, winnerId, ropePosition);

        broadcast(gameUpdate(now));
        broadcast(GameMessages.gameEnded(winnerId, new EndStats(
                reason, ropePosition, elapsed(now).getSeconds(), player1.stats(), player2.stats())));
        listener.matchEnded(this);
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private void submit(Runnable task) {
        mailbox.execute(() -> {
            task.run();
            snapshot = buildSnapshot(clock.instant());
        });
    }

    private void cancelTimers() {
        cancel(graceTimer);
        cancel(tickTimer);
        graceTimer = null;
        tickTimer = null;
    }

    private static void cancel(ScheduledFuture<?> timer) {
        if (timer != null) {
            timer.cancel(false);
        }
    }

    private void broadcast(Object message) {
        for (Side side : new Side[]{player1, player2}) {
            if (side.isConnected()) {
                sender.send(side.getSessionId(), message);
            }
        }
    }

    private GameMessages.GameUpdate gameUpdate(Instant now) {
        return GameMessages.gameUpdate(new GameState(
                id,
                ropePosition,
                player1.getCumulativeScore(), player2.getCumulativeScore(),
                player1.getLastEngagementRate(), player2.getLastEngagementRate(),
                timeRemaining(now),
                state));
    }

    private Duration elapsed(Instant now) {
        if (startedAt == null) {
            return Duration.ZERO;
        }
        Instant until = endedAt != null ? endedAt : now;
        return Duration.between(startedAt, until);
    }

    // Derived from the clock rather than counted ticks, so scheduling jitter cannot drift it
    private long timeRemaining(Instant now) {
        return Math.max(0L, settings.duration().minus(elapsed(now)).getSeconds());
    }

    private Side leader() {
        if (ropePosition > 0) {
            return player1;
        }
        if (ropePosition < 0) {
            return player2;
        }
        return null;
    }

    private Optional<Side> sideFor(String sessionId) {
        if (player1.getSessionId().equals(sessionId)) {
            return Optional.of(player1);
        }
        if (player2.getSessionId().equals(sessionId)) {
            return Optional.of(player2);
        }
        return Optional.empty();
    }

    private Side opponentOf(Side side) {
        return side == player1 ? player2 : player1;
    }

    private MatchSnapshot buildSnapshot(Instant now) {
        return new MatchSnapshot(
                id, state, endReason, ropePosition,
                player1.getCumulativeScore(), player2.getCumulativeScore(),
                player1.getLastEngagementRate(), player2.getLastEngagementRate(),
                timeRemaining(now),
                winner == null ? null : winner.getPlayer().id());
    }
}
