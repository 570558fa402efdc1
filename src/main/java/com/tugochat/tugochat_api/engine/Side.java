package com.tugochat.tugochat_api.engine;

import com.tugochat.tugochat_api.messaging.GameMessages.SideStats;
import com.tugochat.tugochat_api.model.Player;
import com.tugochat.tugochat_api.model.SideId;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

/**
 * One participant of a match: a streamer, their session and their chat's pulls.
 * Mutated only by the owning match actor.
 */
public class Side {

    @Getter
    private final SideId id;

    @Getter
    private final Player player;

    @Getter
    private final String sessionId;

    private final PullAggregator pulls;

    // Every accepted pull over the whole match, not just the window
    @Getter
    private int cumulativeScore;

    // Cached from the latest tick so clients can be told between ticks
    @Getter
    private int lastUniquePullers;

    @Getter
    private double lastEngagementRate;

    @Getter
    private double lastPower;

    @Getter @Setter
    private boolean ready;

    @Getter @Setter
    private boolean connected = true;

    public Side(SideId id, Player player, String sessionId, PullAggregator pulls) {
        this.id = id;
        this.player = player;
        this.sessionId = sessionId;
        this.pulls = pulls;
    }

    public boolean recordPull(String viewerId, Instant at) {
        if (!pulls.recordPull(viewerId, at)) {
            return false;
        }
        cumulativeScore++;
        return true;
    }

    /**
     * Re-evaluate this side's engagement at {@code now} and return its pull power.
     */
    public double measure(Instant now, double baseStrength) {
        lastUniquePullers = pulls.uniquePullers(now);
        lastEngagementRate = pulls.engagementRate(now, player.viewerCount());
        lastPower = FairnessFormula.pullPower(lastEngagementRate, lastUniquePullers, baseStrength);
        return lastPower;
    }

    public SideStats stats() {
        return new SideStats(player.id(), cumulativeScore, lastUniquePullers, lastEngagementRate, lastPower);
    }
}
