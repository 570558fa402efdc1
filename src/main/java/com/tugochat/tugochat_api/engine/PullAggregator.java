package com.tugochat.tugochat_api.engine;

import com.tugochat.tugochat_api.model.PullEvent;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;

/**
 * Sliding window of recent pulls for one side of a match.
 *
 * Events are kept time-ascending and pruned from the oldest end, so both
 * inserting and counting are amortized O(1). Not thread-safe: only the owning
 * match actor touches it.
 */
public class PullAggregator {

    private final Duration window;
    private final Duration cooldown;

    private final Deque<PullEvent> events = new ArrayDeque<>();

    // viewerId -> number of that viewer's events still in the window
    private final Map<String, Integer> eventsPerViewer = new HashMap<>();

    // viewerId -> time of the viewer's latest accepted pull (only for viewers in the window)
    private final Map<String, Instant> lastPullAt = new HashMap<>();

    private Instant newest;

    public PullAggregator(Duration window, Duration cooldown) {
        this.window = window;
        this.cooldown = cooldown;
    }

    /**
     * Record a pull. A pull stamped earlier than the newest recorded one is
     * recorded at the newest timestamp so the deque stays ordered.
     *
     * @return false if the viewer is still cooling down from their previous pull
     */
    public boolean recordPull(String viewerId, Instant at) {
        Instant stamped = newest != null && at.isBefore(newest) ? newest : at;

        Instant previous = lastPullAt.get(viewerId);
        if (previous != null && Duration.between(previous, stamped).compareTo(cooldown) < 0) {
            return false;
        }

        events.addLast(new PullEvent(viewerId, stamped));
        eventsPerViewer.merge(viewerId, 1, Integer::sum);
        lastPullAt.put(viewerId, stamped);
        newest = stamped;

        prune(stamped);
        return true;
    }

    /** Distinct viewers with at least one pull in {@code (now - window, now]}. */
    public int uniquePullers(Instant now) {
        prune(now);
        return eventsPerViewer.size();
    }

    /**
     * Unique pullers as a fraction of the audience, clamped to [0, 1].
     * An empty audience has a rate of exactly 0.
     */
    public double engagementRate(Instant now, int totalViewers) {
        int unique = uniquePullers(now);
        if (totalViewers <= 0) {
            return 0.0;
        }
        return Math.min(1.0, (double) unique / totalViewers);
    }

    private void prune(Instant now) {
        Instant cutoff = now.minus(window);
        while (!events.isEmpty() && !events.peekFirst().at().isAfter(cutoff)) {
            PullEvent expired = events.pollFirst();
            Integer remaining = eventsPerViewer.computeIfPresent(
                    expired.viewerId(), (viewer, count) -> count == 1 ? null : count - 1);
            if (remaining == null) {
                lastPullAt.remove(expired.viewerId());
            }
        }
    }
}
