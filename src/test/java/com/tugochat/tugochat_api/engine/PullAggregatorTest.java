package com.tugochat.tugochat_api.engine;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static com.tugochat.util.TestFixtures.T0;
import static org.junit.jupiter.api.Assertions.*;

class PullAggregatorTest {

    private static final Duration WINDOW = Duration.ofSeconds(30);

    private PullAggregator pulls;

    @BeforeEach
    void setUp() {
        pulls = new PullAggregator(WINDOW, Duration.ZERO);
    }

    // =========================================================================
    // Unique pullers
    // =========================================================================

    @Nested
    @DisplayName("Unique pullers")
    class UniquePullers {

        @Test
        @DisplayName("repeatPullsFromOneViewer_countOnce")
        void repeatPullsFromOneViewer_countOnce() {
            pulls.recordPull("v1", T0);
            pulls.recordPull("v1", T0.plusSeconds(1));
            pulls.recordPull("v2", T0.plusSeconds(2));

            assertEquals(2, pulls.uniquePullers(T0.plusSeconds(3)));
        }

        @Test
        @DisplayName("emptyWindow_hasNoPullers")
        void emptyWindow_hasNoPullers() {
            assertEquals(0, pulls.uniquePullers(T0));
        }

        @Test
        @DisplayName("pullExactlyOneWindowOld_isExpired")
        void pullExactlyOneWindowOld_isExpired() {
            pulls.recordPull("v1", T0);

            assertEquals(1, pulls.uniquePullers(T0.plus(WINDOW).minusMillis(1)));
            assertEquals(0, pulls.uniquePullers(T0.plus(WINDOW)));
        }

        @Test
        @DisplayName("viewerStaysCounted_whileAnyOfTheirPullsIsInWindow")
        void viewerStaysCounted_whileAnyOfTheirPullsIsInWindow() {
            pulls.recordPull("v1", T0);
            pulls.recordPull("v1", T0.plusSeconds(20));

            // First pull expired, second still inside
            assertEquals(1, pulls.uniquePullers(T0.plusSeconds(40)));
            assertEquals(0, pulls.uniquePullers(T0.plusSeconds(50)));
        }

        @Test
        @DisplayName("outOfOrderPull_isStampedAtNewestTime")
        void outOfOrderPull_isStampedAtNewestTime() {
            pulls.recordPull("v1", T0.plusSeconds(10));
            pulls.recordPull("v2", T0.plusSeconds(5));

            // v2 would have expired at +35 had it kept its own timestamp
            assertEquals(2, pulls.uniquePullers(T0.plusSeconds(37)));
            assertEquals(0, pulls.uniquePullers(T0.plusSeconds(40)));
        }
    }

    // =========================================================================
    // Engagement rate
    // =========================================================================

    @Nested
    @DisplayName("Engagement rate")
    class EngagementRate {

        @Test
        @DisplayName("rate_isUniquePullersOverAudience")
        void rate_isUniquePullersOverAudience() {
            for (int i = 0; i < 20; i++) {
                pulls.recordPull("v" + i, T0);
            }

            assertEquals(0.2, pulls.engagementRate(T0, 100), 1e-9);
        }

        @Test
        @DisplayName("zeroAudience_hasZeroRate")
        void zeroAudience_hasZeroRate() {
            pulls.recordPull("v1", T0);

            assertEquals(0.0, pulls.engagementRate(T0, 0));
        }

        @Test
        @DisplayName("morePullersThanAudience_isClampedToOne")
        void morePullersThanAudience_isClampedToOne() {
            for (int i = 0; i < 8; i++) {
                pulls.recordPull("v" + i, T0);
            }

            assertEquals(1.0, pulls.engagementRate(T0, 5));
        }
    }

    // =========================================================================
    // Cooldown
    // =========================================================================

    @Nested
    @DisplayName("Per-viewer cooldown")
    class Cooldown {

        @BeforeEach
        void withCooldown() {
            pulls = new PullAggregator(WINDOW, Duration.ofMillis(500));
        }

        @Test
        @DisplayName("pullWithinCooldown_isRejected")
        void pullWithinCooldown_isRejected() {
            assertTrue(pulls.recordPull("v1", T0));
            assertFalse(pulls.recordPull("v1", T0.plusMillis(499)));
            assertTrue(pulls.recordPull("v1", T0.plusMillis(500)));
        }

        @Test
        @DisplayName("cooldown_isPerViewer")
        void cooldown_isPerViewer() {
            Instant at = T0;
            assertTrue(pulls.recordPull("v1", at));
            assertTrue(pulls.recordPull("v2", at));
        }
    }
}
