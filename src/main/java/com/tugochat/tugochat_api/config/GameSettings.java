package com.tugochat.tugochat_api.config;

import java.time.Duration;

/**
 * Tunables for every match. Built from {@code tugochat.game.*} in {@link GameConfig}.
 *
 * @param duration         play time before a match ends on the clock
 * @param tickInterval     spacing between rope updates
 * @param readyGracePeriod how long to wait for both game_ready acks before starting anyway
 * @param pullWindow       sliding window for unique-puller counting
 * @param pullCooldown     minimum spacing between accepted pulls of the same viewer
 * @param baseStrength     BASE_STRENGTH of the pull power formula
 * @param tickScale        converts the power difference into rope displacement per tick
 * @param winThreshold     rope boundary; the rope is clamped to [-winThreshold, winThreshold]
 */
public record GameSettings(
        Duration duration,
        Duration tickInterval,
        Duration readyGracePeriod,
        Duration pullWindow,
        Duration pullCooldown,
        double baseStrength,
        double tickScale,
        double winThreshold
) {}
