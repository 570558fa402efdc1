package com.tugochat.tugochat_api.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class GameConfig {

    // Defaults match application.properties; the test profile shortens them
    @Bean
    public GameSettings gameSettings(
            @Value("${tugochat.game.duration-seconds:120}") long durationSeconds,
            @Value("${tugochat.game.tick-interval-millis:1000}") long tickIntervalMillis,
            @Value("${tugochat.game.ready-grace-seconds:10}") long readyGraceSeconds,
            @Value("${tugochat.game.pull-window-seconds:30}") long pullWindowSeconds,
            @Value("${tugochat.game.pull-cooldown-millis:500}") long pullCooldownMillis,
            @Value("${tugochat.game.base-strength:1.0}") double baseStrength,
            @Value("${tugochat.game.tick-scale:10.0}") double tickScale,
            @Value("${tugochat.game.win-threshold:100.0}") double winThreshold) {
        return new GameSettings(
                Duration.ofSeconds(durationSeconds),
                Duration.ofMillis(tickIntervalMillis),
                Duration.ofSeconds(readyGraceSeconds),
                Duration.ofSeconds(pullWindowSeconds),
                Duration.ofMillis(pullCooldownMillis),
                baseStrength,
                tickScale,
                winThreshold);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Shared pool behind every match mailbox and timer. A match never holds a
     * thread between events, so a handful of threads serve any number of matches.
     */
    @Bean(name = "matchScheduler")
    public ThreadPoolTaskScheduler matchScheduler(@Value("${tugochat.scheduler.pool-size:4}") int poolSize) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(poolSize);
        scheduler.setThreadNamePrefix("match-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }
}
