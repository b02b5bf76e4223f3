package com.example.estimations.config;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Game server tuning, bound from {@code app.games.*}.
 *
 * @param idleCheckInterval   how often each game checks whether it is idle
 * @param emptyGameTimeout    how long a game may stay empty before it is reclaimed
 * @param workerThreads       size of the shared pool running game mailboxes
 * @param restartCrashedGames start a fresh game under the same id after a crash
 */
@Validated
@ConfigurationProperties(prefix = "app.games")
public record GamesProperties(
        @DefaultValue("1m") @NotNull Duration idleCheckInterval,
        @DefaultValue("5m") @NotNull Duration emptyGameTimeout,
        @DefaultValue("4") @Positive int workerThreads,
        @DefaultValue("true") boolean restartCrashedGames
) {

    public static GamesProperties defaults() {
        return new GamesProperties(Duration.ofMinutes(1), Duration.ofMinutes(5), 4, true);
    }
}
