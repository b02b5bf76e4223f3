package com.example.estimations.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Change notification published after a game server commits a mutation.
 * Only the fields relevant to {@link #type()} are set; the rest are null.
 */
public record GameEvent(
        String gameId,
        Type type,
        String participantId,
        Participant participant,
        Game game,
        String storyName,
        Instant occurredAt
) {

    public enum Type {
        PARTICIPANT_JOINED,
        PARTICIPANT_LEFT,
        PARTICIPANT_CONNECTED,
        PARTICIPANT_DISCONNECTED,
        VOTE_CAST,
        VOTES_REVEALED,
        ROUND_RESET,
        ROLE_TOGGLED,
        STORY_CHANGED
    }

    public GameEvent {
        Objects.requireNonNull(gameId, "gameId");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(occurredAt, "occurredAt");
    }

    public static GameEvent participantJoined(String gameId, Participant p, Instant at) {
        return new GameEvent(gameId, Type.PARTICIPANT_JOINED, p.getId(), p, null, null, at);
    }

    public static GameEvent participantLeft(String gameId, String participantId, Instant at) {
        return new GameEvent(gameId, Type.PARTICIPANT_LEFT, participantId, null, null, null, at);
    }

    public static GameEvent connectivityChanged(String gameId, String participantId, boolean connected, Instant at) {
        Type t = connected ? Type.PARTICIPANT_CONNECTED : Type.PARTICIPANT_DISCONNECTED;
        return new GameEvent(gameId, t, participantId, null, null, null, at);
    }

    public static GameEvent voteCast(String gameId, String participantId, Instant at) {
        return new GameEvent(gameId, Type.VOTE_CAST, participantId, null, null, null, at);
    }

    public static GameEvent votesRevealed(Game game, Instant at) {
        return new GameEvent(game.getId(), Type.VOTES_REVEALED, null, null, game, null, at);
    }

    public static GameEvent roundReset(Game game, Instant at) {
        return new GameEvent(game.getId(), Type.ROUND_RESET, null, null, game, null, at);
    }

    public static GameEvent roleToggled(String gameId, String participantId, Instant at) {
        return new GameEvent(gameId, Type.ROLE_TOGGLED, participantId, null, null, null, at);
    }

    public static GameEvent storyChanged(String gameId, String storyName, Instant at) {
        return new GameEvent(gameId, Type.STORY_CHANGED, null, null, null, storyName, at);
    }
}
