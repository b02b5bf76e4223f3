package com.example.estimations.model;

/** Expected, recoverable failures returned to callers inside an {@link Outcome}. */
public enum GameError {
    /** Game id does not resolve to a live game server. */
    NOT_FOUND,
    /** Card is not part of the game's deck. */
    INVALID_CARD,
    /** Vote attempted after the cards were revealed. */
    ALREADY_REVEALED,
    /** Avatar id is outside the pool or held by someone else. */
    AVATAR_UNAVAILABLE
}
