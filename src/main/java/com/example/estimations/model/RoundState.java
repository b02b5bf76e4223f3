package com.example.estimations.model;

/** Votes are hidden while {@code VOTING} and frozen once {@code REVEALED}. */
public enum RoundState {
    VOTING,
    REVEALED
}
