package com.example.estimations.model;

import java.util.Locale;

/** Voters estimate; spectators watch (e.g. the product owner). */
public enum Role {
    VOTER,
    SPECTATOR;

    public Role toggled() {
        return this == VOTER ? SPECTATOR : VOTER;
    }

    /** Lenient parse for the web layer; anything but "spectator" is a voter. */
    public static Role parse(String raw) {
        if (raw == null) return VOTER;
        return "spectator".equals(raw.trim().toLowerCase(Locale.ROOT)) ? SPECTATOR : VOTER;
    }
}
