package com.example.estimations.model;

import java.util.List;
import java.util.Locale;

/** The two supported estimation decks. Card lists live in {@link CardDecks}. */
public enum DeckType {

    FIBONACCI("fibonacci", "Fibonacci"),
    TSHIRT("tshirt", "T-Shirt Sizes");

    private final String id;
    private final String displayName;

    DeckType(String id, String displayName) {
        this.id = id;
        this.displayName = displayName;
    }

    public String id() { return id; }

    public String displayName() { return displayName; }

    public List<String> cards() {
        return CardDecks.cards(this);
    }

    /**
     * Lenient lookup used by the web layer. Unknown or blank input falls back to
     * {@link #FIBONACCI}.
     */
    public static DeckType fromId(String raw) {
        if (raw == null) return FIBONACCI;
        String s = raw.trim().toLowerCase(Locale.ROOT);
        switch (s) {
            case "tshirt":
            case "t-shirt":
            case "shirt":
            case "shirt_size":
            case "shirtsize":
                return TSHIRT;
            default:
                return FIBONACCI;
        }
    }
}
