package com.example.estimations.model;

import java.util.*;

/**
 * Card lists for each {@link DeckType}, special cards, and numeric values used for averages.
 */
public final class CardDecks {

    private CardDecks() {}

    // ---------------------------------------------------------------------
    // Special cards
    // ---------------------------------------------------------------------

    /** Too large to estimate. */
    public static final String UNBOUNDED = "∞";
    public static final String UNSURE    = "?";
    /** Needs a break. */
    public static final String BREAK     = "coffee";
    public static final String BLOCKER   = "bug";

    /** Specials in the order they are appended to every deck. */
    public static final List<String> SPECIALS = List.of(UNBOUNDED, UNSURE, BREAK, BLOCKER);

    private static final Set<String> SPECIALS_SET = Set.copyOf(SPECIALS);

    // ---------------------------------------------------------------------
    // Decks
    // ---------------------------------------------------------------------

    private static final List<String> FIBONACCI_VALUES =
            List.of("0", "1", "2", "3", "5", "8", "13", "21", "34");

    private static final List<String> TSHIRT_VALUES =
            List.of("XS", "S", "M", "L", "XL", "XXL");

    private static final Map<DeckType, List<String>> DECKS;

    /** Card label → numeric value. Only Fibonacci labels are numeric. */
    private static final Map<String, Integer> NUMERIC;

    static {
        EnumMap<DeckType, List<String>> decks = new EnumMap<>(DeckType.class);
        decks.put(DeckType.FIBONACCI, withSpecials(FIBONACCI_VALUES));
        decks.put(DeckType.TSHIRT, withSpecials(TSHIRT_VALUES));
        DECKS = Collections.unmodifiableMap(decks);

        Map<String, Integer> numeric = new HashMap<>();
        for (String v : FIBONACCI_VALUES) {
            numeric.put(v, Integer.parseInt(v));
        }
        NUMERIC = Collections.unmodifiableMap(numeric);
    }

    private static List<String> withSpecials(List<String> base) {
        List<String> out = new ArrayList<>(base.size() + SPECIALS.size());
        out.addAll(base);
        out.addAll(SPECIALS);
        return List.copyOf(out);
    }

    /** Ordered card list of the given deck. */
    public static List<String> cards(DeckType deck) {
        return DECKS.get(Objects.requireNonNull(deck, "deck"));
    }

    public static boolean isValidCard(DeckType deck, String card) {
        return card != null && cards(deck).contains(card);
    }

    /** Numeric value of a card, empty for specials and size labels. */
    public static OptionalInt numericValue(String card) {
        if (card == null) return OptionalInt.empty();
        Integer v = NUMERIC.get(card);
        return (v == null) ? OptionalInt.empty() : OptionalInt.of(v);
    }

    public static boolean isNumeric(String card) {
        return numericValue(card).isPresent();
    }

    public static boolean isSpecial(String card) {
        return card != null && SPECIALS_SET.contains(card);
    }

    /**
     * Sort order for distributions: numeric cards ascending by value, everything else
     * after them in deck order.
     */
    public static Comparator<String> distributionOrder(DeckType deck) {
        List<String> deckCards = cards(deck);
        return Comparator
                .comparingInt((String c) -> numericValue(c).isPresent() ? 0 : 1)
                .thenComparingInt(c -> numericValue(c).orElse(0))
                .thenComparingInt(c -> {
                    int i = deckCards.indexOf(c);
                    return i < 0 ? Integer.MAX_VALUE : i;
                });
    }
}
