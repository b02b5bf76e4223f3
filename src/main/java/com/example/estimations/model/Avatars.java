package com.example.estimations.model;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.*;

/**
 * Fixed pool of robot avatars (Dicebear "bottts" presets).
 * Allocation bookkeeping lives in {@link Game}; this class only describes the pool.
 */
public final class Avatars {

    private Avatars() {}

    public static final int POOL_SIZE = 7;

    private static final String DICEBEAR_BASE = "https://api.dicebear.com/9.x/bottts/svg";

    /** One avatar preset. */
    public static record Avatar(int id, String name, String color,
                                String eyes, String mouth, String sides, String top) { }

    private static final Map<Integer, Avatar> PRESETS;

    static {
        LinkedHashMap<Integer, Avatar> m = new LinkedHashMap<>();
        put(m, new Avatar(1, "Sunny",  "ffb300", "happy",   "smile01",  "antenna01",        "bulb01"));
        put(m, new Avatar(2, "Ocean",  "1e88e5", "eva",     "square01", "cables01",         "radar"));
        put(m, new Avatar(3, "Forest", "43a047", "glow",    "grill01",  "round",            "horns"));
        put(m, new Avatar(4, "Sunset", "f4511e", "bulging", "bite",     "squareAssymetric", "antenna"));
        put(m, new Avatar(5, "Royal",  "8e24aa", "hearts",  "smile02",  "square",           "pyramid"));
        put(m, new Avatar(6, "Steel",  "546e7a", "robocop", "diagram",  "antenna02",        "lights"));
        put(m, new Avatar(7, "Ruby",   "e53935", "sensor",  "grill02",  "cables02",         "glowingBulb01"));
        PRESETS = Collections.unmodifiableMap(m);
    }

    private static void put(Map<Integer, Avatar> m, Avatar a) {
        m.put(a.id(), a);
    }

    /** All ids in ascending order. */
    public static List<Integer> allIds() {
        return List.copyOf(PRESETS.keySet());
    }

    public static List<Avatar> all() {
        return List.copyOf(PRESETS.values());
    }

    public static Optional<Avatar> get(Integer id) {
        if (id == null) return Optional.empty();
        return Optional.ofNullable(PRESETS.get(id));
    }

    public static boolean isValid(Integer id) {
        return id != null && PRESETS.containsKey(id);
    }

    /** Render URL for the given avatar, empty for unknown ids. */
    public static Optional<String> url(Integer id) {
        return get(id).map(a -> DICEBEAR_BASE
                + "?baseColor=" + enc(a.color())
                + "&eyes=" + enc(a.eyes())
                + "&mouth=" + enc(a.mouth())
                + "&sides=" + enc(a.sides())
                + "&top=" + enc(a.top()));
    }

    private static String enc(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }
}
