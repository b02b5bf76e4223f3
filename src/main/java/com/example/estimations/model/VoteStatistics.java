package com.example.estimations.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Derived round statistics.
 *
 * @param average      mean of numeric votes rounded to one decimal; empty without numeric votes
 * @param distribution card → count, numeric cards ascending, special and size cards after them
 */
public record VoteStatistics(OptionalDouble average, Map<String, Integer> distribution) {

    public VoteStatistics {
        average = (average == null) ? OptionalDouble.empty() : average;
        distribution = Collections.unmodifiableMap(
                new LinkedHashMap<>(distribution == null ? Map.of() : distribution));
    }

    public static VoteStatistics empty() {
        return new VoteStatistics(OptionalDouble.empty(), Map.of());
    }

    public int totalVotes() {
        int n = 0;
        for (int c : distribution.values()) n += c;
        return n;
    }
}
