package com.example.EV_Charging_Platform.normalization;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Token-set similarity for station names. Brand and generic charging words are dropped
 * so "ChargePoint Station - Downtown" and "Downtown EVgo" compare on "downtown".
 */
final class NameSimilarity {

    private static final Set<String> NOISE = Set.of(
            "chargepoint", "evgo", "electrify", "america", "ea", "tesla", "supercharger",
            "station", "stations", "charging", "charger", "chargers", "ev", "fast", "dc",
            "hub", "the", "at", "of", "and");

    private NameSimilarity() {}

    static double score(String first, String second) {
        if (first == null || second == null) {
            return 0.0;
        }
        Set<String> a = tokens(first);
        Set<String> b = tokens(second);
        if (a.isEmpty() || b.isEmpty()) {
            // nothing distinctive left, fall back to comparing the full normalized text
            return normalize(first).equals(normalize(second)) ? 1.0 : 0.0;
        }
        Set<String> intersection = new HashSet<>(a);
        intersection.retainAll(b);
        Set<String> union = new HashSet<>(a);
        union.addAll(b);
        return (double) intersection.size() / union.size();
    }

    static Set<String> tokens(String name) {
        return Arrays.stream(normalize(name).split(" "))
                .filter(token -> !token.isEmpty())
                .filter(token -> !NOISE.contains(token))
                .collect(Collectors.toSet());
    }

    private static String normalize(String name) {
        return name.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", " ").trim();
    }
}
