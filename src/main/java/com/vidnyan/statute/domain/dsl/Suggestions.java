package com.vidnyan.statute.domain.dsl;

import java.util.Collection;
import java.util.Locale;
import java.util.Optional;

/**
 * "Did you mean" lookup by edit distance.
 */
final class Suggestions {

    static final int MAX_DISTANCE = 2;

    private Suggestions() {}

    /**
     * Closest candidate within {@link #MAX_DISTANCE} edits, compared case-insensitively.
     * Ties go to the first candidate.
     */
    static Optional<String> closest(String word, Collection<String> candidates) {
        String best = null;
        int bestDistance = MAX_DISTANCE + 1;
        String needle = word.toUpperCase(Locale.ROOT);
        for (String candidate : candidates) {
            int distance = levenshtein(needle, candidate.toUpperCase(Locale.ROOT));
            if (distance < bestDistance && distance > 0) {
                best = candidate;
                bestDistance = distance;
            } else if (distance == 0 && !word.equals(candidate)) {
                // same letters, wrong case
                return Optional.of(candidate);
            }
        }
        return Optional.ofNullable(best);
    }

    static int levenshtein(String a, String b) {
        int[] prev = new int[b.length() + 1];
        int[] curr = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            prev[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            curr[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                curr[j] = Math.min(Math.min(curr[j - 1] + 1, prev[j] + 1), prev[j - 1] + cost);
            }
            int[] tmp = prev;
            prev = curr;
            curr = tmp;
        }
        return prev[b.length()];
    }
}
