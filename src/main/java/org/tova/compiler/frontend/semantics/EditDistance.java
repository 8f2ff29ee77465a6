package org.tova.compiler.frontend.semantics;

import java.util.Collection;
import java.util.Optional;

/**
 * Bounded Levenshtein matching for "did you mean" hints.
 */
public final class EditDistance {

    private EditDistance() {}

    /**
     * @param a First string.
     * @param b Second string.
     * @return The Levenshtein distance between the two.
     */
    public static int levenshtein(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) previous[j] = j;
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }

    /**
     * @param name The misspelled name.
     * @return The largest distance still worth suggesting: {@code max(2, floor(0.4 * length))}.
     */
    public static int maxDistance(String name) {
        return Math.max(2, (int) Math.floor(name.length() * 0.4));
    }

    /**
     * Finds the closest candidate, comparing case-insensitively. A candidate differing only in case
     * has distance 0 and wins.
     * @param name The misspelled name.
     * @param candidates The names in scope.
     * @return The best candidate within {@link #maxDistance(String)}, ties resolved by candidate order.
     */
    public static Optional<String> closest(String name, Collection<String> candidates) {
        int limit = maxDistance(name);
        String lower = name.toLowerCase();
        String best = null;
        int bestDistance = Integer.MAX_VALUE;
        for (String candidate : candidates) {
            if (candidate.equals(name)) continue;
            if (Math.abs(candidate.length() - name.length()) > limit) continue;
            int d = levenshtein(lower, candidate.toLowerCase());
            if (d <= limit && d < bestDistance) {
                best = candidate;
                bestDistance = d;
            }
        }
        return Optional.ofNullable(best);
    }
}
