package br.edu.ifba.meetingrag.extraction;

import java.util.HashSet;
import java.util.Set;

/**
 * String and set similarity measures shared by entity deduplication and chunk linking.
 */
public final class TextSimilarity {

    private TextSimilarity() {
    }

    /**
     * Normalized Levenshtein similarity: {@code 1 - distance / max(len)}; 1.0 for two empty strings.
     */
    public static double levenshtein(final String a, final String b) {
        final int longest = Math.max(a.length(), b.length());
        if (longest == 0) {
            return 1.0;
        }
        return 1.0 - (double) distance(a, b) / longest;
    }

    /**
     * Jaccard index of two sets; 0 when both are empty.
     */
    public static <T> double jaccard(final Set<T> a, final Set<T> b) {
        if (a.isEmpty() && b.isEmpty()) {
            return 0.0;
        }
        final Set<T> intersection = new HashSet<>(a);
        intersection.retainAll(b);
        final Set<T> union = new HashSet<>(a);
        union.addAll(b);
        return (double) intersection.size() / union.size();
    }

    private static int distance(final String a, final String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                final int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            final int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }
}
