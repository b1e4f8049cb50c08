package br.edu.ifba.meetingrag.search;

/**
 * Tuning of {@link SimilaritySearchService}.
 *
 * @param semanticEnabled when false every search runs in text mode
 * @param relevanceThreshold minimum cosine similarity of a semantic result
 * @param overFetchMultiplier candidates fetched per requested result
 * @param maxLimit upper bound on the requested result count
 * @param contextWindowSeconds how far around a timed chunk neighbours are considered context
 * @param contextTokens token budget of each context snippet
 */
public record SearchSettings(
    boolean semanticEnabled,
    double relevanceThreshold,
    int overFetchMultiplier,
    int maxLimit,
    int contextWindowSeconds,
    int contextTokens
) {

    public SearchSettings {
        if (relevanceThreshold < -1.0 || relevanceThreshold > 1.0) {
            throw new IllegalArgumentException("relevanceThreshold must be within [-1, 1], got " + relevanceThreshold);
        }
        if (overFetchMultiplier < 1) {
            throw new IllegalArgumentException("overFetchMultiplier must be at least 1, got " + overFetchMultiplier);
        }
        if (maxLimit < 1) {
            throw new IllegalArgumentException("maxLimit must be at least 1, got " + maxLimit);
        }
        if (contextWindowSeconds < 0 || contextTokens < 0) {
            throw new IllegalArgumentException("context window and tokens must be non-negative");
        }
    }

    public static SearchSettings defaults() {
        return new SearchSettings(true, 0.7, 3, 50, 30, 150);
    }
}
