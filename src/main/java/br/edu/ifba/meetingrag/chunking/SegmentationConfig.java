package br.edu.ifba.meetingrag.chunking;

/**
 * Token budgets and strategy settings for the {@link Segmenter}.
 *
 * @param targetTokens size at which a chunk is closed when the next piece would grow it further
 * @param minTokens smallest chunk except the last one of a strategy
 * @param maxTokens hard upper bound
 * @param overlapTokens tail of the previous chunk repeated at the start of the next one when a budget split happens
 * @param strategy strategy selector
 * @param timeWindowSeconds time-window length
 * @param timeOverlapSeconds overlap between consecutive time windows
 * @param adaptiveWindows whether window length follows the transcript duration
 * @param topicSimilarityThreshold minimum topic Jaccard index for a topic-similarity edge
 */
public record SegmentationConfig(
    int targetTokens,
    int minTokens,
    int maxTokens,
    int overlapTokens,
    SegmentationStrategy strategy,
    int timeWindowSeconds,
    int timeOverlapSeconds,
    boolean adaptiveWindows,
    double topicSimilarityThreshold
) {

    private static final int MIN_BUDGET_SPREAD = 16;

    public SegmentationConfig {
        if (minTokens < 1 || minTokens > targetTokens || targetTokens > maxTokens) {
            throw new IllegalArgumentException(String.format(
                "Token budgets must satisfy 1 <= min (%d) <= target (%d) <= max (%d)",
                minTokens, targetTokens, maxTokens));
        }
        if (maxTokens - minTokens < MIN_BUDGET_SPREAD) {
            throw new IllegalArgumentException("maxTokens must exceed minTokens by at least " + MIN_BUDGET_SPREAD);
        }
        if (overlapTokens < 0 || overlapTokens >= targetTokens) {
            throw new IllegalArgumentException("overlapTokens must be within [0, targetTokens), got " + overlapTokens);
        }
        if (strategy == null) {
            throw new IllegalArgumentException("strategy is required");
        }
        if (timeWindowSeconds <= 0 || timeOverlapSeconds < 0 || timeOverlapSeconds >= timeWindowSeconds) {
            throw new IllegalArgumentException(String.format(
                "Time windows must satisfy 0 <= overlap (%d) < window (%d)", timeOverlapSeconds, timeWindowSeconds));
        }
        if (topicSimilarityThreshold <= 0.0 || topicSimilarityThreshold > 1.0) {
            throw new IllegalArgumentException("topicSimilarityThreshold must be within (0, 1]");
        }
    }

    public static SegmentationConfig defaults() {
        return new SegmentationConfig(1000, 100, 1500, 200, SegmentationStrategy.AUTO, 300, 30, true, 0.7);
    }

    public SegmentationConfig withStrategy(final SegmentationStrategy newStrategy) {
        return new SegmentationConfig(targetTokens, minTokens, maxTokens, overlapTokens, newStrategy,
            timeWindowSeconds, timeOverlapSeconds, adaptiveWindows, topicSimilarityThreshold);
    }

    public SegmentationConfig withTimeWindow(final int windowSeconds, final int overlapSeconds) {
        return new SegmentationConfig(targetTokens, minTokens, maxTokens, overlapTokens, strategy,
            windowSeconds, overlapSeconds, adaptiveWindows, topicSimilarityThreshold);
    }

    /**
     * Window preset for a transcript of the given length: short meetings get
     * finer windows, long ones coarser windows. Returns this config unchanged when
     * adaptive windows are disabled.
     */
    public SegmentationConfig forDuration(final int durationSeconds) {
        if (!adaptiveWindows || durationSeconds <= 0) {
            return this;
        }
        if (durationSeconds < 1800) {
            return withTimeWindow(180, 20);
        }
        if (durationSeconds <= 3600) {
            return withTimeWindow(300, 30);
        }
        return withTimeWindow(600, 60);
    }

    /**
     * Largest atomic piece the packer accepts; larger lines are split first.
     */
    int pieceLimit() {
        return Math.max(1, (maxTokens - minTokens) / 2);
    }
}
