package br.edu.ifba.meetingrag.embedding;

import java.time.Duration;

/**
 * Tunables of the {@link EmbeddingClient}.
 *
 * @param model model identifier stored with every vector
 * @param dimension vector dimension; provider vectors of any other length fail permanently
 * @param batchSize texts per provider call
 * @param maxConcurrentBatches provider calls in flight at once
 * @param callTimeout timeout of a single provider call
 * @param maxInputTokens texts longer than this are cut to their head before embedding
 */
public record EmbeddingSettings(
    String model,
    int dimension,
    int batchSize,
    int maxConcurrentBatches,
    Duration callTimeout,
    int maxInputTokens
) {

    public EmbeddingSettings {
        if (model == null || model.isBlank()) {
            throw new IllegalArgumentException("model is required");
        }
        if (dimension <= 0 || batchSize <= 0 || maxConcurrentBatches <= 0 || maxInputTokens <= 0) {
            throw new IllegalArgumentException("dimension, batchSize, maxConcurrentBatches and maxInputTokens must be positive");
        }
        if (callTimeout == null || callTimeout.isNegative() || callTimeout.isZero()) {
            throw new IllegalArgumentException("callTimeout must be positive");
        }
    }

    public static EmbeddingSettings defaults() {
        return new EmbeddingSettings("text-embedding-3-small", 1536, 20, 2, Duration.ofSeconds(30), 8000);
    }
}
