package br.edu.ifba.meetingrag.embedding;

import org.jetbrains.annotations.NotNull;

public final class VectorMath {

    private VectorMath() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Computes cosine similarity between two embeddings.
     * Returns a value between -1 (opposite) and 1 (identical), and 0 when either
     * vector has zero magnitude.
     *
     * @throws IllegalArgumentException if the dimensions differ
     */
    public static double cosineSimilarity(@NotNull final float[] a, @NotNull final float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException(
                "Embeddings must have same dimensions: " + a.length + " vs " + b.length);
        }

        double dotProduct = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dotProduct += (double) a[i] * b[i];
            normA += (double) a[i] * a[i];
            normB += (double) b[i] * b[i];
        }

        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        final double similarity = dotProduct / Math.sqrt(normA * normB);
        return Math.max(-1.0, Math.min(1.0, similarity));
    }

    /**
     * Whether every component is a finite number.
     */
    public static boolean isFinite(@NotNull final float[] vector) {
        for (final float value : vector) {
            if (!Float.isFinite(value)) {
                return false;
            }
        }
        return true;
    }
}
