package br.edu.ifba.meetingrag.embedding;

import org.jetbrains.annotations.Nullable;

/**
 * Per-item result of {@link EmbeddingClient#embedBatch}: a vector or the error for that text.
 *
 * @param index position of the text in the request
 */
public record EmbeddingOutcome(int index, @Nullable float[] vector, @Nullable EmbeddingException error) {

    public EmbeddingOutcome {
        if ((vector == null) == (error == null)) {
            throw new IllegalArgumentException("Exactly one of vector and error must be set");
        }
    }

    public static EmbeddingOutcome success(final int index, final float[] vector) {
        return new EmbeddingOutcome(index, vector, null);
    }

    public static EmbeddingOutcome failure(final int index, final EmbeddingException error) {
        return new EmbeddingOutcome(index, null, error);
    }

    public boolean isSuccess() {
        return vector != null;
    }
}
