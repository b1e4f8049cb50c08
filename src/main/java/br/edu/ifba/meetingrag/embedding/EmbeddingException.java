package br.edu.ifba.meetingrag.embedding;

import org.jetbrains.annotations.Nullable;

/**
 * Failure of an embedding call, classified as transient (retry) or permanent (fail now).
 */
public class EmbeddingException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final boolean transientFailure;
    private final Integer status;

    public EmbeddingException(final String message, final boolean transientFailure,
            @Nullable final Integer status, @Nullable final Throwable cause) {
        super(message, cause);
        this.transientFailure = transientFailure;
        this.status = status;
    }

    public static EmbeddingException transientFailure(final String message, @Nullable final Throwable cause) {
        return new EmbeddingException(message, true, null, cause);
    }

    public static EmbeddingException permanent(final String message) {
        return new EmbeddingException(message, false, null, null);
    }

    public static EmbeddingException forStatus(final int status, final String message, @Nullable final Throwable cause) {
        final boolean retryable = status == 408 || status == 429 || status >= 500;
        return new EmbeddingException(message, retryable, Integer.valueOf(status), cause);
    }

    public boolean isTransient() {
        return transientFailure;
    }

    /**
     * HTTP status of the provider response, when there was one.
     */
    @Nullable
    public Integer status() {
        return status;
    }
}
