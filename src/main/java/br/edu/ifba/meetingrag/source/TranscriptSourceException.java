package br.edu.ifba.meetingrag.source;

/**
 * Failure talking to the transcript source.
 */
public class TranscriptSourceException extends RuntimeException {

    private final boolean transientFailure;

    public TranscriptSourceException(String message, boolean transientFailure, Throwable cause) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    public TranscriptSourceException(String message, boolean transientFailure) {
        this(message, transientFailure, null);
    }

    /**
     * Whether a later attempt may succeed (network failure, rate limit, server error).
     */
    public boolean isTransient() {
        return transientFailure;
    }
}
