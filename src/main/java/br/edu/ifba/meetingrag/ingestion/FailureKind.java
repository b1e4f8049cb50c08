package br.edu.ifba.meetingrag.ingestion;

/**
 * How a failed processing attempt is handled.
 */
public enum FailureKind {
    /** Retried with backoff until the attempt ceiling. */
    TRANSIENT,
    /** Failed immediately; retrying cannot succeed. */
    PERMANENT,
    /** A referenced document or blob is missing; failed immediately. */
    DATA_INTEGRITY
}
