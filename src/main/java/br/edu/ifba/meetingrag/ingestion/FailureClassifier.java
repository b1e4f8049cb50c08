package br.edu.ifba.meetingrag.ingestion;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

import br.edu.ifba.meetingrag.embedding.EmbeddingException;
import br.edu.ifba.meetingrag.source.TranscriptSourceException;
import br.edu.ifba.meetingrag.storage.impl.SQLiteDatabaseLockedException;
import br.edu.ifba.meetingrag.utils.TransientSQLExceptionPredicate;

/**
 * Maps a processing failure to a {@link FailureKind}.
 *
 * <p>Exceptions carrying their own transient flag decide for themselves. Timeouts, I/O
 * errors and lock contention are transient. Argument errors are permanent. Anything else
 * is treated as transient, so unexpected failures are retried a bounded number of times.</p>
 */
public class FailureClassifier {

    private final TransientSQLExceptionPredicate transientSql = new TransientSQLExceptionPredicate();

    public FailureKind classify(Throwable failure) {
        Throwable cause = unwrap(failure);
        if (cause instanceof DataIntegrityException) {
            return FailureKind.DATA_INTEGRITY;
        }
        if (cause instanceof EmbeddingException embeddingException) {
            return embeddingException.isTransient() ? FailureKind.TRANSIENT : FailureKind.PERMANENT;
        }
        if (cause instanceof TranscriptSourceException sourceException) {
            return sourceException.isTransient() ? FailureKind.TRANSIENT : FailureKind.PERMANENT;
        }
        if (cause instanceof SQLiteDatabaseLockedException
                || cause instanceof TimeoutException
                || cause instanceof IOException
                || cause instanceof UncheckedIOException
                || transientSql.test(cause)) {
            return FailureKind.TRANSIENT;
        }
        if (cause instanceof IllegalArgumentException) {
            return FailureKind.PERMANENT;
        }
        return FailureKind.TRANSIENT;
    }

    /**
     * Human-readable description stored as the task's last error.
     */
    public String describe(Throwable failure) {
        Throwable cause = unwrap(failure);
        String message = cause.getMessage();
        return cause.getClass().getSimpleName() + (message == null ? "" : ": " + message);
    }

    static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
