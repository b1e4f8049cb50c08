package br.edu.ifba.meetingrag.ingestion;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.sql.SQLTransientConnectionException;
import java.time.Duration;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import org.junit.jupiter.api.Test;

import br.edu.ifba.meetingrag.embedding.EmbeddingException;
import br.edu.ifba.meetingrag.source.TranscriptSourceException;
import br.edu.ifba.meetingrag.storage.impl.SQLiteDatabaseLockedException;

class FailureClassifierTest {

    private final FailureClassifier classifier = new FailureClassifier();

    @Test
    void missingDataIsAnIntegrityFailure() {
        assertEquals(FailureKind.DATA_INTEGRITY, classifier.classify(new DataIntegrityException("gone")));
    }

    @Test
    void embeddingFailuresFollowTheirStatus() {
        assertEquals(FailureKind.TRANSIENT, classifier.classify(EmbeddingException.forStatus(429, "slow down", null)));
        assertEquals(FailureKind.TRANSIENT, classifier.classify(EmbeddingException.forStatus(502, "bad gateway", null)));
        assertEquals(FailureKind.PERMANENT, classifier.classify(EmbeddingException.forStatus(401, "unauthorized", null)));
    }

    @Test
    void sourceFailuresFollowTheirFlag() {
        assertEquals(FailureKind.TRANSIENT, classifier.classify(new TranscriptSourceException("down", true)));
        assertEquals(FailureKind.PERMANENT, classifier.classify(new TranscriptSourceException("bad query", false)));
    }

    @Test
    void infrastructureFailuresAreTransient() {
        assertEquals(FailureKind.TRANSIENT, classifier.classify(
            new SQLiteDatabaseLockedException("claim", Duration.ofSeconds(5), null)));
        assertEquals(FailureKind.TRANSIENT, classifier.classify(
            new UncheckedIOException(new IOException("disk"))));
        assertEquals(FailureKind.TRANSIENT, classifier.classify(
            new RuntimeException(new SQLTransientConnectionException("reset"))));
    }

    @Test
    void argumentErrorsArePermanent() {
        assertEquals(FailureKind.PERMANENT, classifier.classify(new IllegalArgumentException("bad id")));
    }

    @Test
    void unexpectedFailuresAreRetried() {
        assertEquals(FailureKind.TRANSIENT, classifier.classify(new IllegalStateException("surprise")));
    }

    @Test
    void unwrapsAsyncWrappers() {
        Throwable wrapped = new CompletionException(new ExecutionException(new DataIntegrityException("gone")));

        assertEquals(FailureKind.DATA_INTEGRITY, classifier.classify(wrapped));
        assertEquals("DataIntegrityException: gone", classifier.describe(wrapped));
    }

    @Test
    void describesExceptionsWithoutMessage() {
        assertEquals("IllegalStateException", classifier.describe(new IllegalStateException()));
    }
}
