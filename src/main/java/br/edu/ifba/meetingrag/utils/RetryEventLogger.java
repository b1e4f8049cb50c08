package br.edu.ifba.meetingrag.utils;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Structured logging of retries for embedding calls and queued tasks.
 *
 * <p>Every event is logged with the following MDC keys set, and removed again afterwards:</p>
 * <ul>
 *   <li><code>retry.operation</code> - e.g. {@code embed-batch[0..19]} or {@code vectorize[doc-id]}</li>
 *   <li><code>retry.attempt</code> - attempt number (1-based)</li>
 *   <li><code>retry.exception</code> - simple name of the root failure, unwrapped from async wrappers</li>
 *   <li><code>retry.outcome</code> - {@code retrying}, {@code exhausted} or {@code recovered}</li>
 * </ul>
 *
 * <pre>
 * INFO  [RetryEventLogger] Retry attempt 2/3 for embed-batch[0..19]: EmbeddingException - HTTP 429
 * WARN  [RetryEventLogger] Retry exhausted for vectorize[0190f...] after 3 attempts: BlobFetchException - ...
 * INFO  [RetryEventLogger] vectorize[0190f...] recovered on attempt 2
 * </pre>
 */
public class RetryEventLogger {

    private static final Logger logger = LoggerFactory.getLogger(RetryEventLogger.class);

    static final String MDC_OPERATION = "retry.operation";
    static final String MDC_ATTEMPT = "retry.attempt";
    static final String MDC_EXCEPTION = "retry.exception";
    static final String MDC_OUTCOME = "retry.outcome";

    private static final int MAX_MESSAGE_LENGTH = 200;

    /**
     * A failed attempt that will be retried.
     *
     * @param attempt the attempt that just failed (1-based)
     * @param failure may be null
     */
    public void logRetryAttempt(final String operation, final int attempt, final int maxAttempts, final Throwable failure) {
        final Throwable root = unwrap(failure);
        withContext(operation, attempt, root, "retrying", () -> logger.info("Retry attempt {}/{} for {}: {} - {}",
            attempt, maxAttempts, operation, exceptionName(root), truncateMessage(messageOf(root))));
    }

    /**
     * The final failed attempt; the operation is given up.
     */
    public void logRetryExhausted(final String operation, final int totalAttempts, final Throwable failure) {
        final Throwable root = unwrap(failure);
        withContext(operation, totalAttempts, root, "exhausted", () -> logger.warn(
            "Retry exhausted for {} after {} attempts: {} - {}",
            operation, totalAttempts, exceptionName(root), truncateMessage(messageOf(root))));
    }

    /**
     * An operation that succeeded after failing before. First-attempt successes are not logged.
     */
    public void logRetrySuccess(final String operation, final int totalAttempts) {
        if (totalAttempts <= 1) {
            return;
        }
        withContext(operation, totalAttempts, null, "recovered",
            () -> logger.info("{} recovered on attempt {}", operation, totalAttempts));
    }

    private static void withContext(final String operation, final int attempt, final Throwable root,
            final String outcome, final Runnable log) {
        try {
            MDC.put(MDC_OPERATION, operation);
            MDC.put(MDC_ATTEMPT, String.valueOf(attempt));
            if (root != null) {
                MDC.put(MDC_EXCEPTION, root.getClass().getSimpleName());
            }
            MDC.put(MDC_OUTCOME, outcome);
            log.run();
        } finally {
            MDC.remove(MDC_OPERATION);
            MDC.remove(MDC_ATTEMPT);
            MDC.remove(MDC_EXCEPTION);
            MDC.remove(MDC_OUTCOME);
        }
    }

    private static Throwable unwrap(final Throwable failure) {
        Throwable current = failure;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String exceptionName(final Throwable root) {
        return root != null ? root.getClass().getSimpleName() : "unknown";
    }

    private static String messageOf(final Throwable root) {
        return root != null ? root.getMessage() : "no message";
    }

    String truncateMessage(final String message) {
        if (message == null) {
            return "null";
        }
        return message.length() <= MAX_MESSAGE_LENGTH ? message : message.substring(0, MAX_MESSAGE_LENGTH) + "...";
    }
}
