package br.edu.ifba.meetingrag.embedding;

import br.edu.ifba.meetingrag.utils.BackoffPolicy;
import br.edu.ifba.meetingrag.utils.RetryEventLogger;
import br.edu.ifba.meetingrag.utils.Sleeper;
import br.edu.ifba.meetingrag.utils.TokenUtil;
import org.jboss.logging.Logger;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Batching, retrying front of an {@link EmbeddingFunction}.
 *
 * <p>Texts are sent in batches of {@code batchSize}; at most {@code maxConcurrentBatches}
 * provider calls are in flight at once across all callers of this client. Each call
 * carries a timeout. Transient failures (timeouts, rate limits, network errors) are retried
 * following the {@link BackoffPolicy}. A permanent failure of a multi-text batch is
 * isolated by re-sending its texts one by one, so only the offending text fails.</p>
 *
 * <p>Results are reported per text as {@link EmbeddingOutcome}s in input order.</p>
 */
public class EmbeddingClient implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(EmbeddingClient.class);

    private final EmbeddingFunction function;
    private final EmbeddingSettings settings;
    private final BackoffPolicy backoffPolicy;
    private final Sleeper sleeper;
    private final RetryEventLogger retryLogger;
    private final ExecutorService batchExecutor;

    public EmbeddingClient(final EmbeddingFunction function, final EmbeddingSettings settings,
            final BackoffPolicy backoffPolicy) {
        this(function, settings, backoffPolicy, Sleeper.SYSTEM, new RetryEventLogger());
    }

    public EmbeddingClient(final EmbeddingFunction function, final EmbeddingSettings settings,
            final BackoffPolicy backoffPolicy, final Sleeper sleeper, final RetryEventLogger retryLogger) {
        this.function = function;
        this.settings = settings;
        this.backoffPolicy = backoffPolicy;
        this.sleeper = sleeper;
        this.retryLogger = retryLogger;

        final AtomicInteger threadCounter = new AtomicInteger();
        this.batchExecutor = Executors.newFixedThreadPool(settings.maxConcurrentBatches(), runnable -> {
            final Thread thread = new Thread(runnable, "embedding-batch-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    public String model() {
        return settings.model();
    }

    public int dimension() {
        return settings.dimension();
    }

    /**
     * Embeds {@code texts}, one outcome per text in input order.
     * Never throws for provider failures; they are reported on the affected outcomes.
     */
    public List<EmbeddingOutcome> embedBatch(@NotNull final List<String> texts) {
        if (texts.isEmpty()) {
            return List.of();
        }

        final EmbeddingOutcome[] outcomes = new EmbeddingOutcome[texts.size()];
        final List<Integer> pending = new ArrayList<>(texts.size());
        final List<String> prepared = new ArrayList<>(texts.size());
        for (int i = 0; i < texts.size(); i++) {
            final String text = texts.get(i);
            if (text == null || text.isBlank()) {
                outcomes[i] = EmbeddingOutcome.failure(i, EmbeddingException.permanent("Blank text cannot be embedded"));
                prepared.add(null);
                continue;
            }
            prepared.add(prepare(text));
            pending.add(Integer.valueOf(i));
        }

        final List<CompletableFuture<List<EmbeddingOutcome>>> batches = new ArrayList<>();
        for (int from = 0; from < pending.size(); from += settings.batchSize()) {
            final List<Integer> indices = List.copyOf(pending.subList(from, Math.min(pending.size(), from + settings.batchSize())));
            final List<String> batchTexts = indices.stream().map(index -> prepared.get(index.intValue())).toList();
            batches.add(CompletableFuture.supplyAsync(() -> runBatch(indices, batchTexts), batchExecutor));
        }

        for (final CompletableFuture<List<EmbeddingOutcome>> batch : batches) {
            for (final EmbeddingOutcome outcome : batch.join()) {
                outcomes[outcome.index()] = outcome;
            }
        }

        final long failed = Arrays.stream(outcomes).filter(outcome -> !outcome.isSuccess()).count();
        LOG.debugf("Embedded %d texts in %d batches, %d failed",
            Integer.valueOf(texts.size()), Integer.valueOf(batches.size()), Long.valueOf(failed));
        return List.of(outcomes);
    }

    /**
     * Embeds a single text.
     *
     * @throws EmbeddingException if the text could not be embedded
     */
    @NotNull
    public float[] embedOne(@NotNull final String text) {
        final EmbeddingOutcome outcome = embedBatch(List.of(text)).get(0);
        if (!outcome.isSuccess()) {
            throw outcome.error();
        }
        return outcome.vector();
    }

    private String prepare(final String text) {
        if (TokenUtil.estimateTokens(text) <= settings.maxInputTokens()) {
            return text;
        }
        LOG.debugf("Embedding input truncated to %d tokens", Integer.valueOf(settings.maxInputTokens()));
        return TokenUtil.headTokens(text, settings.maxInputTokens());
    }

    private List<EmbeddingOutcome> runBatch(final List<Integer> indices, final List<String> texts) {
        final String operation = "embed-batch[" + indices.get(0) + ".." + indices.get(indices.size() - 1) + "]";
        try {
            return toOutcomes(indices, callWithRetry(texts, operation));
        } catch (EmbeddingException e) {
            if (e.isTransient() || indices.size() == 1) {
                return failAll(indices, e);
            }
            LOG.warnf("Permanent failure for %s, isolating %d texts: %s",
                operation, Integer.valueOf(indices.size()), e.getMessage());
            final List<EmbeddingOutcome> isolated = new ArrayList<>(indices.size());
            for (int i = 0; i < indices.size(); i++) {
                final int index = indices.get(i).intValue();
                try {
                    isolated.addAll(toOutcomes(List.of(indices.get(i)),
                        callWithRetry(List.of(texts.get(i)), "embed-item[" + index + "]")));
                } catch (EmbeddingException itemFailure) {
                    isolated.add(EmbeddingOutcome.failure(index, itemFailure));
                }
            }
            return isolated;
        }
    }

    private List<float[]> callWithRetry(final List<String> texts, final String operation) {
        for (int attempt = 1; ; attempt++) {
            final CallResult result = attemptCall(texts, operation);
            if (result.vectors() != null) {
                retryLogger.logRetrySuccess(operation, attempt);
                return result.vectors();
            }
            final EmbeddingException failure = result.failure();
            if (!failure.isTransient()) {
                throw failure;
            }
            if (backoffPolicy.isExhausted(attempt)) {
                retryLogger.logRetryExhausted(operation, attempt, failure);
                throw failure;
            }
            retryLogger.logRetryAttempt(operation, attempt, backoffPolicy.maxAttempts(), failure);
            try {
                sleeper.sleep(backoffPolicy.delayAfter(attempt));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw EmbeddingException.transientFailure("Interrupted while backing off " + operation, e);
            }
        }
    }

    private CallResult attemptCall(final List<String> texts, final String operation) {
        Future<List<float[]>> future = null;
        try {
            future = function.embed(texts);
            final List<float[]> vectors = future.get(settings.callTimeout().toMillis(), TimeUnit.MILLISECONDS);
            if (vectors == null || vectors.size() != texts.size()) {
                return CallResult.failed(EmbeddingException.permanent(String.format(
                    "Expected %d vectors for %s but received %d",
                    texts.size(), operation, vectors == null ? 0 : vectors.size())));
            }
            return new CallResult(vectors, null);
        } catch (TimeoutException e) {
            future.cancel(true);
            return CallResult.failed(EmbeddingException.transientFailure(
                "Embedding call timed out after " + settings.callTimeout().toMillis() + " ms", e));
        } catch (ExecutionException e) {
            return CallResult.failed(classify(e.getCause()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return CallResult.failed(EmbeddingException.transientFailure("Interrupted while waiting for " + operation, e));
        } catch (RuntimeException e) {
            return CallResult.failed(classify(e));
        }
    }

    private static EmbeddingException classify(final Throwable failure) {
        Throwable current = failure;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        if (current instanceof EmbeddingException embeddingException) {
            return embeddingException;
        }
        final String message = current == null ? "unknown error" : current.getClass().getSimpleName() + ": " + current.getMessage();
        return EmbeddingException.transientFailure(message, current);
    }

    private List<EmbeddingOutcome> toOutcomes(final List<Integer> indices, final List<float[]> vectors) {
        final List<EmbeddingOutcome> outcomes = new ArrayList<>(indices.size());
        for (int i = 0; i < indices.size(); i++) {
            final int index = indices.get(i).intValue();
            final float[] vector = vectors.get(i);
            if (vector == null || vector.length != settings.dimension()) {
                final int received = vector == null ? 0 : vector.length;
                LOG.warnf("Embedding for input %d has dimension %d, model %s is configured for %d",
                    Integer.valueOf(index), Integer.valueOf(received), settings.model(),
                    Integer.valueOf(settings.dimension()));
                outcomes.add(EmbeddingOutcome.failure(index, EmbeddingException.permanent(String.format(
                    "Vector dimension %d does not match the configured %d", received, settings.dimension()))));
            } else {
                outcomes.add(EmbeddingOutcome.success(index, vector));
            }
        }
        return outcomes;
    }

    private static List<EmbeddingOutcome> failAll(final List<Integer> indices, final EmbeddingException failure) {
        final List<EmbeddingOutcome> outcomes = new ArrayList<>(indices.size());
        for (final Integer index : indices) {
            outcomes.add(EmbeddingOutcome.failure(index.intValue(), failure));
        }
        return outcomes;
    }

    @Override
    public void close() {
        batchExecutor.shutdownNow();
    }

    private record CallResult(List<float[]> vectors, EmbeddingException failure) {

        static CallResult failed(final EmbeddingException failure) {
            return new CallResult(null, failure);
        }
    }
}
