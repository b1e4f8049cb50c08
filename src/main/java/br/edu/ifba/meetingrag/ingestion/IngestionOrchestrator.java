package br.edu.ifba.meetingrag.ingestion;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import org.jboss.logging.Logger;
import org.jetbrains.annotations.Nullable;

import br.edu.ifba.meetingrag.chunking.Chunk;
import br.edu.ifba.meetingrag.chunking.SegmentationConfig;
import br.edu.ifba.meetingrag.chunking.SegmentationResult;
import br.edu.ifba.meetingrag.chunking.Segmenter;
import br.edu.ifba.meetingrag.embedding.EmbeddingClient;
import br.edu.ifba.meetingrag.embedding.EmbeddingException;
import br.edu.ifba.meetingrag.embedding.EmbeddingOutcome;
import br.edu.ifba.meetingrag.queue.ProcessingTask;
import br.edu.ifba.meetingrag.queue.TaskQueue;
import br.edu.ifba.meetingrag.queue.TaskStatus;
import br.edu.ifba.meetingrag.queue.TaskType;
import br.edu.ifba.meetingrag.source.SourceTranscript;
import br.edu.ifba.meetingrag.source.TranscriptSourceException;
import br.edu.ifba.meetingrag.storage.BlobStore;
import br.edu.ifba.meetingrag.storage.ChunkStore;
import br.edu.ifba.meetingrag.storage.Document;
import br.edu.ifba.meetingrag.storage.DocumentState;
import br.edu.ifba.meetingrag.storage.DocumentStore;
import br.edu.ifba.meetingrag.storage.WebhookEventLog;
import br.edu.ifba.meetingrag.storage.WebhookEventStatus;
import br.edu.ifba.meetingrag.utils.BackoffPolicy;
import br.edu.ifba.meetingrag.utils.RetryEventLogger;
import br.edu.ifba.meetingrag.utils.TokenUtil;

/**
 * Drives documents through {@code fetch -> segment -> embed -> persist} via the task queue.
 *
 * <p>Entry points are scheduled sync ({@link #sync(SyncOptions)}), webhooks
 * ({@link #handleWebhook(byte[], String)}) and queue polling ({@link #processPending(String)}).
 * Each claimed task is processed on a worker thread; the stages of one document run
 * sequentially.</p>
 *
 * <p>Failure handling per attempt:</p>
 * <ul>
 *   <li>transient failures are requeued after the {@link BackoffPolicy} delay until the queue's
 *       attempt ceiling is reached</li>
 *   <li>permanent and data-integrity failures fail the task at once</li>
 *   <li>a permanently failed vectorize task moves its document to {@link DocumentState#FAILED};
 *       the processed flag and the previous chunk set are left as they were</li>
 * </ul>
 */
public class IngestionOrchestrator implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(IngestionOrchestrator.class);

    private final DocumentStore documentStore;
    private final ChunkStore chunkStore;
    private final BlobStore blobStore;
    private final TaskQueue taskQueue;
    private final WebhookEventLog webhookEventLog;
    private final TranscriptImporter importer;
    private final Segmenter segmenter;
    private final SegmentationConfig segmentationConfig;
    private final EmbeddingClient embeddingClient;
    private final WebhookVerifier webhookVerifier;
    private final BackoffPolicy retryPolicy;
    private final IngestionSettings settings;
    private final Clock clock;
    private final FailureClassifier failureClassifier = new FailureClassifier();
    private final RetryEventLogger retryLogger = new RetryEventLogger();
    private final ExecutorService workers;
    private final ExecutorService blobReader;

    public IngestionOrchestrator(DocumentStore documentStore, ChunkStore chunkStore, BlobStore blobStore,
            TaskQueue taskQueue, WebhookEventLog webhookEventLog, TranscriptImporter importer, Segmenter segmenter,
            SegmentationConfig segmentationConfig, EmbeddingClient embeddingClient, WebhookVerifier webhookVerifier,
            BackoffPolicy retryPolicy, IngestionSettings settings, Clock clock) {
        this.documentStore = documentStore;
        this.chunkStore = chunkStore;
        this.blobStore = blobStore;
        this.taskQueue = taskQueue;
        this.webhookEventLog = webhookEventLog;
        this.importer = importer;
        this.segmenter = segmenter;
        this.segmentationConfig = segmentationConfig;
        this.embeddingClient = embeddingClient;
        this.webhookVerifier = webhookVerifier;
        this.retryPolicy = retryPolicy;
        this.settings = settings;
        this.clock = clock;
        this.workers = Executors.newFixedThreadPool(settings.workerConcurrency(), daemonThreads("ingestion-worker-"));
        this.blobReader = Executors.newCachedThreadPool(daemonThreads("blob-reader-"));
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    // ---------------------------------------------------------------- sync

    /**
     * Pulls new transcripts, enqueues unprocessed documents and optionally runs housekeeping.
     * A failing transcript is counted in the report; it does not abort the run.
     */
    public SyncReport sync(SyncOptions options) {
        List<String> errors = new ArrayList<>();
        int listed = 0;
        int imported = 0;
        int skipped = 0;
        int failed = 0;

        if (options.pullFromSource()) {
            int limit = options.limit() > 0 ? options.limit() : settings.fetchLimit();
            List<SourceTranscript> transcripts = List.of();
            try {
                transcripts = importer.source().listRecent(limit, options.since());
            } catch (TranscriptSourceException e) {
                LOG.warnf("Listing transcripts failed: %s", e.getMessage());
                errors.add("list: " + e.getMessage());
            }
            listed = transcripts.size();

            for (SourceTranscript transcript : transcripts) {
                try {
                    Optional<Document> document = importer.importListed(transcript, options.forceUpdate());
                    if (document.isPresent()) {
                        imported++;
                    } else {
                        skipped++;
                    }
                } catch (RuntimeException e) {
                    failed++;
                    String message = failureClassifier.describe(e);
                    errors.add(transcript.id() + ": " + message);
                    LOG.warnf("Import of transcript %s failed: %s", transcript.id(), message);
                }
            }
        }

        int enqueued = options.enqueueUnprocessed() ? enqueueUnprocessed(settings.syncBatchSize()) : 0;
        HousekeepingReport housekeeping = options.cleanup() ? housekeeping() : HousekeepingReport.none();

        LOG.infof("Sync finished: %d listed, %d imported, %d skipped, %d failed, %d enqueued",
            Integer.valueOf(listed), Integer.valueOf(imported), Integer.valueOf(skipped), Integer.valueOf(failed),
            Integer.valueOf(enqueued));
        return new SyncReport(listed, imported, skipped, failed, enqueued, housekeeping, errors);
    }

    /**
     * Enqueues one vectorize task per unprocessed document, up to {@code limit}.
     *
     * @return number of documents enqueued
     */
    public int enqueueUnprocessed(int limit) {
        List<Document> documents = documentStore.findUnprocessed(limit);
        for (Document document : documents) {
            taskQueue.enqueue(TaskType.VECTORIZE, document.id(), settings.syncPriority());
        }
        if (!documents.isEmpty()) {
            LOG.infof("Enqueued %d unprocessed documents", Integer.valueOf(documents.size()));
        }
        return documents.size();
    }

    // ---------------------------------------------------------------- webhooks

    /**
     * Handles one webhook request body.
     *
     * @param body raw request body, used for signature verification
     * @param signature value of the signature header, may be null
     * @throws WebhookAuthenticationException if the signature is required and missing or wrong
     * @throws IllegalArgumentException if the payload is malformed or lacks a transcript id
     */
    public WebhookResult handleWebhook(byte[] body, @Nullable String signature) {
        String payload = new String(body, StandardCharsets.UTF_8);
        try {
            webhookVerifier.verify(body, signature);
        } catch (WebhookAuthenticationException e) {
            webhookEventLog.record("unknown", null, payload, WebhookEventStatus.REJECTED, e.getMessage(), clock.instant());
            LOG.warnf("Webhook rejected: %s", e.getMessage());
            throw e;
        }

        WebhookEvent event;
        try {
            event = WebhookEvent.parse(payload);
        } catch (IllegalArgumentException e) {
            webhookEventLog.record("unknown", null, payload, WebhookEventStatus.REJECTED, e.getMessage(), clock.instant());
            throw e;
        }

        String eventId = webhookEventLog.record(event.eventName(), event.transcriptId(), payload,
            WebhookEventStatus.RECEIVED, null, clock.instant());
        LOG.infof("Webhook event %s (%s) for transcript %s", event.eventName(), event.type(), event.transcriptId());

        if (!event.type().importsTranscript()) {
            String message = event.type() == WebhookEventType.UNKNOWN
                ? "Unknown event type " + event.eventName()
                : "Event " + event.eventName() + " logged";
            webhookEventLog.updateStatus(eventId, WebhookEventStatus.IGNORED, message, clock.instant());
            return new WebhookResult(WebhookResult.Outcome.IGNORED, eventId, event.type(), event.transcriptId(), null,
                message);
        }

        if (event.transcriptId() == null) {
            String message = "No transcript id in " + event.eventName() + " payload";
            webhookEventLog.updateStatus(eventId, WebhookEventStatus.FAILED, message, clock.instant());
            throw new IllegalArgumentException(message);
        }

        int priority = event.type() == WebhookEventType.COMPLETED
            ? settings.completedPriority()
            : settings.updatedPriority();
        try {
            Document document = importer.importTranscript(event.transcriptId());
            ProcessingTask task = taskQueue.enqueue(TaskType.VECTORIZE, document.id(), priority);
            String message = "Imported and queued for indexing";
            webhookEventLog.updateStatus(eventId, WebhookEventStatus.PROCESSED, message, clock.instant());
            return new WebhookResult(WebhookResult.Outcome.QUEUED, eventId, event.type(), event.transcriptId(),
                task.id(), message);
        } catch (RuntimeException e) {
            String error = failureClassifier.describe(e);
            LOG.warnf("Webhook import of transcript %s failed, scheduling retry: %s", event.transcriptId(), error);
            ProcessingTask retry = taskQueue.enqueue(TaskType.WEBHOOK_RETRY, event.transcriptId(),
                settings.retryPriority());
            webhookEventLog.updateStatus(eventId, WebhookEventStatus.FAILED, error, clock.instant());
            return new WebhookResult(WebhookResult.Outcome.RETRY_SCHEDULED, eventId, event.type(),
                event.transcriptId(), retry.id(), error);
        }
    }

    // ---------------------------------------------------------------- queue processing

    /**
     * Reclaims expired leases, then claims up to {@code workerConcurrency} due tasks and
     * processes them in parallel. A vectorize task failed by lease expiry fails its document.
     *
     * @return the tasks in their state after processing
     */
    public List<ProcessingTask> processPending(String workerId) {
        for (ProcessingTask expired : taskQueue.reclaimExpired()) {
            if (expired.type() == TaskType.VECTORIZE) {
                markDocumentFailed(expired.payload());
            }
        }
        List<ProcessingTask> claimed = taskQueue.claim(workerId, settings.workerConcurrency(), settings.leaseDuration());
        if (claimed.isEmpty()) {
            return List.of();
        }
        List<CompletableFuture<ProcessingTask>> running = new ArrayList<>(claimed.size());
        for (ProcessingTask task : claimed) {
            running.add(CompletableFuture.supplyAsync(() -> processTask(task), workers));
        }
        List<ProcessingTask> finished = new ArrayList<>(running.size());
        for (CompletableFuture<ProcessingTask> future : running) {
            finished.add(future.join());
        }
        return finished;
    }

    /**
     * Runs one claimed task and records its outcome in the queue.
     */
    public ProcessingTask processTask(ProcessingTask task) {
        long started = System.currentTimeMillis();
        try {
            switch (task.type()) {
                case VECTORIZE -> vectorize(task.payload());
                case WEBHOOK_RETRY -> {
                    Document document = importer.importTranscript(task.payload());
                    taskQueue.enqueue(TaskType.VECTORIZE, document.id(), settings.completedPriority());
                }
                case SYNC -> sync(SyncOptions.defaults());
            }
        } catch (RuntimeException e) {
            try {
                return handleFailure(task, e);
            } catch (IllegalStateException lost) {
                LOG.warnf("Task %s failed after its lease was lost: %s", task.id(), lost.getMessage());
                return task;
            }
        }

        ProcessingTask completed;
        try {
            completed = taskQueue.complete(task);
        } catch (IllegalStateException e) {
            LOG.warnf("Task %s finished after its lease was lost: %s", task.id(), e.getMessage());
            return task;
        }
        if (task.attempts() > 0) {
            retryLogger.logRetrySuccess(operation(task), task.attempts() + 1);
        }
        LOG.infof("Task %s (%s %s) completed in %d ms", task.id(), task.type(), task.payload(),
            Long.valueOf(System.currentTimeMillis() - started));
        return completed;
    }

    private ProcessingTask handleFailure(ProcessingTask task, RuntimeException failure) {
        FailureKind kind = failureClassifier.classify(failure);
        String error = failureClassifier.describe(failure);
        int attempt = task.attempts() + 1;

        ProcessingTask updated;
        if (kind == FailureKind.TRANSIENT) {
            Instant nextAttemptAt = clock.instant().plus(retryPolicy.delayAfter(attempt));
            updated = taskQueue.requeue(task, error, nextAttemptAt);
            if (updated.status() == TaskStatus.PENDING) {
                retryLogger.logRetryAttempt(operation(task), attempt, taskQueue.maxAttempts(), failure);
            } else {
                retryLogger.logRetryExhausted(operation(task), attempt, failure);
            }
        } else {
            LOG.warnf("Task %s (%s %s) failed with a %s error, not retrying: %s",
                task.id(), task.type(), task.payload(), kind, error);
            updated = taskQueue.fail(task, error);
        }

        if (updated.status() == TaskStatus.FAILED && task.type() == TaskType.VECTORIZE) {
            markDocumentFailed(task.payload());
        }
        return updated;
    }

    private void markDocumentFailed(String documentId) {
        try {
            documentStore.updateState(documentId, DocumentState.FAILED, clock.instant());
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to mark document %s as FAILED", documentId);
        }
    }

    private static String operation(ProcessingTask task) {
        return task.type().name().toLowerCase(Locale.ROOT) + "[" + task.payload() + "]";
    }

    /**
     * Fetches, segments, embeds and persists one document, replacing any previous chunk set.
     *
     * @return number of chunks stored
     * @throws DataIntegrityException if the document or its raw content does not exist
     */
    public int vectorize(String documentId) {
        Document document = documentStore.findById(documentId)
            .orElseThrow(() -> new DataIntegrityException("Document " + documentId + " does not exist"));

        String content = fetchContent(document);
        documentStore.updateState(documentId, DocumentState.FETCHED, clock.instant());

        SegmentationResult segmentation = segmenter.segment(documentId, content, segmentationConfig);
        documentStore.updateState(documentId, DocumentState.SEGMENTED, clock.instant());

        List<Chunk> chunks = embed(documentId, segmentation.chunks());
        documentStore.updateState(documentId, DocumentState.EMBEDDED, clock.instant());

        chunkStore.replaceDocumentChunks(documentId, chunks, segmentation.relationships());
        documentStore.markProcessed(documentId, chunks.size(), TokenUtil.countWords(content), clock.instant());

        LOG.infof("Indexed document %s: %d chunks, %d relationships, %d entities",
            documentId, Integer.valueOf(chunks.size()), Integer.valueOf(segmentation.relationships().size()),
            Integer.valueOf(segmentation.entities().size()));
        return chunks.size();
    }

    private String fetchContent(Document document) {
        CompletableFuture<Optional<byte[]>> read =
            CompletableFuture.supplyAsync(() -> blobStore.get(document.rawContentKey()), blobReader);
        Optional<byte[]> bytes;
        try {
            bytes = read.get(settings.blobTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            read.cancel(true);
            throw new BlobFetchException("Reading " + document.rawContentKey() + " timed out after "
                + settings.blobTimeout().toMillis() + " ms", e);
        } catch (ExecutionException e) {
            throw new BlobFetchException("Reading " + document.rawContentKey() + " failed: "
                + e.getCause().getMessage(), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BlobFetchException("Interrupted while reading " + document.rawContentKey(), e);
        }
        return new String(bytes.orElseThrow(() -> new DataIntegrityException(
            "Raw content " + document.rawContentKey() + " of document " + document.id() + " is missing")),
            StandardCharsets.UTF_8);
    }

    /**
     * Attaches embeddings. A transient failure of any chunk fails the attempt so the whole
     * document is retried; chunks that fail permanently are stored without an embedding and
     * stay reachable by text search.
     */
    private List<Chunk> embed(String documentId, List<Chunk> chunks) {
        if (chunks.isEmpty()) {
            return chunks;
        }
        List<EmbeddingOutcome> outcomes = embeddingClient.embedBatch(chunks.stream().map(Chunk::content).toList());
        List<Chunk> embedded = new ArrayList<>(chunks.size());
        int unembedded = 0;
        for (int i = 0; i < chunks.size(); i++) {
            EmbeddingOutcome outcome = outcomes.get(i);
            if (outcome.isSuccess()) {
                embedded.add(chunks.get(i).withEmbedding(outcome.vector(), embeddingClient.model()));
                continue;
            }
            EmbeddingException error = outcome.error();
            if (error.isTransient()) {
                throw error;
            }
            LOG.warnf("Chunk %s of document %s stored without embedding: %s",
                chunks.get(i).id(), documentId, error.getMessage());
            embedded.add(chunks.get(i));
            unembedded++;
        }
        if (unembedded > 0) {
            LOG.warnf("%d of %d chunks of document %s have no embedding",
                Integer.valueOf(unembedded), Integer.valueOf(chunks.size()), documentId);
        }
        return embedded;
    }

    // ---------------------------------------------------------------- housekeeping and statistics

    /**
     * Purges finished tasks and old webhook events past their retention windows.
     */
    public HousekeepingReport housekeeping() {
        Instant now = clock.instant();
        int tasks = taskQueue.purge(now.minus(settings.taskRetention()));
        int events = webhookEventLog.purgeOlderThan(now.minus(settings.webhookRetention()));
        LOG.infof("Housekeeping purged %d tasks and %d webhook events", Integer.valueOf(tasks), Integer.valueOf(events));
        return new HousekeepingReport(tasks, events);
    }

    public PipelineStatistics statistics() {
        return new PipelineStatistics(documentStore.countByState(), chunkStore.countChunks(),
            chunkStore.countEmbedded(), taskQueue.countByStatus());
    }

    @Override
    public void close() {
        workers.shutdownNow();
        blobReader.shutdownNow();
    }

    /**
     * Raw content could not be read in time; retried like any transient failure.
     */
    static final class BlobFetchException extends RuntimeException {

        BlobFetchException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
