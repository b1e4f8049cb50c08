package br.edu.ifba.meetingrag;

import java.time.Duration;
import java.util.Optional;

import br.edu.ifba.meetingrag.chunking.SegmentationConfig;
import br.edu.ifba.meetingrag.chunking.SegmentationStrategy;
import br.edu.ifba.meetingrag.embedding.EmbeddingSettings;
import br.edu.ifba.meetingrag.ingestion.IngestionSettings;
import br.edu.ifba.meetingrag.search.SearchSettings;
import br.edu.ifba.meetingrag.utils.BackoffPolicy;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration of the ingestion and retrieval pipeline.
 *
 * <p>Loaded from application.properties with the "meetingrag" prefix. Each group converts
 * into the plain settings record its component is constructed with.</p>
 *
 * <p>Example configuration:
 * <pre>
 * meetingrag.segmentation.strategy=AUTO
 * meetingrag.embedding.model=text-embedding-3-small
 * meetingrag.retry.max-attempts=3
 * meetingrag.search.relevance-threshold=0.7
 * meetingrag.webhook.secret=${FIREFLIES_WEBHOOK_SECRET}
 * </pre>
 */
@ConfigMapping(prefix = "meetingrag")
public interface PipelineConfig {

    Segmentation segmentation();

    Extraction extraction();

    Embedding embedding();

    Retry retry();

    Search search();

    Queue queue();

    Sync sync();

    Webhook webhook();

    Housekeeping housekeeping();

    Storage storage();

    interface Segmentation {

        @WithName("target-tokens")
        @WithDefault("1000")
        int targetTokens();

        @WithName("min-tokens")
        @WithDefault("100")
        int minTokens();

        @WithName("max-tokens")
        @WithDefault("1500")
        int maxTokens();

        @WithName("overlap-tokens")
        @WithDefault("200")
        int overlapTokens();

        @WithDefault("AUTO")
        SegmentationStrategy strategy();

        @WithName("time-window-seconds")
        @WithDefault("300")
        int timeWindowSeconds();

        @WithName("time-overlap-seconds")
        @WithDefault("30")
        int timeOverlapSeconds();

        @WithName("adaptive-windows")
        @WithDefault("true")
        boolean adaptiveWindows();

        /**
         * Minimum topic Jaccard index for a topic-similarity relationship.
         *
         * @return threshold in (0, 1]
         */
        @WithName("topic-similarity-threshold")
        @WithDefault("0.7")
        double topicSimilarityThreshold();

        default SegmentationConfig toSettings() {
            return new SegmentationConfig(targetTokens(), minTokens(), maxTokens(), overlapTokens(), strategy(),
                timeWindowSeconds(), timeOverlapSeconds(), adaptiveWindows(), topicSimilarityThreshold());
        }
    }

    interface Extraction {

        /**
         * Longest text scanned for entities; the rest is ignored and the result flagged as truncated.
         *
         * @return limit in characters
         */
        @WithName("max-text-length")
        @WithDefault("50000")
        int maxTextLength();

        @WithName("max-topics")
        @WithDefault("5")
        int maxTopics();
    }

    interface Embedding {

        @WithDefault("text-embedding-3-small")
        String model();

        @WithDefault("1536")
        int dimension();

        @WithName("batch-size")
        @WithDefault("20")
        int batchSize();

        @WithName("max-concurrent-batches")
        @WithDefault("2")
        int maxConcurrentBatches();

        @WithDefault("30S")
        Duration timeout();

        @WithName("max-input-tokens")
        @WithDefault("8000")
        int maxInputTokens();

        default EmbeddingSettings toSettings() {
            return new EmbeddingSettings(model(), dimension(), batchSize(), maxConcurrentBatches(), timeout(),
                maxInputTokens());
        }
    }

    /**
     * Backoff shared by embedding calls and queue retries. {@code max-attempts} is also the
     * attempt ceiling of the task queue.
     */
    interface Retry {

        @WithName("max-attempts")
        @WithDefault("3")
        int maxAttempts();

        @WithName("base-delay")
        @WithDefault("1S")
        Duration baseDelay();

        @WithDefault("2.0")
        double multiplier();

        @WithName("max-delay")
        @WithDefault("5M")
        Duration maxDelay();

        default BackoffPolicy toPolicy() {
            return new BackoffPolicy(maxAttempts(), baseDelay(), multiplier(), maxDelay());
        }
    }

    interface Search {

        @WithName("semantic-enabled")
        @WithDefault("true")
        boolean semanticEnabled();

        @WithName("relevance-threshold")
        @WithDefault("0.7")
        double relevanceThreshold();

        @WithName("over-fetch-multiplier")
        @WithDefault("3")
        int overFetchMultiplier();

        @WithName("max-limit")
        @WithDefault("50")
        int maxLimit();

        @WithName("context-window-seconds")
        @WithDefault("30")
        int contextWindowSeconds();

        @WithName("context-tokens")
        @WithDefault("150")
        int contextTokens();

        default SearchSettings toSettings() {
            return new SearchSettings(semanticEnabled(), relevanceThreshold(), overFetchMultiplier(), maxLimit(),
                contextWindowSeconds(), contextTokens());
        }
    }

    interface Queue {

        @WithName("worker-concurrency")
        @WithDefault("2")
        int workerConcurrency();

        @WithName("lease-duration")
        @WithDefault("10M")
        Duration leaseDuration();

        /**
         * Read by the scheduler expression of the queue poll job.
         */
        @WithName("poll-interval")
        @WithDefault("15s")
        String pollInterval();

        @WithName("blob-timeout")
        @WithDefault("10S")
        Duration blobTimeout();
    }

    interface Sync {

        @WithDefault("true")
        boolean enabled();

        @WithDefault("30m")
        String interval();

        @WithName("batch-size")
        @WithDefault("50")
        int batchSize();

        @WithName("fetch-limit")
        @WithDefault("25")
        int fetchLimit();

        @WithDefault("5")
        int priority();
    }

    interface Webhook {

        /**
         * HMAC-SHA256 secret; signature verification is off when absent.
         *
         * @return secret, empty Optional if not configured
         */
        Optional<String> secret();

        @WithName("completed-priority")
        @WithDefault("10")
        int completedPriority();

        @WithName("updated-priority")
        @WithDefault("8")
        int updatedPriority();

        @WithName("retry-priority")
        @WithDefault("7")
        int retryPriority();
    }

    interface Housekeeping {

        @WithDefault("6h")
        String interval();

        @WithName("task-retention")
        @WithDefault("7D")
        Duration taskRetention();

        @WithName("webhook-retention")
        @WithDefault("30D")
        Duration webhookRetention();
    }

    /**
     * Read by {@code SQLiteStorageProvider}; mapped here so the whole prefix is known.
     */
    interface Storage {

        Sqlite sqlite();

        @WithName("blob-root")
        @WithDefault("data/blobs")
        String blobRoot();

        interface Sqlite {

            @WithDefault("data/meetingrag.db")
            String path();

            @WithName("read-pool-size")
            @WithDefault("4")
            int readPoolSize();

            @WithName("busy-timeout")
            @WithDefault("30000")
            long busyTimeout();

            @WithName("wal-mode")
            @WithDefault("true")
            boolean walMode();
        }
    }

    default IngestionSettings toIngestionSettings() {
        return new IngestionSettings(queue().workerConcurrency(), queue().leaseDuration(), queue().blobTimeout(),
            sync().batchSize(), sync().fetchLimit(), sync().priority(), webhook().completedPriority(),
            webhook().updatedPriority(), webhook().retryPriority(), housekeeping().taskRetention(),
            housekeeping().webhookRetention());
    }
}
