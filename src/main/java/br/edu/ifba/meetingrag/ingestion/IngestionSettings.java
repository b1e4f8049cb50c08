package br.edu.ifba.meetingrag.ingestion;

import java.time.Duration;

/**
 * Queue, sync, webhook and housekeeping settings of the {@link IngestionOrchestrator}.
 *
 * @param workerConcurrency tasks processed in parallel per poll
 * @param leaseDuration how long a claimed task stays owned by its worker
 * @param blobTimeout timeout of a raw-content fetch
 * @param syncBatchSize unprocessed documents enqueued per sync
 * @param fetchLimit transcripts pulled from the source per sync
 * @param syncPriority priority of tasks enqueued by sync
 */
public record IngestionSettings(
    int workerConcurrency,
    Duration leaseDuration,
    Duration blobTimeout,
    int syncBatchSize,
    int fetchLimit,
    int syncPriority,
    int completedPriority,
    int updatedPriority,
    int retryPriority,
    Duration taskRetention,
    Duration webhookRetention
) {

    public IngestionSettings {
        if (workerConcurrency < 1) {
            throw new IllegalArgumentException("workerConcurrency must be at least 1, got " + workerConcurrency);
        }
        if (syncBatchSize < 1 || fetchLimit < 1) {
            throw new IllegalArgumentException("syncBatchSize and fetchLimit must be positive");
        }
        requirePositive(leaseDuration, "leaseDuration");
        requirePositive(blobTimeout, "blobTimeout");
        requirePositive(taskRetention, "taskRetention");
        requirePositive(webhookRetention, "webhookRetention");
    }

    private static void requirePositive(Duration value, String name) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }

    public static IngestionSettings defaults() {
        return new IngestionSettings(2, Duration.ofMinutes(10), Duration.ofSeconds(10), 50, 25, 5, 10, 8, 7,
            Duration.ofDays(7), Duration.ofDays(30));
    }
}
