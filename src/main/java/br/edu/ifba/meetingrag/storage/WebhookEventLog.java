package br.edu.ifba.meetingrag.storage;

import java.time.Instant;
import java.util.List;

import org.jetbrains.annotations.Nullable;

/**
 * Audit log of received webhook events.
 */
public interface WebhookEventLog {

    /**
     * Stores a new event and returns its id.
     */
    String record(String eventType, @Nullable String transcriptId, String payload, WebhookEventStatus status,
            @Nullable String detail, Instant at);

    void updateStatus(String id, WebhookEventStatus status, @Nullable String detail, Instant at);

    List<WebhookEventRecord> recent(int limit);

    /**
     * Deletes events received before {@code cutoff}.
     *
     * @return number of deleted events
     */
    int purgeOlderThan(Instant cutoff);
}
