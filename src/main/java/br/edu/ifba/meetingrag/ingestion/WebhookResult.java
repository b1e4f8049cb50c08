package br.edu.ifba.meetingrag.ingestion;

import org.jetbrains.annotations.Nullable;

/**
 * Outcome of {@link IngestionOrchestrator#handleWebhook(byte[], String)}.
 *
 * @param eventId id of the webhook event log entry
 * @param taskId task enqueued for the event, if any
 */
public record WebhookResult(Outcome outcome, String eventId, WebhookEventType type, @Nullable String transcriptId,
        @Nullable String taskId, String message) {

    public enum Outcome {
        /** Transcript imported and queued for indexing. */
        QUEUED,
        /** Transcript fetch failed; a retry task was queued. */
        RETRY_SCHEDULED,
        /** Event logged without further action. */
        IGNORED
    }
}
