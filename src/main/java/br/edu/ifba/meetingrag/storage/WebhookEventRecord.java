package br.edu.ifba.meetingrag.storage;

import java.time.Instant;

import org.jetbrains.annotations.Nullable;

public record WebhookEventRecord(
    String id,
    String eventType,
    @Nullable String transcriptId,
    String payload,
    WebhookEventStatus status,
    @Nullable String detail,
    Instant receivedAt,
    Instant updatedAt
) {
}
