package br.edu.ifba.meetingrag.queue;

import java.time.Instant;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A queued unit of work.
 *
 * @param payload document id or transcript id, depending on the type
 * @param attempts failed attempts so far
 * @param lastError human-readable error of the most recent failure
 * @param scheduledAt earliest time the task may be claimed
 * @param leaseOwner worker holding the task while it is processing
 * @param leaseExpiresAt time after which another worker may reclaim the task
 */
public record ProcessingTask(
    @NotNull String id,
    @NotNull TaskType type,
    @NotNull String payload,
    int priority,
    @NotNull TaskStatus status,
    int attempts,
    @Nullable String lastError,
    @NotNull Instant scheduledAt,
    @Nullable String leaseOwner,
    @Nullable Instant leaseExpiresAt,
    @NotNull Instant createdAt,
    @NotNull Instant updatedAt,
    @Nullable Instant completedAt
) {
}
