package br.edu.ifba.meetingrag.storage;

import java.time.Instant;
import java.util.List;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A source unit, typically one meeting transcript.
 *
 * <p>{@code processed} is only ever set together with a complete chunk set; a failed
 * reprocessing run leaves it and {@code chunkCount} as they were.</p>
 *
 * @param rawContentKey blob store key of the raw text
 * @param durationSeconds meeting length when the source reports one
 */
public record Document(
    @NotNull String id,
    @NotNull String title,
    @Nullable Instant sourceDate,
    @NotNull String rawContentKey,
    int wordCount,
    boolean processed,
    int chunkCount,
    @Nullable Instant lastProcessedAt,
    @NotNull DocumentState state,
    @Nullable String category,
    @Nullable String project,
    @Nullable String department,
    @NotNull List<String> tags,
    @NotNull List<String> participants,
    @Nullable Integer durationSeconds,
    @NotNull Instant createdAt,
    @NotNull Instant updatedAt
) {

    public Document {
        tags = tags == null ? List.of() : List.copyOf(tags);
        participants = participants == null ? List.of() : List.copyOf(participants);
    }

    /**
     * A document that has not been processed yet.
     */
    public static Document create(final String id, final String title, @Nullable final Instant sourceDate,
            final String rawContentKey, final int wordCount, final Instant now) {
        return new Document(id, title, sourceDate, rawContentKey, wordCount, false, 0, null, DocumentState.NEW,
            null, null, null, List.of(), List.of(), null, now, now);
    }

    public Document withClassification(@Nullable final String newCategory, @Nullable final String newProject,
            @Nullable final String newDepartment, final List<String> newTags) {
        return new Document(id, title, sourceDate, rawContentKey, wordCount, processed, chunkCount, lastProcessedAt,
            state, newCategory, newProject, newDepartment, newTags, participants, durationSeconds, createdAt, updatedAt);
    }

    public Document withParticipants(final List<String> newParticipants, @Nullable final Integer newDurationSeconds) {
        return new Document(id, title, sourceDate, rawContentKey, wordCount, processed, chunkCount, lastProcessedAt,
            state, category, project, department, tags, newParticipants, newDurationSeconds, createdAt, updatedAt);
    }
}
