package br.edu.ifba.meetingrag.chunking;

import java.util.List;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import br.edu.ifba.meetingrag.extraction.ExtractedEntity;

/**
 * A segment of a document's content, the unit of embedding and retrieval.
 *
 * <p>The embedding is absent until the embedding stage has run; such a chunk is
 * valid but not searchable by similarity. Previous/next/parent ids are lookup
 * references only.</p>
 */
public record Chunk(
    @NotNull String id,
    @NotNull String documentId,
    int position,
    @NotNull ChunkType type,
    @NotNull String content,
    @Nullable String speaker,
    @Nullable Integer startSeconds,
    @Nullable Integer endSeconds,
    int tokenCount,
    double importance,
    @NotNull List<String> topics,
    @NotNull List<ExtractedEntity> entities,
    @Nullable float[] embedding,
    @Nullable String embeddingModel,
    @Nullable String previousChunkId,
    @Nullable String nextChunkId,
    @Nullable String parentChunkId
) {

    public Chunk {
        if (position < 0) {
            throw new IllegalArgumentException("position must be non-negative, got " + position);
        }
        if (importance < 0.0 || importance > 1.0) {
            throw new IllegalArgumentException("importance must be within [0, 1], got " + importance);
        }
        topics = List.copyOf(topics);
        entities = List.copyOf(entities);
    }

    public boolean hasEmbedding() {
        return embedding != null;
    }

    public Chunk withEmbedding(@NotNull final float[] vector, @NotNull final String model) {
        return new Chunk(id, documentId, position, type, content, speaker, startSeconds, endSeconds, tokenCount,
            importance, topics, entities, vector, model, previousChunkId, nextChunkId, parentChunkId);
    }
}
