package br.edu.ifba.meetingrag.search;

import java.time.Instant;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import br.edu.ifba.meetingrag.chunking.ChunkType;

/**
 * One ranked chunk.
 *
 * @param similarity cosine similarity to the query; null for text-mode results
 * @param contextBefore tail of the preceding chunk of the same type, when it lies within the context window
 * @param contextAfter head of the following chunk of the same type, when it lies within the context window
 * @param highlight content with query matches wrapped in {@code **}; text mode only
 */
public record SearchResult(
    @NotNull String chunkId,
    @NotNull String documentId,
    @NotNull String documentTitle,
    @Nullable Instant documentDate,
    @NotNull ChunkType type,
    int position,
    @NotNull String content,
    @Nullable String speaker,
    @Nullable Integer startSeconds,
    @Nullable Integer endSeconds,
    @Nullable Double similarity,
    @Nullable String contextBefore,
    @Nullable String contextAfter,
    @Nullable String highlight
) {

    SearchResult withContext(@Nullable String before, @Nullable String after) {
        return new SearchResult(chunkId, documentId, documentTitle, documentDate, type, position, content, speaker,
            startSeconds, endSeconds, similarity, before, after, highlight);
    }
}
