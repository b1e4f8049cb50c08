package br.edu.ifba.meetingrag.storage;

import java.time.Instant;

import org.jetbrains.annotations.Nullable;

import br.edu.ifba.meetingrag.chunking.Chunk;

/**
 * A chunk returned for ranking, with its owning document's title and date.
 *
 * @param chunk the chunk; its embedding is not decoded
 * @param embeddingBlob the stored vector bytes, null for text-search candidates
 */
public record CandidateChunk(Chunk chunk, @Nullable byte[] embeddingBlob, String documentTitle,
        @Nullable Instant documentDate) {
}
