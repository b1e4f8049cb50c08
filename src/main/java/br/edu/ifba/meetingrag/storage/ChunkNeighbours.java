package br.edu.ifba.meetingrag.storage;

import org.jetbrains.annotations.Nullable;

import br.edu.ifba.meetingrag.chunking.Chunk;

/**
 * Chunks linked to a chunk by sequential relationships.
 */
public record ChunkNeighbours(@Nullable Chunk previous, @Nullable Chunk next) {

    public static ChunkNeighbours none() {
        return new ChunkNeighbours(null, null);
    }
}
