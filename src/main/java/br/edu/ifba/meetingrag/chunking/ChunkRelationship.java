package br.edu.ifba.meetingrag.chunking;

import org.jetbrains.annotations.NotNull;

/**
 * Directed, weighted edge between two chunks. Used for context expansion only.
 */
public record ChunkRelationship(
    @NotNull String sourceChunkId,
    @NotNull String targetChunkId,
    @NotNull RelationshipType type,
    double strength
) {

    public ChunkRelationship {
        if (strength < 0.0 || strength > 1.0) {
            throw new IllegalArgumentException("strength must be within [0, 1], got " + strength);
        }
        if (sourceChunkId.equals(targetChunkId)) {
            throw new IllegalArgumentException("relationship must connect two different chunks: " + sourceChunkId);
        }
    }
}
