package br.edu.ifba.meetingrag.chunking;

import java.util.List;

import br.edu.ifba.meetingrag.extraction.ExtractedEntity;

/**
 * Chunks of one document with their relationship graph.
 *
 * @param chunks chunks ordered by position, the full-document chunk first
 * @param relationships edges between chunk ids
 * @param entities document-level entities, near-duplicates across chunks merged
 * @param strategies strategies that produced the finer-grained chunks
 * @param extractionTruncated whether any chunk exceeded the extractor's size ceiling
 */
public record SegmentationResult(
    List<Chunk> chunks,
    List<ChunkRelationship> relationships,
    List<ExtractedEntity> entities,
    List<ChunkType> strategies,
    boolean extractionTruncated
) {

    public SegmentationResult {
        chunks = List.copyOf(chunks);
        relationships = List.copyOf(relationships);
        entities = List.copyOf(entities);
        strategies = List.copyOf(strategies);
    }

    public static SegmentationResult empty() {
        return new SegmentationResult(List.of(), List.of(), List.of(), List.of(), false);
    }

    public boolean isEmpty() {
        return chunks.isEmpty();
    }

    public List<Chunk> chunksOfType(final ChunkType type) {
        return chunks.stream().filter(chunk -> chunk.type() == type).toList();
    }
}
