package br.edu.ifba.meetingrag.chunking;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import br.edu.ifba.meetingrag.extraction.TextSimilarity;

/**
 * Builds the relationship graph of one document's chunks.
 *
 * <ul>
 *   <li>sequential: each chunk to its successor by position, strength 1.0</li>
 *   <li>parent-child: the full-document chunk to every other chunk, strength 1.0</li>
 *   <li>speaker-continuity: a chunk to the next chunk of the same type and speaker, strength 0.8</li>
 *   <li>topic-similarity: same-type chunks whose topic sets reach the Jaccard threshold, strength = index</li>
 * </ul>
 */
final class RelationshipBuilder {

    static final double SPEAKER_CONTINUITY_STRENGTH = 0.8;

    private final double topicSimilarityThreshold;

    RelationshipBuilder(final double topicSimilarityThreshold) {
        this.topicSimilarityThreshold = topicSimilarityThreshold;
    }

    List<ChunkRelationship> build(final List<Chunk> chunks) {
        final List<ChunkRelationship> relationships = new ArrayList<>();

        for (int i = 0; i + 1 < chunks.size(); i++) {
            relationships.add(new ChunkRelationship(chunks.get(i).id(), chunks.get(i + 1).id(),
                RelationshipType.SEQUENTIAL, 1.0));
        }

        for (final Chunk chunk : chunks) {
            if (chunk.parentChunkId() != null) {
                relationships.add(new ChunkRelationship(chunk.parentChunkId(), chunk.id(),
                    RelationshipType.PARENT_CHILD, 1.0));
            }
        }

        final Map<String, Chunk> lastBySpeaker = new HashMap<>();
        for (final Chunk chunk : chunks) {
            if (chunk.speaker() == null || chunk.type() == ChunkType.FULL_DOCUMENT) {
                continue;
            }
            final String key = chunk.type().name() + '|' + chunk.speaker();
            final Chunk previous = lastBySpeaker.put(key, chunk);
            if (previous != null) {
                relationships.add(new ChunkRelationship(previous.id(), chunk.id(),
                    RelationshipType.SPEAKER_CONTINUITY, SPEAKER_CONTINUITY_STRENGTH));
            }
        }

        for (int i = 0; i < chunks.size(); i++) {
            final Chunk first = chunks.get(i);
            if (first.type() == ChunkType.FULL_DOCUMENT || first.topics().isEmpty()) {
                continue;
            }
            final Set<String> firstTopics = new HashSet<>(first.topics());
            for (int j = i + 1; j < chunks.size(); j++) {
                final Chunk second = chunks.get(j);
                if (second.type() != first.type() || second.topics().isEmpty()) {
                    continue;
                }
                final double similarity = TextSimilarity.jaccard(firstTopics, new HashSet<>(second.topics()));
                if (similarity >= topicSimilarityThreshold) {
                    relationships.add(new ChunkRelationship(first.id(), second.id(),
                        RelationshipType.TOPIC_SIMILARITY, Math.round(similarity * 1000.0) / 1000.0));
                }
            }
        }
        return relationships;
    }
}
