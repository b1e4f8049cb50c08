package br.edu.ifba.meetingrag.storage;

import java.util.List;
import java.util.Optional;

import br.edu.ifba.meetingrag.chunking.Chunk;
import br.edu.ifba.meetingrag.chunking.ChunkRelationship;
import br.edu.ifba.meetingrag.extraction.ExtractedEntity;
import br.edu.ifba.meetingrag.search.FilterOptions;
import br.edu.ifba.meetingrag.search.SearchFilters;

/**
 * Persistence of chunks, their relationships and their entities.
 *
 * <p>A document's chunk set is only ever replaced as a whole, inside one transaction,
 * so readers never observe a half-written document.</p>
 */
public interface ChunkStore {

    /**
     * Deletes every chunk, relationship and entity of {@code documentId} and inserts the new set.
     * Entities are taken from {@link Chunk#entities()}.
     */
    void replaceDocumentChunks(String documentId, List<Chunk> chunks, List<ChunkRelationship> relationships);

    /**
     * Chunks of a document ordered by position, embeddings decoded.
     */
    List<Chunk> findByDocument(String documentId);

    Optional<Chunk> findById(String chunkId);

    /**
     * Embedded chunks matching {@code filters}, most recent documents first.
     */
    List<CandidateChunk> findSearchCandidates(SearchFilters filters, int limit);

    /**
     * Chunks whose content contains {@code query} (case-insensitive), most recent documents first.
     */
    List<CandidateChunk> searchText(String query, SearchFilters filters, int limit);

    ChunkNeighbours findNeighbours(String chunkId);

    List<ChunkRelationship> findRelationships(String documentId);

    List<ExtractedEntity> findEntities(String documentId);

    long countChunks();

    long countEmbedded();

    FilterOptions filterOptions();
}
