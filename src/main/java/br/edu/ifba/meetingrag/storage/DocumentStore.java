package br.edu.ifba.meetingrag.storage;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persistence of {@link Document} records. Documents are never deleted here.
 */
public interface DocumentStore {

    /**
     * Inserts the document or updates its descriptive fields. The processing fields
     * (processed flag, chunk count, last-processed time, state) of an existing row are kept.
     */
    void upsert(Document document);

    Optional<Document> findById(String id);

    /**
     * Documents whose processed flag is false and that are not in {@link DocumentState#FAILED},
     * oldest first.
     */
    List<Document> findUnprocessed(int limit);

    void updateState(String id, DocumentState state, Instant at);

    /**
     * Records a completed run: processed flag set, state {@link DocumentState#INDEXED}.
     */
    void markProcessed(String id, int chunkCount, int wordCount, Instant at);

    Map<DocumentState, Long> countByState();
}
