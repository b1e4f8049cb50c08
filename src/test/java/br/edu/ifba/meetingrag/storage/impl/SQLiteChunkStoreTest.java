package br.edu.ifba.meetingrag.storage.impl;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import br.edu.ifba.meetingrag.chunking.Chunk;
import br.edu.ifba.meetingrag.chunking.ChunkRelationship;
import br.edu.ifba.meetingrag.chunking.ChunkType;
import br.edu.ifba.meetingrag.chunking.RelationshipType;
import br.edu.ifba.meetingrag.extraction.EntityType;
import br.edu.ifba.meetingrag.extraction.ExtractedEntity;
import br.edu.ifba.meetingrag.search.FilterOptions;
import br.edu.ifba.meetingrag.search.SearchFilters;
import br.edu.ifba.meetingrag.storage.CandidateChunk;
import br.edu.ifba.meetingrag.storage.ChunkNeighbours;
import br.edu.ifba.meetingrag.storage.Document;

class SQLiteChunkStoreTest {

    private static final Instant MARCH = Instant.parse("2024-03-10T09:00:00Z");
    private static final Instant APRIL = Instant.parse("2024-04-10T09:00:00Z");

    @TempDir
    Path tempDir;

    private SQLiteConnectionManager connectionManager;
    private SQLiteDocumentStore documentStore;
    private SQLiteChunkStore store;

    @BeforeEach
    void setUp() throws Exception {
        connectionManager = new SQLiteConnectionManager(tempDir.resolve("chunks.db").toString());
        Connection conn = connectionManager.getWriteConnection();
        try {
            new SQLiteSchemaMigrator().migrateToLatest(conn);
        } finally {
            connectionManager.releaseWriteConnection(conn);
        }
        documentStore = new SQLiteDocumentStore(connectionManager);
        store = new SQLiteChunkStore(connectionManager);

        documentStore.upsert(Document.create("march", "Planning", MARCH, "march.txt", 100, MARCH)
            .withClassification("meeting", "apollo", "engineering", List.of("planning")));
        documentStore.upsert(Document.create("april", "Retro", APRIL, "april.txt", 100, APRIL)
            .withClassification("retro", "zeus", "sales", List.of("retro")));
    }

    @AfterEach
    void tearDown() {
        connectionManager.close();
    }

    private static Chunk chunk(String documentId, int position, ChunkType type, String content, String speaker,
            float[] embedding, List<ExtractedEntity> entities) {
        String id = documentId + "_" + position;
        return new Chunk(id, documentId, position, type, content, speaker, position * 60, position * 60 + 60, 10,
            0.5, List.of("budget"), entities, embedding, embedding == null ? null : "test-model",
            position > 1 ? documentId + "_" + (position - 1) : null, null,
            position > 0 ? documentId + "_0" : null);
    }

    private void storeMarchChunks() {
        ExtractedEntity decision = new ExtractedEntity(EntityType.DECISION, "ship on Friday", 0.95, "march_1", 4,
            Map.of(ExtractedEntity.RULE, "decision-label"));
        List<Chunk> chunks = List.of(
            chunk("march", 0, ChunkType.FULL_DOCUMENT, "Full planning transcript", null, new float[] {1, 0, 0},
                List.of()),
            chunk("march", 1, ChunkType.TIME_WINDOW, "Decision: ship on Friday", "Alice", new float[] {0, 1, 0},
                List.of(decision)),
            chunk("march", 2, ChunkType.TIME_WINDOW, "Budget is 100% approved", "Bob", null, List.of()));
        List<ChunkRelationship> relationships = List.of(
            new ChunkRelationship("march_1", "march_2", RelationshipType.SEQUENTIAL, 1.0),
            new ChunkRelationship("march_0", "march_1", RelationshipType.PARENT_CHILD, 1.0),
            new ChunkRelationship("march_0", "march_2", RelationshipType.PARENT_CHILD, 1.0));
        store.replaceDocumentChunks("march", chunks, relationships);
    }

    private void storeAprilChunks() {
        store.replaceDocumentChunks("april", List.of(
            chunk("april", 0, ChunkType.FULL_DOCUMENT, "Retro transcript", null, new float[] {0, 0, 1}, List.of()),
            chunk("april", 1, ChunkType.SPEAKER_TURN, "Alice says the budget slipped", "alice",
                new float[] {0, 1, 1}, List.of())), List.of());
    }

    @Nested
    @DisplayName("Replacing a document's chunk set")
    class Replace {

        @Test
        void storedChunksLoadInPositionOrderWithEmbeddingsAndEntities() {
            storeMarchChunks();

            List<Chunk> loaded = store.findByDocument("march");

            assertEquals(List.of("march_0", "march_1", "march_2"), loaded.stream().map(Chunk::id).toList());
            assertArrayEquals(new float[] {0, 1, 0}, loaded.get(1).embedding());
            assertEquals("test-model", loaded.get(1).embeddingModel());
            assertNull(loaded.get(2).embedding());
            assertEquals("march_0", loaded.get(1).parentChunkId());
            assertEquals(List.of("budget"), loaded.get(1).topics());

            ExtractedEntity entity = loaded.get(1).entities().get(0);
            assertEquals(EntityType.DECISION, entity.type());
            assertEquals("march_1", entity.sourceChunkId());
            assertEquals("decision-label", entity.metadata().get(ExtractedEntity.RULE));
            assertEquals(1, store.findEntities("march").size());
            assertEquals(3, store.findRelationships("march").size());
        }

        @Test
        void replacingRemovesThePreviousSet() {
            storeMarchChunks();

            store.replaceDocumentChunks("march", List.of(
                chunk("march", 0, ChunkType.FULL_DOCUMENT, "Rewritten transcript", null, null, List.of())), List.of());

            assertEquals(1, store.findByDocument("march").size());
            assertTrue(store.findRelationships("march").isEmpty());
            assertTrue(store.findEntities("march").isEmpty());
            assertEquals(1, store.countChunks());
            assertEquals(0, store.countEmbedded());
        }

        @Test
        void chunksOfAnotherDocumentAreRejected() {
            List<Chunk> chunks = List.of(chunk("april", 0, ChunkType.FULL_DOCUMENT, "x", null, null, List.of()));

            assertThrows(IllegalArgumentException.class, () -> store.replaceDocumentChunks("march", chunks, List.of()));
        }

        @Test
        void failedReplaceLeavesPreviousSetIntact() {
            storeMarchChunks();
            List<ChunkRelationship> dangling = List.of(
                new ChunkRelationship("march_0", "nowhere_9", RelationshipType.PARENT_CHILD, 1.0));

            assertThrows(RuntimeException.class, () -> store.replaceDocumentChunks("march",
                List.of(chunk("march", 0, ChunkType.FULL_DOCUMENT, "new", null, null, List.of())), dangling));

            assertEquals(3, store.findByDocument("march").size());
        }
    }

    @Nested
    @DisplayName("Candidate selection")
    class Candidates {

        @BeforeEach
        void storeBoth() {
            storeMarchChunks();
            storeAprilChunks();
        }

        @Test
        void onlyEmbeddedChunksAreCandidatesMostRecentFirst() {
            List<CandidateChunk> candidates = store.findSearchCandidates(SearchFilters.none(), 10);

            assertEquals(List.of("april_0", "april_1", "march_0", "march_1"),
                candidates.stream().map(candidate -> candidate.chunk().id()).toList());
            assertEquals("Retro", candidates.get(0).documentTitle());
            assertEquals(APRIL, candidates.get(0).documentDate());
            assertEquals(12, candidates.get(0).embeddingBlob().length);
        }

        @Test
        void dateSpeakerAndTypeFiltersApply() {
            SearchFilters marchOnly = SearchFilters.builder().from(MARCH).to(MARCH.plusSeconds(3600)).build();
            assertTrue(store.findSearchCandidates(marchOnly, 10).stream()
                .allMatch(candidate -> candidate.chunk().documentId().equals("march")));

            SearchFilters alice = SearchFilters.builder().speaker("ALICE").build();
            assertEquals(List.of("april_1", "march_1"), store.findSearchCandidates(alice, 10).stream()
                .map(candidate -> candidate.chunk().id()).toList());

            SearchFilters fullOnly = SearchFilters.builder().chunkType(ChunkType.FULL_DOCUMENT).build();
            assertEquals(2, store.findSearchCandidates(fullOnly, 10).size());
        }

        @Test
        void metadataAndTagFiltersApply() {
            SearchFilters retroTag = SearchFilters.builder().tag("RETRO").build();
            assertTrue(store.findSearchCandidates(retroTag, 10).stream()
                .allMatch(candidate -> candidate.chunk().documentId().equals("april")));

            SearchFilters project = SearchFilters.builder().project("apollo").department("Engineering").build();
            assertEquals(2, store.findSearchCandidates(project, 10).size());

            SearchFilters nothing = SearchFilters.builder().category("board").build();
            assertTrue(store.findSearchCandidates(nothing, 10).isEmpty());
        }

        @Test
        void limitIsApplied() {
            assertEquals(3, store.findSearchCandidates(SearchFilters.none(), 3).size());
        }

        @Test
        void textSearchIsCaseInsensitiveAndEscapesWildcards() {
            List<CandidateChunk> budget = store.searchText("BUDGET", SearchFilters.none(), 10);
            assertEquals(List.of("april_1", "march_2"), budget.stream().map(candidate -> candidate.chunk().id()).toList());
            assertNull(budget.get(0).embeddingBlob());

            assertEquals(List.of("march_2"), store.searchText("100%", SearchFilters.none(), 10).stream()
                .map(candidate -> candidate.chunk().id()).toList());
            assertTrue(store.searchText("_", SearchFilters.none(), 10).isEmpty());
        }
    }

    @Test
    void neighboursFollowSequentialRelationships() {
        storeMarchChunks();

        ChunkNeighbours neighbours = store.findNeighbours("march_1");
        assertNull(neighbours.previous());
        assertEquals("march_2", neighbours.next().id());

        ChunkNeighbours last = store.findNeighbours("march_2");
        assertEquals("march_1", last.previous().id());
        assertNull(last.next());
    }

    @Test
    void corruptEmbeddingLoadsWithoutVector() throws Exception {
        storeMarchChunks();
        Connection conn = connectionManager.getWriteConnection();
        try (PreparedStatement stmt = conn.prepareStatement("UPDATE chunks SET embedding = ? WHERE id = 'march_1'")) {
            stmt.setBytes(1, new byte[] {1, 2, 3, 4, 5});
            stmt.executeUpdate();
        } finally {
            connectionManager.releaseWriteConnection(conn);
        }

        Chunk loaded = store.findById("march_1").orElseThrow();

        assertFalse(loaded.hasEmbedding());
        assertNull(loaded.embeddingModel());
    }

    @Test
    void filterOptionsListDistinctValues() {
        storeMarchChunks();
        storeAprilChunks();

        FilterOptions options = store.filterOptions();

        assertEquals(List.of("meeting", "retro"), options.categories());
        assertEquals(List.of("apollo", "zeus"), options.projects());
        assertEquals(List.of("engineering", "sales"), options.departments());
        assertEquals(List.of("planning", "retro"), options.tags());
        assertTrue(options.speakers().containsAll(List.of("Alice", "Bob", "alice")));
    }
}
