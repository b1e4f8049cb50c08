package br.edu.ifba.meetingrag.storage.impl;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import br.edu.ifba.meetingrag.storage.Document;
import br.edu.ifba.meetingrag.storage.DocumentState;

class SQLiteDocumentStoreTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    @TempDir
    Path tempDir;

    private SQLiteConnectionManager connectionManager;
    private SQLiteDocumentStore store;

    @BeforeEach
    void setUp() throws Exception {
        connectionManager = new SQLiteConnectionManager(tempDir.resolve("documents.db").toString());
        Connection conn = connectionManager.getWriteConnection();
        try {
            new SQLiteSchemaMigrator().migrateToLatest(conn);
        } finally {
            connectionManager.releaseWriteConnection(conn);
        }
        store = new SQLiteDocumentStore(connectionManager);
    }

    @AfterEach
    void tearDown() {
        connectionManager.close();
    }

    @Test
    void upsertAndFindRoundTripsAllFields() {
        Document document = Document.create("doc-1", "Weekly sync", T0, "transcripts/doc-1.txt", 120, T0)
            .withClassification("meeting", "apollo", "engineering", List.of("weekly", "planning"))
            .withParticipants(List.of("Alice", "Bob"), 1800);

        store.upsert(document);

        Document loaded = store.findById("doc-1").orElseThrow();
        assertEquals(document, loaded);
    }

    @Test
    void upsertKeepsProcessingFieldsOfExistingDocument() {
        store.upsert(Document.create("doc-1", "Weekly sync", T0, "transcripts/doc-1.txt", 120, T0));
        store.markProcessed("doc-1", 7, 130, T0.plusSeconds(60));

        store.upsert(Document.create("doc-1", "Weekly sync (edited)", T0, "transcripts/doc-1.txt", 140,
            T0.plusSeconds(120)));

        Document loaded = store.findById("doc-1").orElseThrow();
        assertEquals("Weekly sync (edited)", loaded.title());
        assertTrue(loaded.processed());
        assertEquals(7, loaded.chunkCount());
        assertEquals(DocumentState.INDEXED, loaded.state());
        assertEquals(T0.plusSeconds(60), loaded.lastProcessedAt());
    }

    @Test
    void findUnprocessedSkipsProcessedAndFailedDocuments() {
        store.upsert(Document.create("doc-a", "A", T0, "a.txt", 1, T0));
        store.upsert(Document.create("doc-b", "B", T0, "b.txt", 1, T0.plusSeconds(1)));
        store.upsert(Document.create("doc-c", "C", T0, "c.txt", 1, T0.plusSeconds(2)));
        store.upsert(Document.create("doc-d", "D", T0, "d.txt", 1, T0.plusSeconds(3)));
        store.markProcessed("doc-b", 3, 1, T0);
        store.updateState("doc-c", DocumentState.FAILED, T0);

        List<String> ids = store.findUnprocessed(10).stream().map(Document::id).toList();

        assertEquals(List.of("doc-a", "doc-d"), ids);
        assertEquals(1, store.findUnprocessed(1).size());
    }

    @Test
    void updateStateDoesNotTouchProcessedFlag() {
        store.upsert(Document.create("doc-1", "Weekly sync", T0, "doc-1.txt", 10, T0));

        store.updateState("doc-1", DocumentState.SEGMENTED, T0.plusSeconds(5));

        Document loaded = store.findById("doc-1").orElseThrow();
        assertEquals(DocumentState.SEGMENTED, loaded.state());
        assertFalse(loaded.processed());
        assertEquals(T0.plusSeconds(5), loaded.updatedAt());
    }

    @Test
    void markProcessedOfUnknownDocumentFails() {
        assertThrows(IllegalStateException.class, () -> store.markProcessed("missing", 1, 1, T0));
    }

    @Test
    void countByStateReportsEveryState() {
        store.upsert(Document.create("doc-a", "A", null, "a.txt", 1, T0));
        store.upsert(Document.create("doc-b", "B", null, "b.txt", 1, T0));
        store.markProcessed("doc-b", 1, 1, T0);

        Map<DocumentState, Long> counts = store.countByState();

        assertEquals(DocumentState.values().length, counts.size());
        assertEquals(1L, counts.get(DocumentState.NEW));
        assertEquals(1L, counts.get(DocumentState.INDEXED));
        assertEquals(0L, counts.get(DocumentState.FAILED));
    }
}
