package br.edu.ifba.meetingrag.storage.impl;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.jboss.logging.Logger;

import br.edu.ifba.meetingrag.storage.Document;
import br.edu.ifba.meetingrag.storage.DocumentState;
import br.edu.ifba.meetingrag.storage.DocumentStore;

/**
 * SQLite implementation of {@link DocumentStore}.
 */
public final class SQLiteDocumentStore implements DocumentStore {

    private static final Logger LOG = Logger.getLogger(SQLiteDocumentStore.class);

    private static final String COLUMNS = """
        id, title, source_date, raw_content_key, word_count, processed, chunk_count, last_processed_at,
        state, category, project, department, tags, participants, duration_seconds, created_at, updated_at
        """;

    private final SQLiteConnectionManager connectionManager;

    public SQLiteDocumentStore(SQLiteConnectionManager connectionManager) {
        this.connectionManager = connectionManager;
    }

    @Override
    public void upsert(Document document) {
        String sql = """
            INSERT INTO documents (id, title, source_date, raw_content_key, word_count, processed, chunk_count,
                last_processed_at, state, category, project, department, tags, participants, duration_seconds,
                created_at, updated_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT(id) DO UPDATE SET
                title = excluded.title,
                source_date = excluded.source_date,
                raw_content_key = excluded.raw_content_key,
                word_count = excluded.word_count,
                category = excluded.category,
                project = excluded.project,
                department = excluded.department,
                tags = excluded.tags,
                participants = excluded.participants,
                duration_seconds = excluded.duration_seconds,
                updated_at = excluded.updated_at
            """;

        connectionManager.inWriteTransaction("upsert document " + document.id(), conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                stmt.setString(1, document.id());
                stmt.setString(2, document.title());
                SqlColumns.setInstant(stmt, 3, document.sourceDate());
                stmt.setString(4, document.rawContentKey());
                stmt.setInt(5, document.wordCount());
                stmt.setInt(6, document.processed() ? 1 : 0);
                stmt.setInt(7, document.chunkCount());
                SqlColumns.setInstant(stmt, 8, document.lastProcessedAt());
                stmt.setString(9, document.state().name());
                stmt.setString(10, document.category());
                stmt.setString(11, document.project());
                stmt.setString(12, document.department());
                stmt.setString(13, JsonColumns.write(document.tags()));
                stmt.setString(14, JsonColumns.write(document.participants()));
                SqlColumns.setInteger(stmt, 15, document.durationSeconds());
                SqlColumns.setInstant(stmt, 16, document.createdAt());
                SqlColumns.setInstant(stmt, 17, document.updatedAt());
                return stmt.executeUpdate();
            }
        });
        LOG.debugf("Upserted document %s", document.id());
    }

    @Override
    public Optional<Document> findById(String id) {
        return connectionManager.read("find document " + id, conn -> {
            try (PreparedStatement stmt = conn.prepareStatement("SELECT " + COLUMNS + " FROM documents WHERE id = ?")) {
                stmt.setString(1, id);
                try (ResultSet rs = stmt.executeQuery()) {
                    return rs.next() ? Optional.of(toDocument(rs)) : Optional.<Document>empty();
                }
            }
        });
    }

    @Override
    public List<Document> findUnprocessed(int limit) {
        String sql = "SELECT " + COLUMNS + """
             FROM documents
            WHERE processed = 0 AND state <> 'FAILED'
            ORDER BY created_at, id
            LIMIT ?
            """;
        return connectionManager.read("find unprocessed documents", conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                stmt.setInt(1, limit);
                try (ResultSet rs = stmt.executeQuery()) {
                    List<Document> documents = new ArrayList<>();
                    while (rs.next()) {
                        documents.add(toDocument(rs));
                    }
                    return documents;
                }
            }
        });
    }

    @Override
    public void updateState(String id, DocumentState state, Instant at) {
        int updated = connectionManager.inWriteTransaction("update state of document " + id, conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(
                    "UPDATE documents SET state = ?, updated_at = ? WHERE id = ?")) {
                stmt.setString(1, state.name());
                stmt.setLong(2, at.toEpochMilli());
                stmt.setString(3, id);
                return stmt.executeUpdate();
            }
        });
        if (updated == 0) {
            LOG.warnf("State update to %s ignored, document %s does not exist", state, id);
        }
    }

    @Override
    public void markProcessed(String id, int chunkCount, int wordCount, Instant at) {
        String sql = """
            UPDATE documents
               SET processed = 1, chunk_count = ?, word_count = ?, last_processed_at = ?, state = 'INDEXED', updated_at = ?
             WHERE id = ?
            """;
        int updated = connectionManager.inWriteTransaction("mark document " + id + " processed", conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                stmt.setInt(1, chunkCount);
                stmt.setInt(2, wordCount);
                stmt.setLong(3, at.toEpochMilli());
                stmt.setLong(4, at.toEpochMilli());
                stmt.setString(5, id);
                return stmt.executeUpdate();
            }
        });
        if (updated == 0) {
            throw new IllegalStateException("Document " + id + " does not exist");
        }
    }

    @Override
    public Map<DocumentState, Long> countByState() {
        return connectionManager.read("count documents by state", conn -> {
            Map<DocumentState, Long> counts = new EnumMap<>(DocumentState.class);
            for (DocumentState state : DocumentState.values()) {
                counts.put(state, 0L);
            }
            try (PreparedStatement stmt = conn.prepareStatement("SELECT state, COUNT(*) FROM documents GROUP BY state");
                 ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    counts.put(DocumentState.valueOf(rs.getString(1)), rs.getLong(2));
                }
            }
            return counts;
        });
    }

    private static Document toDocument(ResultSet rs) throws SQLException {
        return new Document(
            rs.getString("id"),
            rs.getString("title"),
            SqlColumns.getInstant(rs, "source_date"),
            rs.getString("raw_content_key"),
            rs.getInt("word_count"),
            rs.getInt("processed") == 1,
            rs.getInt("chunk_count"),
            SqlColumns.getInstant(rs, "last_processed_at"),
            DocumentState.valueOf(rs.getString("state")),
            rs.getString("category"),
            rs.getString("project"),
            rs.getString("department"),
            JsonColumns.stringList(rs.getString("tags")),
            JsonColumns.stringList(rs.getString("participants")),
            SqlColumns.getInteger(rs, "duration_seconds"),
            SqlColumns.getInstant(rs, "created_at"),
            SqlColumns.getInstant(rs, "updated_at"));
    }
}
