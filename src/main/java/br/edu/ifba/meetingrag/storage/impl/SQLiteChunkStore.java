package br.edu.ifba.meetingrag.storage.impl;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.jboss.logging.Logger;

import br.edu.ifba.meetingrag.chunking.Chunk;
import br.edu.ifba.meetingrag.chunking.ChunkRelationship;
import br.edu.ifba.meetingrag.chunking.ChunkType;
import br.edu.ifba.meetingrag.chunking.RelationshipType;
import br.edu.ifba.meetingrag.embedding.VectorCodec;
import br.edu.ifba.meetingrag.extraction.EntityType;
import br.edu.ifba.meetingrag.extraction.ExtractedEntity;
import br.edu.ifba.meetingrag.search.FilterOptions;
import br.edu.ifba.meetingrag.search.SearchFilters;
import br.edu.ifba.meetingrag.storage.CandidateChunk;
import br.edu.ifba.meetingrag.storage.ChunkNeighbours;
import br.edu.ifba.meetingrag.storage.ChunkStore;

/**
 * SQLite implementation of {@link ChunkStore}.
 *
 * <p>Vectors are stored as little-endian float32 BLOBs ({@link VectorCodec}). Ranking is
 * done in Java by the search service; this store only selects candidates. A chunk set is
 * replaced with delete-then-insert in one write transaction.</p>
 */
public final class SQLiteChunkStore implements ChunkStore {

    private static final Logger LOG = Logger.getLogger(SQLiteChunkStore.class);

    private static final String CHUNK_COLUMNS = """
        c.id, c.document_id, c.position, c.type, c.content, c.speaker, c.start_seconds, c.end_seconds,
        c.token_count, c.importance, c.topics, c.embedding, c.embedding_model, c.previous_chunk_id,
        c.next_chunk_id, c.parent_chunk_id
        """;

    private final SQLiteConnectionManager connectionManager;

    public SQLiteChunkStore(SQLiteConnectionManager connectionManager) {
        this.connectionManager = connectionManager;
    }

    @Override
    public void replaceDocumentChunks(String documentId, List<Chunk> chunks, List<ChunkRelationship> relationships) {
        for (Chunk chunk : chunks) {
            if (!chunk.documentId().equals(documentId)) {
                throw new IllegalArgumentException(
                    "Chunk " + chunk.id() + " belongs to " + chunk.documentId() + ", not " + documentId);
            }
        }

        int deleted = connectionManager.inWriteTransaction("replace chunks of document " + documentId, conn -> {
            int removed = deleteDocumentRows(conn, documentId);
            insertChunks(conn, chunks);
            insertRelationships(conn, documentId, relationships);
            insertEntities(conn, documentId, chunks);
            return removed;
        });

        LOG.debugf("Replaced %d chunks of document %s with %d chunks and %d relationships",
            deleted, documentId, chunks.size(), relationships.size());
    }

    private static int deleteDocumentRows(Connection conn, String documentId) throws SQLException {
        try (PreparedStatement entities = conn.prepareStatement("DELETE FROM extracted_entities WHERE document_id = ?");
             PreparedStatement relationships = conn.prepareStatement("DELETE FROM chunk_relationships WHERE document_id = ?");
             PreparedStatement chunks = conn.prepareStatement("DELETE FROM chunks WHERE document_id = ?")) {
            entities.setString(1, documentId);
            entities.executeUpdate();
            relationships.setString(1, documentId);
            relationships.executeUpdate();
            chunks.setString(1, documentId);
            return chunks.executeUpdate();
        }
    }

    private static void insertChunks(Connection conn, List<Chunk> chunks) throws SQLException {
        String sql = """
            INSERT INTO chunks (id, document_id, position, type, content, speaker, start_seconds, end_seconds,
                token_count, importance, topics, embedding, embedding_model, previous_chunk_id, next_chunk_id,
                parent_chunk_id)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            for (Chunk chunk : chunks) {
                stmt.setString(1, chunk.id());
                stmt.setString(2, chunk.documentId());
                stmt.setInt(3, chunk.position());
                stmt.setString(4, chunk.type().label());
                stmt.setString(5, chunk.content());
                stmt.setString(6, chunk.speaker());
                SqlColumns.setInteger(stmt, 7, chunk.startSeconds());
                SqlColumns.setInteger(stmt, 8, chunk.endSeconds());
                stmt.setInt(9, chunk.tokenCount());
                stmt.setDouble(10, chunk.importance());
                stmt.setString(11, JsonColumns.write(chunk.topics()));
                if (chunk.hasEmbedding()) {
                    stmt.setBytes(12, VectorCodec.encode(chunk.embedding()));
                } else {
                    stmt.setNull(12, Types.BLOB);
                }
                stmt.setString(13, chunk.embeddingModel());
                stmt.setString(14, chunk.previousChunkId());
                stmt.setString(15, chunk.nextChunkId());
                stmt.setString(16, chunk.parentChunkId());
                stmt.addBatch();
            }
            stmt.executeBatch();
        }
    }

    private static void insertRelationships(Connection conn, String documentId, List<ChunkRelationship> relationships)
            throws SQLException {
        String sql = """
            INSERT INTO chunk_relationships (source_chunk_id, target_chunk_id, document_id, type, strength)
            VALUES (?, ?, ?, ?, ?)
            """;
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            for (ChunkRelationship relationship : relationships) {
                stmt.setString(1, relationship.sourceChunkId());
                stmt.setString(2, relationship.targetChunkId());
                stmt.setString(3, documentId);
                stmt.setString(4, relationship.type().label());
                stmt.setDouble(5, relationship.strength());
                stmt.addBatch();
            }
            stmt.executeBatch();
        }
    }

    private static void insertEntities(Connection conn, String documentId, List<Chunk> chunks) throws SQLException {
        String sql = """
            INSERT INTO extracted_entities (document_id, chunk_id, type, value, confidence, char_offset, metadata)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            """;
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            for (Chunk chunk : chunks) {
                for (ExtractedEntity entity : chunk.entities()) {
                    stmt.setString(1, documentId);
                    stmt.setString(2, chunk.id());
                    stmt.setString(3, entity.type().label());
                    stmt.setString(4, entity.value());
                    stmt.setDouble(5, entity.confidence());
                    stmt.setInt(6, entity.offset());
                    stmt.setString(7, JsonColumns.write(entity.metadata()));
                    stmt.addBatch();
                }
            }
            stmt.executeBatch();
        }
    }

    @Override
    public List<Chunk> findByDocument(String documentId) {
        return connectionManager.read("load chunks of document " + documentId, conn -> {
            Map<String, List<ExtractedEntity>> entitiesByChunk = new HashMap<>();
            for (ExtractedEntity entity : loadEntities(conn, documentId)) {
                entitiesByChunk.computeIfAbsent(entity.sourceChunkId(), id -> new ArrayList<>()).add(entity);
            }

            String sql = "SELECT " + CHUNK_COLUMNS + " FROM chunks c WHERE c.document_id = ? ORDER BY c.position";
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                stmt.setString(1, documentId);
                try (ResultSet rs = stmt.executeQuery()) {
                    List<Chunk> chunks = new ArrayList<>();
                    while (rs.next()) {
                        chunks.add(toChunk(rs, entitiesByChunk.getOrDefault(rs.getString("id"), List.of()), true));
                    }
                    return chunks;
                }
            }
        });
    }

    @Override
    public Optional<Chunk> findById(String chunkId) {
        return connectionManager.read("load chunk " + chunkId, conn -> {
            try (PreparedStatement stmt = conn.prepareStatement("SELECT " + CHUNK_COLUMNS + " FROM chunks c WHERE c.id = ?")) {
                stmt.setString(1, chunkId);
                try (ResultSet rs = stmt.executeQuery()) {
                    return rs.next() ? Optional.of(toChunk(rs, List.of(), true)) : Optional.<Chunk>empty();
                }
            }
        });
    }

    @Override
    public List<CandidateChunk> findSearchCandidates(SearchFilters filters, int limit) {
        FilterClause filter = FilterClause.of(filters);
        String sql = "SELECT " + CHUNK_COLUMNS + ", d.title AS document_title, d.source_date AS document_date"
            + " FROM chunks c JOIN documents d ON d.id = c.document_id"
            + " WHERE c.embedding IS NOT NULL" + filter.sql()
            + " ORDER BY d.source_date IS NULL, d.source_date DESC, c.document_id, c.position LIMIT ?";
        return queryCandidates("select search candidates", sql, filter.parameters(), limit, true);
    }

    @Override
    public List<CandidateChunk> searchText(String query, SearchFilters filters, int limit) {
        FilterClause filter = FilterClause.of(filters);
        List<Object> parameters = new ArrayList<>();
        parameters.add("%" + escapeLike(query.trim()) + "%");
        parameters.addAll(filter.parameters());
        String sql = "SELECT " + CHUNK_COLUMNS + ", d.title AS document_title, d.source_date AS document_date"
            + " FROM chunks c JOIN documents d ON d.id = c.document_id"
            + " WHERE c.content LIKE ? ESCAPE '\\'" + filter.sql()
            + " ORDER BY d.source_date IS NULL, d.source_date DESC, c.document_id, c.position LIMIT ?";
        return queryCandidates("search chunk text", sql, parameters, limit, false);
    }

    private List<CandidateChunk> queryCandidates(String operation, String sql, List<Object> parameters, int limit,
            boolean withEmbedding) {
        return connectionManager.read(operation, conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                int index = bind(stmt, 1, parameters);
                stmt.setInt(index, limit);
                try (ResultSet rs = stmt.executeQuery()) {
                    List<CandidateChunk> candidates = new ArrayList<>();
                    while (rs.next()) {
                        candidates.add(new CandidateChunk(
                            toChunk(rs, List.of(), false),
                            withEmbedding ? rs.getBytes("embedding") : null,
                            rs.getString("document_title"),
                            SqlColumns.getInstant(rs, "document_date")));
                    }
                    return candidates;
                }
            }
        });
    }

    @Override
    public ChunkNeighbours findNeighbours(String chunkId) {
        String previousSql = "SELECT " + CHUNK_COLUMNS + """
             FROM chunk_relationships r JOIN chunks c ON c.id = r.source_chunk_id
            WHERE r.target_chunk_id = ? AND r.type = 'sequential'
            """;
        String nextSql = "SELECT " + CHUNK_COLUMNS + """
             FROM chunk_relationships r JOIN chunks c ON c.id = r.target_chunk_id
            WHERE r.source_chunk_id = ? AND r.type = 'sequential'
            """;
        return connectionManager.read("load neighbours of chunk " + chunkId, conn ->
            new ChunkNeighbours(singleChunk(conn, previousSql, chunkId), singleChunk(conn, nextSql, chunkId)));
    }

    private Chunk singleChunk(Connection conn, String sql, String parameter) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, parameter);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? toChunk(rs, List.of(), false) : null;
            }
        }
    }

    @Override
    public List<ChunkRelationship> findRelationships(String documentId) {
        return connectionManager.read("load relationships of document " + documentId, conn -> {
            try (PreparedStatement stmt = conn.prepareStatement("""
                    SELECT source_chunk_id, target_chunk_id, type, strength
                      FROM chunk_relationships
                     WHERE document_id = ?
                     ORDER BY rowid
                    """)) {
                stmt.setString(1, documentId);
                try (ResultSet rs = stmt.executeQuery()) {
                    List<ChunkRelationship> relationships = new ArrayList<>();
                    while (rs.next()) {
                        relationships.add(new ChunkRelationship(
                            rs.getString("source_chunk_id"),
                            rs.getString("target_chunk_id"),
                            RelationshipType.fromLabel(rs.getString("type")),
                            rs.getDouble("strength")));
                    }
                    return relationships;
                }
            }
        });
    }

    @Override
    public List<ExtractedEntity> findEntities(String documentId) {
        return connectionManager.read("load entities of document " + documentId, conn -> loadEntities(conn, documentId));
    }

    private static List<ExtractedEntity> loadEntities(Connection conn, String documentId) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement("""
                SELECT chunk_id, type, value, confidence, char_offset, metadata
                  FROM extracted_entities
                 WHERE document_id = ?
                 ORDER BY id
                """)) {
            stmt.setString(1, documentId);
            try (ResultSet rs = stmt.executeQuery()) {
                List<ExtractedEntity> entities = new ArrayList<>();
                while (rs.next()) {
                    entities.add(new ExtractedEntity(
                        EntityType.fromLabel(rs.getString("type")),
                        rs.getString("value"),
                        rs.getDouble("confidence"),
                        rs.getString("chunk_id"),
                        rs.getInt("char_offset"),
                        JsonColumns.stringMap(rs.getString("metadata"))));
                }
                return entities;
            }
        }
    }

    @Override
    public long countChunks() {
        return count("SELECT COUNT(*) FROM chunks");
    }

    @Override
    public long countEmbedded() {
        return count("SELECT COUNT(*) FROM chunks WHERE embedding IS NOT NULL");
    }

    private long count(String sql) {
        return connectionManager.read("count chunks", conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(sql);
                 ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        });
    }

    @Override
    public FilterOptions filterOptions() {
        return connectionManager.read("load filter options", conn -> new FilterOptions(
            distinct(conn, "SELECT DISTINCT category FROM documents WHERE category IS NOT NULL ORDER BY 1"),
            distinct(conn, "SELECT DISTINCT project FROM documents WHERE project IS NOT NULL ORDER BY 1"),
            distinct(conn, "SELECT DISTINCT department FROM documents WHERE department IS NOT NULL ORDER BY 1"),
            distinct(conn, "SELECT DISTINCT speaker FROM chunks WHERE speaker IS NOT NULL ORDER BY 1"),
            distinct(conn, "SELECT DISTINCT j.value FROM documents d, json_each(d.tags) j ORDER BY 1")));
    }

    private static List<String> distinct(Connection conn, String sql) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(sql);
             ResultSet rs = stmt.executeQuery()) {
            List<String> values = new ArrayList<>();
            while (rs.next()) {
                values.add(rs.getString(1));
            }
            return values;
        }
    }

    private Chunk toChunk(ResultSet rs, List<ExtractedEntity> entities, boolean decodeEmbedding) throws SQLException {
        String id = rs.getString("id");
        float[] embedding = null;
        if (decodeEmbedding) {
            byte[] blob = rs.getBytes("embedding");
            if (blob != null) {
                try {
                    embedding = VectorCodec.decode(blob);
                } catch (IllegalArgumentException e) {
                    LOG.warnf("Chunk %s has a corrupt embedding, loading it without one: %s", id, e.getMessage());
                }
            }
        }
        return new Chunk(
            id,
            rs.getString("document_id"),
            rs.getInt("position"),
            ChunkType.fromLabel(rs.getString("type")),
            rs.getString("content"),
            rs.getString("speaker"),
            SqlColumns.getInteger(rs, "start_seconds"),
            SqlColumns.getInteger(rs, "end_seconds"),
            rs.getInt("token_count"),
            rs.getDouble("importance"),
            JsonColumns.stringList(rs.getString("topics")),
            entities,
            embedding,
            embedding == null ? null : rs.getString("embedding_model"),
            rs.getString("previous_chunk_id"),
            rs.getString("next_chunk_id"),
            rs.getString("parent_chunk_id"));
    }

    private static int bind(PreparedStatement stmt, int start, List<Object> parameters) throws SQLException {
        int index = start;
        for (Object parameter : parameters) {
            stmt.setObject(index++, parameter);
        }
        return index;
    }

    static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    /**
     * SQL fragment for {@link SearchFilters}, appended to a WHERE clause over
     * {@code chunks c JOIN documents d}.
     */
    record FilterClause(String sql, List<Object> parameters) {

        static FilterClause of(SearchFilters filters) {
            StringBuilder sql = new StringBuilder();
            List<Object> parameters = new ArrayList<>();

            if (filters.from() != null) {
                sql.append(" AND d.source_date >= ?");
                parameters.add(filters.from().toEpochMilli());
            }
            if (filters.to() != null) {
                sql.append(" AND d.source_date <= ?");
                parameters.add(filters.to().toEpochMilli());
            }
            equalsIgnoreCase(sql, parameters, "d.category", filters.category());
            equalsIgnoreCase(sql, parameters, "d.project", filters.project());
            equalsIgnoreCase(sql, parameters, "d.department", filters.department());
            equalsIgnoreCase(sql, parameters, "c.speaker", filters.speaker());
            if (!filters.tags().isEmpty()) {
                sql.append(" AND EXISTS (SELECT 1 FROM json_each(d.tags) t WHERE t.value COLLATE NOCASE IN (")
                    .append(placeholders(filters.tags().size())).append("))");
                parameters.addAll(filters.tags());
            }
            if (!filters.chunkTypes().isEmpty()) {
                sql.append(" AND c.type IN (").append(placeholders(filters.chunkTypes().size())).append(')');
                filters.chunkTypes().stream().map(ChunkType::label).sorted().forEach(parameters::add);
            }
            if (!filters.documentIds().isEmpty()) {
                sql.append(" AND c.document_id IN (").append(placeholders(filters.documentIds().size())).append(')');
                parameters.addAll(filters.documentIds());
            }
            return new FilterClause(sql.toString(), parameters);
        }

        private static void equalsIgnoreCase(StringBuilder sql, List<Object> parameters, String column, String value) {
            if (value != null && !value.isBlank()) {
                sql.append(" AND ").append(column).append(" = ? COLLATE NOCASE");
                parameters.add(value.trim());
            }
        }

        private static String placeholders(int count) {
            return String.join(", ", Collections.nCopies(count, "?"));
        }
    }
}
