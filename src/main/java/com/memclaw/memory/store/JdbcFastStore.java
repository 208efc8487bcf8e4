package com.memclaw.memory.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.memclaw.memory.Importance;
import com.memclaw.memory.MemoryRecord;
import com.memclaw.memory.MemoryResult;
import com.memclaw.memory.MemoryStats;
import com.memclaw.memory.MemoryStorageException;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalLong;

public class JdbcFastStore implements FastStore {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String RECORD_COLUMNS =
            "id, content, category, importance, metadata, embedding, created_at, access_count, last_accessed_at";

    private final DataSource dataSource;
    private final SyncQueue syncQueue;
    private final Clock clock;

    public JdbcFastStore(DataSource dataSource, SyncQueue syncQueue) {
        this(dataSource, syncQueue, Clock.systemUTC());
    }

    public JdbcFastStore(DataSource dataSource, SyncQueue syncQueue, Clock clock) {
        this.dataSource = dataSource;
        this.syncQueue = syncQueue;
        this.clock = clock;
        initSchema();
    }

    private void initSchema() {
        try (var conn = dataSource.getConnection();
             var st = conn.createStatement()) {
            st.executeUpdate("""
                    CREATE TABLE IF NOT EXISTS memories (
                        id               INTEGER PRIMARY KEY AUTOINCREMENT,
                        content          TEXT    NOT NULL,
                        content_lc       TEXT,
                        category         TEXT    NOT NULL DEFAULT 'general',
                        importance       TEXT    NOT NULL DEFAULT 'medium',
                        metadata         TEXT,
                        embedding        BLOB,
                        created_at       INTEGER NOT NULL,
                        access_count     INTEGER NOT NULL DEFAULT 0,
                        last_accessed_at INTEGER
                    )""");
            st.executeUpdate("CREATE INDEX IF NOT EXISTS idx_memories_category ON memories(category)");
            addLowercaseContent(conn);
            syncQueue.initSchema(conn);
        } catch (SQLException e) {
            throw new MemoryStorageException("Failed to initialise memory schema", e);
        }
    }

    // SQLite's LIKE folds ASCII only, so searches run against a Java-lowercased copy
    private static void addLowercaseContent(Connection conn) throws SQLException {
        boolean present = false;
        try (var st = conn.createStatement();
             var rs = st.executeQuery("PRAGMA table_info(memories)")) {
            while (rs.next()) {
                if ("content_lc".equals(rs.getString("name"))) present = true;
            }
        }
        if (!present) {
            try (var st = conn.createStatement()) {
                st.executeUpdate("ALTER TABLE memories ADD COLUMN content_lc TEXT");
            }
        }
        var missing = new LinkedHashMap<Long, String>();
        try (var st = conn.createStatement();
             var rs = st.executeQuery("SELECT id, content FROM memories WHERE content_lc IS NULL")) {
            while (rs.next()) missing.put(rs.getLong(1), rs.getString(2));
        }
        if (missing.isEmpty()) return;
        try (var ps = conn.prepareStatement("UPDATE memories SET content_lc = ? WHERE id = ?")) {
            for (var e : missing.entrySet()) {
                ps.setString(1, e.getValue().toLowerCase(Locale.ROOT));
                ps.setLong(2, e.getKey());
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    @Override
    public MemoryRecord store(String content, String category, Importance importance, ObjectNode metadata) {
        var createdAt = Instant.ofEpochMilli(clock.millis());
        try (var conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                long id = insertMemory(conn, content, category, importance, metadata, createdAt);
                syncQueue.enqueue(conn, new SyncPayload(id, content, category, importance, createdAt));
                conn.commit();
                return new MemoryRecord(id, content, category, importance, metadata, null, createdAt, 0, null);
            } catch (Exception e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException | JsonProcessingException e) {
            throw new MemoryStorageException("Failed to store memory", e);
        }
    }

    private long insertMemory(Connection conn, String content, String category, Importance importance,
                              ObjectNode metadata, Instant createdAt) throws SQLException, JsonProcessingException {
        var sql = "INSERT INTO memories (content, content_lc, category, importance, metadata, created_at) "
                + "VALUES (?, ?, ?, ?, ?, ?)";
        try (var ps = conn.prepareStatement(sql)) {
            ps.setString(1, content);
            ps.setString(2, content.toLowerCase(Locale.ROOT));
            ps.setString(3, category);
            ps.setString(4, importance.wireName());
            ps.setString(5, metadata == null || metadata.isEmpty() ? null : MAPPER.writeValueAsString(metadata));
            ps.setLong(6, createdAt.toEpochMilli());
            ps.executeUpdate();
        }
        return SyncQueue.lastInsertId(conn);
    }

    @Override
    public List<MemoryResult> recall(String text, int limit) {
        var tokens = tokenize(text);
        List<MemoryResult> results = tokens.isEmpty() ? newest(limit) : scored(tokens, limit);
        recordAccess(results.stream().map(MemoryResult::id).toList());
        return results;
    }

    private List<MemoryResult> newest(int limit) {
        var sql = "SELECT id, content, category, created_at FROM memories ORDER BY created_at DESC, id DESC LIMIT ?";
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(sql)) {
            ps.setInt(1, limit);
            try (var rs = ps.executeQuery()) {
                var results = new ArrayList<MemoryResult>();
                while (rs.next()) results.add(mapResult(rs, 0.0));
                return results;
            }
        } catch (SQLException e) {
            throw new MemoryStorageException("Failed to recall memories", e);
        }
    }

    private List<MemoryResult> scored(List<String> tokens, int limit) {
        // LIKE narrows the candidates, the score is computed here
        var where = new StringBuilder();
        for (int i = 0; i < tokens.size(); i++) {
            if (i > 0) where.append(" OR ");
            where.append("content_lc LIKE ? ESCAPE '\\'");
        }
        var sql = "SELECT id, content, content_lc, category, created_at FROM memories WHERE " + where;
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(sql)) {
            for (int i = 0; i < tokens.size(); i++) {
                ps.setString(i + 1, "%" + escapeLike(tokens.get(i)) + "%");
            }
            var scored = new ArrayList<MemoryResult>();
            try (var rs = ps.executeQuery()) {
                while (rs.next()) {
                    var lower = rs.getString("content_lc");
                    long hits = tokens.stream().filter(lower::contains).count();
                    if (hits > 0) scored.add(mapResult(rs, (double) hits));
                }
            }
            scored.sort(Comparator.comparingDouble(MemoryResult::score).reversed()
                    .thenComparing(MemoryResult::createdAt, Comparator.reverseOrder())
                    .thenComparing(Comparator.comparingLong(MemoryResult::id).reversed()));
            return new ArrayList<>(scored.subList(0, Math.min(limit, scored.size())));
        } catch (SQLException e) {
            throw new MemoryStorageException("Failed to recall memories", e);
        }
    }

    @Override
    public OptionalLong latestContaining(String text) {
        if (text == null || text.isBlank()) return OptionalLong.empty();
        var needle = text.trim().toLowerCase(Locale.ROOT);
        var sql = "SELECT id FROM memories WHERE content_lc LIKE ? ESCAPE '\\' "
                + "ORDER BY created_at DESC, id DESC LIMIT 1";
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(sql)) {
            ps.setString(1, "%" + escapeLike(needle) + "%");
            try (var rs = ps.executeQuery()) {
                return rs.next() ? OptionalLong.of(rs.getLong(1)) : OptionalLong.empty();
            }
        } catch (SQLException e) {
            throw new MemoryStorageException("Failed to search memories", e);
        }
    }

    @Override
    public Optional<MemoryRecord> get(long id) {
        var sql = "SELECT " + RECORD_COLUMNS + " FROM memories WHERE id = ?";
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(sql)) {
            ps.setLong(1, id);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapRecord(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new MemoryStorageException("Failed to load memory " + id, e);
        }
    }

    @Override
    public List<MemoryRecord> list(int limit, int offset) {
        var sql = "SELECT " + RECORD_COLUMNS + " FROM memories ORDER BY id DESC LIMIT ? OFFSET ?";
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(sql)) {
            ps.setInt(1, limit);
            ps.setInt(2, offset);
            try (var rs = ps.executeQuery()) {
                var records = new ArrayList<MemoryRecord>();
                while (rs.next()) records.add(mapRecord(rs));
                return records;
            }
        } catch (SQLException e) {
            throw new MemoryStorageException("Failed to list memories", e);
        }
    }

    @Override
    public void recordAccess(Collection<Long> ids) {
        if (ids.isEmpty()) return;
        var sql = "UPDATE memories SET access_count = access_count + 1, last_accessed_at = ? WHERE id = ?";
        long now = clock.millis();
        try (var conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try (var ps = conn.prepareStatement(sql)) {
                for (var id : new LinkedHashSet<>(ids)) {
                    ps.setLong(1, now);
                    ps.setLong(2, id);
                    ps.addBatch();
                }
                ps.executeBatch();
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new MemoryStorageException("Failed to record memory access", e);
        }
    }

    @Override
    public void updateEmbedding(long id, float[] vector) {
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement("UPDATE memories SET embedding = ? WHERE id = ?")) {
            ps.setBytes(1, VectorCodec.encode(vector));
            ps.setLong(2, id);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new MemoryStorageException("Failed to store embedding for memory " + id, e);
        }
    }

    @Override
    public List<StoredVector> vectors() {
        var sql = "SELECT id, content, category, created_at, embedding FROM memories WHERE embedding IS NOT NULL";
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(sql);
             var rs = ps.executeQuery()) {
            var vectors = new ArrayList<StoredVector>();
            while (rs.next()) {
                var vec = VectorCodec.decode(rs.getBytes("embedding"));
                if (vec == null) continue;
                vectors.add(new StoredVector(rs.getLong("id"), rs.getString("content"),
                        rs.getString("category"), Instant.ofEpochMilli(rs.getLong("created_at")), vec));
            }
            return vectors;
        } catch (SQLException e) {
            throw new MemoryStorageException("Failed to read stored embeddings", e);
        }
    }

    @Override
    public MemoryStats.FastStoreStats stats() {
        var sql = "SELECT category, COUNT(*) FROM memories GROUP BY category ORDER BY category";
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(sql);
             var rs = ps.executeQuery()) {
            var byCategory = new LinkedHashMap<String, Long>();
            long total = 0;
            while (rs.next()) {
                long count = rs.getLong(2);
                byCategory.put(rs.getString(1), count);
                total += count;
            }
            return new MemoryStats.FastStoreStats(total, byCategory);
        } catch (SQLException e) {
            throw new MemoryStorageException("Failed to compute memory stats", e);
        }
    }

    @Override
    public void clear() {
        try (var conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try (var st = conn.createStatement()) {
                st.executeUpdate("DELETE FROM memories");
                syncQueue.clear(conn);
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new MemoryStorageException("Failed to clear memories", e);
        }
    }

    static List<String> tokenize(String text) {
        if (text == null || text.isBlank()) return List.of();
        var tokens = new LinkedHashSet<String>();
        for (var t : text.toLowerCase(Locale.ROOT).trim().split("\\s+")) {
            if (!t.isEmpty()) tokens.add(t);
        }
        return new ArrayList<>(tokens);
    }

    private static String escapeLike(String token) {
        return token.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    private MemoryResult mapResult(ResultSet rs, double score) throws SQLException {
        return new MemoryResult(rs.getLong("id"), rs.getString("content"), rs.getString("category"),
                Instant.ofEpochMilli(rs.getLong("created_at")), score);
    }

    private MemoryRecord mapRecord(ResultSet rs) throws SQLException {
        long lastAccessed = rs.getLong("last_accessed_at");
        var lastAccessedAt = rs.wasNull() ? null : Instant.ofEpochMilli(lastAccessed);
        return new MemoryRecord(
                rs.getLong("id"),
                rs.getString("content"),
                rs.getString("category"),
                Importance.parse(rs.getString("importance")),
                parseMetadata(rs.getString("metadata")),
                VectorCodec.decode(rs.getBytes("embedding")),
                Instant.ofEpochMilli(rs.getLong("created_at")),
                rs.getLong("access_count"),
                lastAccessedAt);
    }

    private ObjectNode parseMetadata(String json) throws SQLException {
        if (json == null || json.isBlank()) return MAPPER.createObjectNode();
        try {
            var node = MAPPER.readTree(json);
            return node instanceof ObjectNode obj ? obj : MAPPER.createObjectNode();
        } catch (JsonProcessingException e) {
            throw new SQLException("Corrupted metadata column", e);
        }
    }
}
