package com.memclaw.memory.store;

import com.memclaw.memory.MemoryStorageException;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Durable record of pending graph-indexing work. Lives in the same SQLite file as the
 * memory table; rows only ever move from unsynced to synced.
 */
public class SyncQueue {

    private final DataSource dataSource;
    private final Clock clock;

    public SyncQueue(DataSource dataSource) {
        this(dataSource, Clock.systemUTC());
    }

    public SyncQueue(DataSource dataSource, Clock clock) {
        this.dataSource = dataSource;
        this.clock = clock;
    }

    void initSchema(Connection conn) throws SQLException {
        try (var st = conn.createStatement()) {
            st.executeUpdate("""
                    CREATE TABLE IF NOT EXISTS sync_queue (
                        id         INTEGER PRIMARY KEY AUTOINCREMENT,
                        memory_id  INTEGER NOT NULL,
                        payload    TEXT    NOT NULL,
                        synced     INTEGER NOT NULL DEFAULT 0,
                        created_at INTEGER NOT NULL,
                        synced_at  INTEGER
                    )""");
            st.executeUpdate("CREATE INDEX IF NOT EXISTS idx_sync_queue_pending ON sync_queue(synced, id)");
        }
    }

    /** Must run inside the caller's transaction, on the connection that inserted the memory. */
    long enqueue(Connection conn, SyncPayload payload) throws SQLException {
        var sql = "INSERT INTO sync_queue (memory_id, payload, synced, created_at) VALUES (?, ?, 0, ?)";
        try (var ps = conn.prepareStatement(sql)) {
            ps.setLong(1, payload.memoryId());
            ps.setString(2, payload.toJson());
            ps.setLong(3, clock.millis());
            ps.executeUpdate();
        }
        return lastInsertId(conn);
    }

    public List<SyncQueueEntry> pending(int limit) {
        return pendingAfter(0, limit);
    }

    /** Unsynced entries with a queue id above {@code afterQueueId}, oldest first. */
    public List<SyncQueueEntry> pendingAfter(long afterQueueId, int limit) {
        var sql = "SELECT id, memory_id, payload, synced, created_at, synced_at FROM sync_queue "
                + "WHERE synced = 0 AND id > ? ORDER BY id LIMIT ?";
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(sql)) {
            ps.setLong(1, afterQueueId);
            ps.setInt(2, limit);
            try (var rs = ps.executeQuery()) {
                var entries = new ArrayList<SyncQueueEntry>();
                while (rs.next()) entries.add(mapEntry(rs));
                return entries;
            }
        } catch (SQLException e) {
            throw new MemoryStorageException("Failed to read pending sync entries", e);
        }
    }

    public List<SyncQueueEntry> entriesFor(long memoryId) {
        var sql = "SELECT id, memory_id, payload, synced, created_at, synced_at FROM sync_queue "
                + "WHERE memory_id = ? ORDER BY id";
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(sql)) {
            ps.setLong(1, memoryId);
            try (var rs = ps.executeQuery()) {
                var entries = new ArrayList<SyncQueueEntry>();
                while (rs.next()) entries.add(mapEntry(rs));
                return entries;
            }
        } catch (SQLException e) {
            throw new MemoryStorageException("Failed to read sync entries for memory " + memoryId, e);
        }
    }

    /**
     * Flips the entry to synced. Returns false when it was already synced (or does not
     * exist), so calling this twice is harmless.
     */
    public boolean markSynced(long queueId) {
        var sql = "UPDATE sync_queue SET synced = 1, synced_at = ? WHERE id = ? AND synced = 0";
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(sql)) {
            ps.setLong(1, clock.millis());
            ps.setLong(2, queueId);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new MemoryStorageException("Failed to mark sync entry " + queueId, e);
        }
    }

    public long pendingCount() {
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement("SELECT COUNT(*) FROM sync_queue WHERE synced = 0");
             var rs = ps.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0;
        } catch (SQLException e) {
            throw new MemoryStorageException("Failed to count pending sync entries", e);
        }
    }

    /** Deletes synced rows older than {@code before}; pending rows are never touched. */
    public int compact(Instant before) {
        var sql = "DELETE FROM sync_queue WHERE synced = 1 AND synced_at < ?";
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(sql)) {
            ps.setLong(1, before.toEpochMilli());
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new MemoryStorageException("Failed to compact sync queue", e);
        }
    }

    void clear(Connection conn) throws SQLException {
        try (var st = conn.createStatement()) {
            st.executeUpdate("DELETE FROM sync_queue");
        }
    }

    private SyncQueueEntry mapEntry(ResultSet rs) throws SQLException {
        long syncedAt = rs.getLong("synced_at");
        var syncedAtInstant = rs.wasNull() ? null : Instant.ofEpochMilli(syncedAt);
        return new SyncQueueEntry(
                rs.getLong("id"),
                rs.getLong("memory_id"),
                SyncPayload.fromJson(rs.getString("payload")),
                rs.getInt("synced") == 1,
                Instant.ofEpochMilli(rs.getLong("created_at")),
                syncedAtInstant);
    }

    static long lastInsertId(Connection conn) throws SQLException {
        try (var st = conn.createStatement();
             var rs = st.executeQuery("SELECT last_insert_rowid()")) {
            if (!rs.next()) throw new SQLException("No row id after insert");
            return rs.getLong(1);
        }
    }
}
