package com.memclaw.memory.store;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.memclaw.memory.Importance;
import com.memclaw.memory.MemoryRecord;
import com.memclaw.memory.MemoryResult;
import com.memclaw.memory.MemoryStats;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * The relational source of truth. Every method either succeeds or throws
 * {@link com.memclaw.memory.MemoryStorageException}.
 */
public interface FastStore {

    /** Inserts the memory and its sync-queue entry in one transaction. */
    MemoryRecord store(String content, String category, Importance importance, ObjectNode metadata);

    /** Keyword search; bumps access counters of everything returned. */
    List<MemoryResult> recall(String text, int limit);

    /** Id of the newest memory whose whole content contains {@code text}, ignoring case. */
    OptionalLong latestContaining(String text);

    Optional<MemoryRecord> get(long id);

    List<MemoryRecord> list(int limit, int offset);

    void recordAccess(Collection<Long> ids);

    void updateEmbedding(long id, float[] vector);

    List<StoredVector> vectors();

    MemoryStats.FastStoreStats stats();

    /** Wipes memories and the sync queue together. */
    void clear();
}
