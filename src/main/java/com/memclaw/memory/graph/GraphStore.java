package com.memclaw.memory.graph;

import com.memclaw.memory.MemoryStats;
import com.memclaw.memory.extract.Entity;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;

/**
 * Typed nodes and edges over memories. Every write is merge-or-create, so writing the
 * same node or edge twice leaves one copy. Failures surface as {@link GraphStoreException}.
 */
public interface GraphStore extends AutoCloseable {

    void upsertMemory(MemoryNode node);

    void linkTopic(long memoryId, String topic);

    void linkEntity(long memoryId, Entity entity);

    void linkMemories(Relation relation, long fromId, long toId, double strength);

    /** Makes everything written so far durable. */
    void commit();

    boolean containsMemory(long memoryId);

    Optional<MemoryNode> findMemory(long memoryId);

    Set<Long> memoryIds();

    /** Highest memory id strictly below {@code memoryId}. */
    OptionalLong previousMemoryId(long memoryId);

    /** Other memories attached to any of {@code topics}, newest first. */
    List<Long> memoriesSharingTopics(long memoryId, Collection<String> topics, int limit);

    /**
     * Newest memory whose content contains {@code text}, ignoring case. Implementations
     * may match only a bounded prefix of the content and of {@code text}; a miss here is
     * not proof that no memory contains it.
     */
    Optional<MemoryNode> latestMemoryContaining(String text);

    /** Distinct memories within {@code depth} hops of the seed over {@code relations}, in either direction. */
    List<MemoryNode> traverse(long seedId, Set<Relation> relations, int depth);

    List<MemoryNode> memoriesWithTopics(Collection<String> topics, int limit);

    List<MemoryNode> memoriesMentioning(Collection<String> entityNames, int limit);

    MemoryStats.GraphStoreStats stats();

    void clear();

    @Override
    void close();
}
