package com.memclaw.memory;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/** A stored memory with its bookkeeping. Equality compares the embedding by content. */
public record MemoryRecord(
    long id,
    String content,
    String category,
    Importance importance,
    ObjectNode metadata,
    float[] embedding,
    Instant createdAt,
    long accessCount,
    Instant lastAccessedAt
) {
    public boolean hasEmbedding() {
        return embedding != null && embedding.length > 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MemoryRecord other)) return false;
        return id == other.id
                && accessCount == other.accessCount
                && Objects.equals(content, other.content)
                && Objects.equals(category, other.category)
                && importance == other.importance
                && Objects.equals(metadata, other.metadata)
                && Arrays.equals(embedding, other.embedding)
                && Objects.equals(createdAt, other.createdAt)
                && Objects.equals(lastAccessedAt, other.lastAccessedAt);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(id, content, category, importance, metadata, createdAt, accessCount, lastAccessedAt);
        return 31 * result + Arrays.hashCode(embedding);
    }

    @Override
    public String toString() {
        return "MemoryRecord[id=" + id + ", category=" + category + ", importance=" + importance
                + ", embedding=" + (embedding == null ? "none" : embedding.length + " dims")
                + ", createdAt=" + createdAt + ", accessCount=" + accessCount + "]";
    }
}
