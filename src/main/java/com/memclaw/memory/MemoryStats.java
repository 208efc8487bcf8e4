package com.memclaw.memory;

import java.util.Map;

public record MemoryStats(
    FastStoreStats fastStore,
    GraphStoreStats graphStore,
    boolean graphAvailable,
    long pendingSyncCount,
    String embeddingModelName
) {
    public record FastStoreStats(long total, Map<String, Long> byCategory) {}

    public record GraphStoreStats(long nodeCount, long edgeCount) {
        public static GraphStoreStats empty() {
            return new GraphStoreStats(0, 0);
        }
    }
}
