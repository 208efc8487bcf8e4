package com.memclaw.memory;

import java.util.List;
import java.util.Map;

public interface MemoryStore {
    long store(String content, String category, Importance importance, Map<String, Object> metadata);
    List<MemoryResult> recall(MemoryQuery query);
    MemoryStats getStats();
    void clear();

    default long store(String content) {
        return store(content, "general", Importance.MEDIUM, Map.of());
    }

    default long store(String content, String category) {
        return store(content, category, Importance.MEDIUM, Map.of());
    }
}
