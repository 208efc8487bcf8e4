package com.memclaw.memory.graph;

import com.memclaw.memory.Importance;
import com.memclaw.memory.MemoryResult;

import java.time.Instant;

public record MemoryNode(long id, String content, String category, Importance importance, Instant createdAt) {

    public MemoryResult toResult() {
        return new MemoryResult(id, content, category, createdAt, null);
    }
}
