package com.memclaw.memory.store;

import com.memclaw.memory.MemoryResult;

import java.time.Instant;

public record StoredVector(long id, String content, String category, Instant createdAt, float[] vector) {

    public MemoryResult toResult(double score) {
        return new MemoryResult(id, content, category, createdAt, score);
    }
}
