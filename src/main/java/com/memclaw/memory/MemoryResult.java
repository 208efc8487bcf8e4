package com.memclaw.memory;

import java.time.Instant;

/**
 * One ranked recall hit. {@code score} is null for results that came from a graph
 * walk, where there is no meaningful numeric rank.
 */
public record MemoryResult(long id, String content, String category, Instant createdAt, Double score) {}
