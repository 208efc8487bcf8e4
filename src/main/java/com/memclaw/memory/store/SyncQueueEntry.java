package com.memclaw.memory.store;

import java.time.Instant;

public record SyncQueueEntry(long queueId, long memoryId, SyncPayload payload,
                             boolean synced, Instant createdAt, Instant syncedAt) {}
