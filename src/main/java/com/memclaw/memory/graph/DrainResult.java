package com.memclaw.memory.graph;

public record DrainResult(int attempted, int synced, int failed) {

    public static final DrainResult EMPTY = new DrainResult(0, 0, 0);

    public DrainResult plus(DrainResult other) {
        return new DrainResult(attempted + other.attempted, synced + other.synced, failed + other.failed);
    }

    public boolean idle() {
        return attempted == 0;
    }
}
