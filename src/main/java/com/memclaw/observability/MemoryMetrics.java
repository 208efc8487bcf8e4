package com.memclaw.observability;

import com.memclaw.memory.QueryType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.Locale;

public class MemoryMetrics {

    private final MeterRegistry registry;

    public MemoryMetrics() {
        this(new SimpleMeterRegistry());
    }

    public MemoryMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public MeterRegistry registry() { return registry; }

    public Counter memoriesStored() {
        return Counter.builder("memclaw.memory.stored").register(registry);
    }

    public Counter syncCompleted() {
        return Counter.builder("memclaw.sync.completed").register(registry);
    }

    public Counter syncFailed() {
        return Counter.builder("memclaw.sync.failed").register(registry);
    }

    public Counter recallFallbacks() {
        return Counter.builder("memclaw.recall.fallbacks").register(registry);
    }

    public Timer recallLatency(QueryType type) {
        return Timer.builder("memclaw.recall.latency")
                .tag("type", type.name().toLowerCase(Locale.ROOT))
                .register(registry);
    }
}
