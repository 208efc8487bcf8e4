package com.memclaw.memory.extract;

public record Entity(String name, EntityType type) {}
