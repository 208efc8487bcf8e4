package com.memclaw.memory.extract;

public enum EntityType {
    TECHNOLOGY, CLASS, FILE, CONFIG
}
