package com.memclaw.memory.graph;

public enum Relation {
    /** Memory to Topic. */
    HAS_TOPIC,
    /** Memory to Entity. */
    MENTIONS,
    /** Memory to Memory sharing a topic, weighted. */
    RELATED_TO,
    /** Memory to the memory written immediately before it. */
    FOLLOWS
}
