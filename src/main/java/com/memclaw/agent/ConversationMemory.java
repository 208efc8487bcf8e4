package com.memclaw.agent;

import com.memclaw.memory.MemoryQuery;
import com.memclaw.memory.MemoryStorageException;
import com.memclaw.memory.MemoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.OptionalLong;

/**
 * Glue between a chat handler and the memory store: recalled memories go in front of
 * the user message, worthwhile turns are written back after the reply.
 */
public class ConversationMemory {

    private static final Logger log = LoggerFactory.getLogger(ConversationMemory.class);
    static final String CATEGORY = "conversation";
    private static final int RECALL_LIMIT = 3;

    private final MemoryStore memoryStore;
    private final MemoryRelevanceGate gate;

    public ConversationMemory(MemoryStore memoryStore, MemoryRelevanceGate gate) {
        this.memoryStore = memoryStore;
        this.gate = gate;
    }

    public String enrich(String userMessage) {
        if (userMessage == null || userMessage.isBlank()) return userMessage;
        try {
            var memories = memoryStore.recall(MemoryQuery.semantic(userMessage).withLimit(RECALL_LIMIT));
            if (memories.isEmpty()) return userMessage;
            var sb = new StringBuilder();
            for (var m : memories) sb.append("- ").append(m.content()).append("\n");
            return "[Recalled memories]\n" + sb + "\n[User message]\n" + userMessage;
        } catch (MemoryStorageException e) {
            log.warn("Memory recall failed, answering without memories: {}", e.getMessage());
            return userMessage;
        }
    }

    /** Stores the turn if the relevance gate accepts it; returns the new memory id. */
    public OptionalLong remember(String userMessage, String assistantReply, String sessionId) {
        var decision = gate.evaluate(userMessage, assistantReply);
        if (!decision.shouldStore()) {
            log.debug("Turn not stored ({}, score {})", decision.reason(), decision.score());
            return OptionalLong.empty();
        }
        var summary = "Q: " + userMessage + "\nA: " + assistantReply;
        long id = memoryStore.store(summary, CATEGORY, decision.importance(),
                Map.of("sessionId", sessionId != null ? sessionId : ""));
        return OptionalLong.of(id);
    }
}
