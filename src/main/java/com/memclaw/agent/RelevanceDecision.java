package com.memclaw.agent;

import com.memclaw.memory.Importance;

public record RelevanceDecision(boolean shouldStore, double score, Importance importance, String reason) {}
