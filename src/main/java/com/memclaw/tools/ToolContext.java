package com.memclaw.tools;

public record ToolContext(String sessionId) {}
