package com.memclaw.tools;

public record ToolResult(String output, boolean isError) {}
