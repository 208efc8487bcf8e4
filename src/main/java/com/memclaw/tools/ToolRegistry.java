package com.memclaw.tools;

import com.memclaw.memory.MemoryStore;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

public class ToolRegistry {
    private final Map<String, Tool> tools = new LinkedHashMap<>();

    /** Registry holding the three memory tools bound to {@code store}. */
    public static ToolRegistry forMemory(MemoryStore store) {
        var registry = new ToolRegistry();
        registry.register(new MemoryStoreTool(store));
        registry.register(new MemoryRecallTool(store));
        registry.register(new MemoryStatsTool(store));
        return registry;
    }

    public void register(Tool tool) {
        if (tools.containsKey(tool.name())) {
            throw new IllegalArgumentException("Duplicate tool: " + tool.name());
        }
        tools.put(tool.name(), tool);
    }

    public Tool get(String name) {
        return tools.get(name);
    }

    public Collection<Tool> all() {
        return tools.values();
    }
}
