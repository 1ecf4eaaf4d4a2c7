package com.phonepe.soulwire.core.tools;

import com.google.common.base.Preconditions;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Tools available to an agent, keyed by name
 */
public class Toolset {
    private final Map<String, Tool> tools = new LinkedHashMap<>();

    public static Toolset of(Tool... tools) {
        return new Toolset().add(List.of(tools));
    }

    public synchronized Toolset add(Collection<? extends Tool> toAdd) {
        toAdd.forEach(tool -> {
            Preconditions.checkArgument(!tools.containsKey(tool.name()), "Duplicate tool name: %s", tool.name());
            tools.put(tool.name(), tool);
        });
        return this;
    }

    public synchronized Optional<Tool> find(String name) {
        return Optional.ofNullable(tools.get(name));
    }

    public synchronized List<ToolDefinition> definitions() {
        return tools.values()
                .stream()
                .map(Tool::definition)
                .toList();
    }
}
