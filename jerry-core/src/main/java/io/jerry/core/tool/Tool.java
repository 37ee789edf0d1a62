package io.jerry.core.tool;

import java.util.Map;

// Throwing is fine; the registry turns exceptions into failed results.
public interface Tool {
    String name();

    String description();

    default Map<String, Object> schema() {
        return Map.of("type", "object", "properties", Map.of());
    }

    String execute(Map<String, Object> input, ToolContext context);
}
