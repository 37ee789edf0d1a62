package io.jerry.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record ToolCall(String id, String name, Map<String, Object> arguments) {

    public ToolCall {
        name = name == null ? "" : name.trim();
        arguments = arguments == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
    }
}
