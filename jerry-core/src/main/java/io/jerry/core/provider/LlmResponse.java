package io.jerry.core.provider;

import io.jerry.core.model.ToolCall;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record LlmResponse(String content, List<ToolCall> toolCalls, Map<String, Object> usage) {
    public static final String ERROR_PREFIX = "Error calling LLM:";

    public LlmResponse {
        content = content == null ? "" : content;
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
        usage = usage == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(usage));
    }

    public static LlmResponse error(String detail) {
        return new LlmResponse(ERROR_PREFIX + " " + detail, List.of(), Map.of());
    }

    public boolean isError() {
        return content.startsWith(ERROR_PREFIX);
    }
}
