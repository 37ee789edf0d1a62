package io.jerry.core.tool;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public record ToolCallRequest(
    String correlationId,
    String toolName,
    Map<String, Object> arguments,
    String conversationKey,
    Instant deadline
) {
    public ToolCallRequest {
        Objects.requireNonNull(correlationId, "correlationId must not be null");
        Objects.requireNonNull(toolName, "toolName must not be null");
        Objects.requireNonNull(deadline, "deadline must not be null");
        arguments = arguments == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
        conversationKey = conversationKey == null ? "" : conversationKey;
    }
}
