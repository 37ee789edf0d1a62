package io.jerry.core.provider;

import io.jerry.core.model.ChatMessage;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public record ModelRequest(
    String model,
    List<ChatMessage> messages,
    List<Map<String, Object>> tools,
    double temperature,
    int maxTokens,
    boolean parallelToolCalls
) {
    public ModelRequest {
        Objects.requireNonNull(model, "model must not be null");
        messages = messages == null ? List.of() : List.copyOf(messages);
        tools = tools == null ? List.of() : List.copyOf(tools);
    }

    public static ModelRequest of(String model, List<ChatMessage> messages, List<Map<String, Object>> tools) {
        return new ModelRequest(model, messages, tools, 0.3, 16000, true);
    }
}
