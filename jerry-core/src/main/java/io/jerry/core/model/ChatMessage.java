package io.jerry.core.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;

public record ChatMessage(MessageRole role, String content, String toolCallId, List<ToolCall> toolCalls) {
    private static final int CHARS_PER_TOKEN = 4;

    public ChatMessage {
        Objects.requireNonNull(role, "role must not be null");
        content = content == null ? "" : content;
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
    }

    public static ChatMessage system(String content) {
        return new ChatMessage(MessageRole.SYSTEM, content, null, List.of());
    }

    public static ChatMessage user(String content) {
        return new ChatMessage(MessageRole.USER, content, null, List.of());
    }

    public static ChatMessage assistant(String content) {
        return new ChatMessage(MessageRole.ASSISTANT, content, null, List.of());
    }

    public static ChatMessage assistantWithToolCalls(String content, List<ToolCall> toolCalls) {
        return new ChatMessage(MessageRole.ASSISTANT, content, null, toolCalls);
    }

    public static ChatMessage tool(String content, String toolCallId) {
        return new ChatMessage(MessageRole.TOOL, content, toolCallId, List.of());
    }

    public boolean hasToolCalls() {
        return !toolCalls.isEmpty();
    }

    public int estimatedTokens() {
        int chars = content.length();
        for (ToolCall call : toolCalls) {
            chars += call.name().length();
            for (Map.Entry<String, Object> entry : call.arguments().entrySet()) {
                chars += entry.getKey().length() + String.valueOf(entry.getValue()).length();
            }
        }
        return (chars + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN;
    }
}
