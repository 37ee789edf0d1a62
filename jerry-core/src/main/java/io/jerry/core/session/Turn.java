package io.jerry.core.session;

import io.jerry.core.model.ToolCall;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

public record Turn(
    TurnRole role,
    String content,
    Instant timestamp,
    String correlationId,
    List<ToolCall> toolCalls
) {
    public Turn {
        Objects.requireNonNull(role, "role must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        content = content == null ? "" : content;
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
    }

    public static Turn user(String content, Instant timestamp) {
        return new Turn(TurnRole.USER, content, timestamp, null, List.of());
    }

    public static Turn agent(String content, Instant timestamp) {
        return new Turn(TurnRole.AGENT, content, timestamp, null, List.of());
    }

    public static Turn agentInvocations(String content, List<ToolCall> toolCalls, Instant timestamp) {
        return new Turn(TurnRole.AGENT, content, timestamp, null, toolCalls);
    }

    public static Turn toolResult(String content, String correlationId, Instant timestamp) {
        return new Turn(TurnRole.TOOL, content, timestamp, correlationId, List.of());
    }

    public static Turn peerResult(String content, String correlationId, Instant timestamp) {
        return new Turn(TurnRole.PEER, content, timestamp, correlationId, List.of());
    }

    public boolean isResult() {
        return role == TurnRole.TOOL || role == TurnRole.PEER;
    }
}
