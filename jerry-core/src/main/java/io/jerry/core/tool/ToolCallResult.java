package io.jerry.core.tool;

import java.util.Objects;

public record ToolCallResult(String correlationId, String toolName, ToolOutcome outcome, String payload, String reason) {

    public ToolCallResult {
        Objects.requireNonNull(correlationId, "correlationId must not be null");
        Objects.requireNonNull(outcome, "outcome must not be null");
        toolName = toolName == null ? "" : toolName;
        payload = payload == null ? "" : payload;
        reason = reason == null ? "" : reason;
    }

    public static ToolCallResult success(String correlationId, String toolName, String payload) {
        return new ToolCallResult(correlationId, toolName, ToolOutcome.SUCCESS, payload, null);
    }

    public static ToolCallResult failure(String correlationId, String toolName, String reason) {
        return new ToolCallResult(correlationId, toolName, ToolOutcome.FAILURE, null, reason);
    }

    public static ToolCallResult timeout(String correlationId, String toolName) {
        return new ToolCallResult(correlationId, toolName, ToolOutcome.TIMEOUT, null, "deadline exceeded");
    }

    public boolean isSuccess() {
        return outcome == ToolOutcome.SUCCESS;
    }

    public String render() {
        return switch (outcome) {
            case SUCCESS -> payload;
            case FAILURE -> "Error executing tool '" + toolName + "': " + reason;
            case TIMEOUT -> "Error: tool '" + toolName + "' did not respond before its deadline";
        };
    }
}
