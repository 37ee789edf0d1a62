package io.jerry.core.tool;

public enum ToolOutcome {
    SUCCESS,
    FAILURE,
    TIMEOUT
}
