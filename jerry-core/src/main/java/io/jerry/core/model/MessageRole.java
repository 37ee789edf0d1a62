package io.jerry.core.model;

public enum MessageRole {
    SYSTEM,
    USER,
    ASSISTANT,
    TOOL
}
