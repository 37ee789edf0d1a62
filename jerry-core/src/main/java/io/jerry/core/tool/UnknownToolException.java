package io.jerry.core.tool;

public final class UnknownToolException extends RuntimeException {
    private final String toolName;

    public UnknownToolException(String toolName) {
        super("Tool '" + toolName + "' not found");
        this.toolName = toolName;
    }

    public String toolName() {
        return toolName;
    }
}
