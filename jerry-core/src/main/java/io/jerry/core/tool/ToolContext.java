package io.jerry.core.tool;

public record ToolContext(String conversationKey, String senderId) {

    public static ToolContext detached() {
        return new ToolContext("", "");
    }

    public ToolContext {
        conversationKey = conversationKey == null ? "" : conversationKey;
        senderId = senderId == null ? "" : senderId;
    }
}
