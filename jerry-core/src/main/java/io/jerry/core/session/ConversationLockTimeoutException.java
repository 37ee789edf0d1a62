package io.jerry.core.session;

import java.time.Duration;

public final class ConversationLockTimeoutException extends RuntimeException {
    private final String conversationKey;

    public ConversationLockTimeoutException(String conversationKey, Duration waited) {
        super("Timed out after " + waited.toMillis() + " ms waiting for conversation " + conversationKey);
        this.conversationKey = conversationKey;
    }

    public String conversationKey() {
        return conversationKey;
    }
}
