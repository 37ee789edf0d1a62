package io.jerry.core.session;

public enum ConversationStatus {
    IDLE,
    RUNNING,
    AWAITING_TOOL,
    AWAITING_PEER,
    CLOSED
}
