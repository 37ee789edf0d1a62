package io.jerry.core.session;

public enum TurnRole {
    USER,
    AGENT,
    TOOL,
    PEER
}
