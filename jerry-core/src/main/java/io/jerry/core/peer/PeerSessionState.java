package io.jerry.core.peer;

public enum PeerSessionState {
    CONNECTING,
    OPEN,
    DEGRADED,
    CLOSED
}
