package io.jerry.core.peer;

public final class PeerSessionFatalException extends RuntimeException {

    public PeerSessionFatalException(String message) {
        super(message);
    }

    public PeerSessionFatalException(String message, Throwable cause) {
        super(message, cause);
    }
}
