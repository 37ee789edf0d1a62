package io.jerry.core.peer;

import java.time.Duration;
import java.util.Objects;

public record PeerSessionSettings(
    String url,
    String agentId,
    Duration heartbeat,
    Duration handshakeTimeout,
    ReconnectPolicy reconnect
) {
    public PeerSessionSettings {
        Objects.requireNonNull(url, "url must not be null");
        if (agentId == null || agentId.isBlank()) {
            throw new IllegalArgumentException("agentId must not be blank");
        }
        heartbeat = heartbeat == null ? Duration.ofSeconds(15) : heartbeat;
        handshakeTimeout = handshakeTimeout == null ? Duration.ofSeconds(10) : handshakeTimeout;
        reconnect = reconnect == null ? ReconnectPolicy.defaults() : reconnect;
    }
}
