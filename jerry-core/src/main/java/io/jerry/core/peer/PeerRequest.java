package io.jerry.core.peer;

import java.util.Map;

public record PeerRequest(String senderAgentId, String correlationId, Map<String, Object> payload, String toolName) {
    public PeerRequest {
        payload = payload == null ? Map.of() : payload;
    }
}
