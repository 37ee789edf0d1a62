package io.jerry.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CoralConfig(
    String connectionUrl,
    String agentId,
    String orchestrationRuntime,
    long heartbeatMs,
    long handshakeTimeoutMs,
    int reconnectAttempts,
    long reconnectInitialDelayMs,
    long reconnectMaxDelayMs,
    double reconnectJitter
) {

    public static CoralConfig defaults() {
        return new CoralConfig("", "jerry", "", 15_000, 10_000, 6, 500, 30_000, 0.2);
    }

    @JsonIgnore
    public boolean enabled() {
        return connectionUrl != null && !connectionUrl.isBlank() && agentId != null && !agentId.isBlank();
    }
}
