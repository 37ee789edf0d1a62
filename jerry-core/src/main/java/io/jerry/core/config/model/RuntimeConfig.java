package io.jerry.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RuntimeConfig(
    long lockTimeoutMs,
    long idleEvictionMs,
    long evictionIntervalMs,
    int inboundWorkers,
    int inboundQueue,
    int toolWorkers
) {

    public static RuntimeConfig defaults() {
        return new RuntimeConfig(30_000, 1_800_000, 60_000, 16, 256, 16);
    }
}
