package io.jerry.core.agent;

import java.time.Duration;

public record AgentSettings(
    int maxIterations,
    int decisionAttempts,
    Duration decisionBackoff,
    Duration toolTimeout,
    Duration cycleTimeout,
    Duration lockTimeout
) {
    public AgentSettings {
        maxIterations = Math.max(1, maxIterations);
        decisionAttempts = Math.max(1, decisionAttempts);
        decisionBackoff = decisionBackoff == null ? Duration.ofMillis(500) : decisionBackoff;
        toolTimeout = toolTimeout == null ? Duration.ofSeconds(30) : toolTimeout;
        cycleTimeout = cycleTimeout == null ? Duration.ofSeconds(120) : cycleTimeout;
        lockTimeout = lockTimeout == null ? Duration.ofSeconds(30) : lockTimeout;
    }

    public static AgentSettings defaults() {
        return new AgentSettings(8, 3, null, null, null, null);
    }
}
