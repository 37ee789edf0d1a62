package io.jerry.core.agent;

public enum CycleOutcome {
    ANSWERED,
    DEGRADED,
    ITERATION_CAP,
    FAILED,
    SUPERSEDED,
    BUSY
}
