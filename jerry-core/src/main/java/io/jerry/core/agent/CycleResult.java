package io.jerry.core.agent;

public record CycleResult(CycleOutcome outcome, String reply, int decisions, int dispatched, boolean parseDegraded) {

    public boolean replied() {
        return outcome != CycleOutcome.SUPERSEDED;
    }
}
