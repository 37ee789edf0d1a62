package io.jerry.core.context;

public record ContextBudget(int maxTurns, int maxTokens) {
    public ContextBudget {
        if (maxTurns < 1) {
            throw new IllegalArgumentException("maxTurns must be >= 1");
        }
        if (maxTokens < 1) {
            throw new IllegalArgumentException("maxTokens must be >= 1");
        }
    }
}
