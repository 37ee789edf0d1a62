package io.jerry.core.decision;

import java.time.Duration;
import java.util.Objects;

public record DecisionSettings(
    String provider,
    String model,
    double temperature,
    int maxTokens,
    Duration timeout
) {
    public DecisionSettings {
        model = model == null || model.isBlank() ? "mistral-large-latest" : model;
        maxTokens = maxTokens <= 0 ? 16000 : maxTokens;
        Objects.requireNonNull(timeout, "timeout must not be null");
    }
}
