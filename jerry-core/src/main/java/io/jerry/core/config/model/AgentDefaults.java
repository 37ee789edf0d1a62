package io.jerry.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AgentDefaults(
    String provider,
    String model,
    int maxTokens,
    double temperature,
    int maxIterations,
    int decisionAttempts,
    long decisionBackoffMs,
    long modelTimeoutMs,
    long toolTimeoutMs,
    long cycleTimeoutMs,
    int contextMaxTurns,
    int contextMaxTokens
) {

    public static AgentDefaults defaults() {
        return new AgentDefaults(
            "mistral",
            "mistral-large-latest",
            16000,
            0.3,
            8,
            3,
            500,
            60_000,
            30_000,
            120_000,
            20,
            12_000
        );
    }

    public AgentDefaults withModel(String newProvider, String newModel) {
        return new AgentDefaults(
            newProvider == null || newProvider.isBlank() ? provider : newProvider,
            newModel == null || newModel.isBlank() ? model : newModel,
            maxTokens,
            temperature,
            maxIterations,
            decisionAttempts,
            decisionBackoffMs,
            modelTimeoutMs,
            toolTimeoutMs,
            cycleTimeoutMs,
            contextMaxTurns,
            contextMaxTokens
        );
    }
}
