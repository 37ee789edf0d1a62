package io.jerry.core.provider;

import java.util.Objects;

/**
 * Stands in for a provider that has no credentials. Every call answers with an error
 * response, which fallback chains treat as a miss.
 */
public record DisabledProvider(String name, String reason) implements LlmProvider {

    public DisabledProvider {
        Objects.requireNonNull(name, "name must not be null");
        reason = reason == null || reason.isBlank() ? "provider is disabled" : reason;
    }

    public static DisabledProvider missingKey(String name) {
        return new DisabledProvider(name, "set providers." + name + ".apiKey or MODEL_API_KEY");
    }

    @Override
    public LlmResponse chat(ModelRequest request) {
        return LlmResponse.error("provider " + name + " is not configured (" + reason + ")");
    }
}
