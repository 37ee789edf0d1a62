package io.jerry.core.provider;

import java.util.Locale;

public final class ProviderRouter {
    private final ProviderRegistry registry;

    public ProviderRouter(ProviderRegistry registry) {
        this.registry = registry;
    }

    public LlmProvider resolve(String preferredProvider, String model) {
        if (preferredProvider != null && !preferredProvider.isBlank()) {
            return require(preferredProvider);
        }

        String normalizedModel = model == null ? "" : model.toLowerCase(Locale.ROOT);
        if (normalizedModel.startsWith("openrouter/") || normalizedModel.contains("/")) {
            return require("openrouter");
        }
        if (normalizedModel.contains("gpt") || normalizedModel.startsWith("o1") || normalizedModel.startsWith("o3")) {
            return require("openai");
        }
        return require("mistral");
    }

    private LlmProvider require(String name) {
        return registry.find(name)
            .orElseThrow(() -> new IllegalArgumentException("Unknown provider: " + name));
    }
}
