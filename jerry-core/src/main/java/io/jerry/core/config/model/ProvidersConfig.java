package io.jerry.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Locale;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ProvidersConfig(
    ProviderConfig mistral,
    ProviderConfig openai,
    ProviderConfig openrouter
) {

    public static ProvidersConfig defaults() {
        return new ProvidersConfig(
            ProviderConfig.withBase("https://api.mistral.ai/v1"),
            ProviderConfig.withBase("https://api.openai.com/v1"),
            ProviderConfig.withBase("https://openrouter.ai/api/v1")
        );
    }

    public ProviderConfig byName(String name) {
        return switch (name == null ? "" : name.toLowerCase(Locale.ROOT)) {
            case "mistral" -> mistral;
            case "openai" -> openai;
            case "openrouter" -> openrouter;
            default -> null;
        };
    }
}
