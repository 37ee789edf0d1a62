package io.jerry.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record WebSearchConfig(String apiKey, String apiBase, int maxResults) {

    public static WebSearchConfig defaults() {
        return new WebSearchConfig("", "https://api.search.brave.com/res/v1", 5);
    }
}
