package io.jerry.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record GitHubConfig(String token, String apiBase) {

    public static GitHubConfig defaults() {
        return new GitHubConfig("", "https://api.github.com");
    }
}
