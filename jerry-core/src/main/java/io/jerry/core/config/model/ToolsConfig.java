package io.jerry.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ToolsConfig(
    WebSearchConfig search,
    WebFetchConfig web,
    GitHubConfig github,
    GoogleConfig google
) {

    public static ToolsConfig defaults() {
        return new ToolsConfig(
            WebSearchConfig.defaults(),
            WebFetchConfig.defaults(),
            GitHubConfig.defaults(),
            GoogleConfig.defaults()
        );
    }
}
