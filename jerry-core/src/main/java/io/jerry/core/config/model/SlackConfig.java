package io.jerry.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SlackConfig(
    String botToken,
    String signingSecret,
    String apiBase,
    String host,
    int port
) {

    public static SlackConfig defaults() {
        return new SlackConfig("", "", "https://slack.com/api", "0.0.0.0", 3000);
    }

    @JsonIgnore
    public boolean enabled() {
        return botToken != null && !botToken.isBlank() && signingSecret != null && !signingSecret.isBlank();
    }
}
