package io.jerry.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record GoogleConfig(
    String clientId,
    String clientSecret,
    String refreshToken,
    String tokenUrl,
    String apiBase
) {

    public static GoogleConfig defaults() {
        return new GoogleConfig("", "", "", "https://oauth2.googleapis.com/token", "https://www.googleapis.com");
    }

    @JsonIgnore
    public boolean configured() {
        return notBlank(clientId) && notBlank(clientSecret) && notBlank(refreshToken);
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
