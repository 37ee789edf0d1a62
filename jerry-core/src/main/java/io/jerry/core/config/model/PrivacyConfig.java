package io.jerry.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record PrivacyConfig(boolean redactionEnabled, String customPattern) {

    public static PrivacyConfig defaults() {
        return new PrivacyConfig(false, "");
    }
}
