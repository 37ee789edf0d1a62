package io.jerry.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record WebFetchConfig(int maxChars, boolean allowPrivateNetworks) {

    public static WebFetchConfig defaults() {
        return new WebFetchConfig(20_000, false);
    }
}
