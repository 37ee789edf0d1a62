package io.jerry.core.tool.impl;

import com.fasterxml.jackson.databind.JsonNode;
import io.jerry.core.config.model.GoogleConfig;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import okhttp3.FormBody;
import okhttp3.HttpUrl;
import okhttp3.Request;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class GoogleAccessTokens {
    private static final Logger LOG = LoggerFactory.getLogger(GoogleAccessTokens.class);
    private static final Duration EXPIRY_MARGIN = Duration.ofSeconds(60);

    private final GoogleConfig config;
    private final HttpUrl tokenUrl;
    private final HttpJson http;
    private final Clock clock;
    private String accessToken;
    private Instant expiresAt = Instant.EPOCH;

    GoogleAccessTokens(GoogleConfig config, HttpJson http, Clock clock) {
        this.config = config;
        this.tokenUrl = HttpUrl.get(config.tokenUrl());
        this.http = http;
        this.clock = clock;
    }

    synchronized String current() {
        if (accessToken != null && clock.instant().isBefore(expiresAt)) {
            return accessToken;
        }
        FormBody form = new FormBody.Builder()
            .add("client_id", config.clientId())
            .add("client_secret", config.clientSecret())
            .add("refresh_token", config.refreshToken())
            .add("grant_type", "refresh_token")
            .build();
        JsonNode body = http.execute(new Request.Builder().url(tokenUrl).post(form).build());
        String token = body == null ? "" : body.path("access_token").asText("");
        if (token.isBlank()) {
            throw new IllegalStateException("Google token endpoint returned no access token");
        }
        long expiresIn = body.path("expires_in").asLong(3600);
        accessToken = token;
        expiresAt = clock.instant().plusSeconds(expiresIn).minus(EXPIRY_MARGIN);
        LOG.debug("Refreshed Google access token, valid for {}s", expiresIn);
        return accessToken;
    }
}
