package io.jerry.core.tool.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

final class HttpJson {
    static final int NOT_FOUND = 404;

    private final OkHttpClient client;
    private final ObjectMapper mapper;

    HttpJson() {
        this(new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(10))
            .readTimeout(Duration.ofSeconds(20))
            .build());
    }

    HttpJson(OkHttpClient client) {
        this.client = client;
        this.mapper = new ObjectMapper();
    }

    // Null for 404; any other non-2xx status is an error.
    JsonNode execute(Request request) {
        try (Response response = client.newCall(request).execute()) {
            ResponseBody body = response.body();
            String raw = body == null ? "" : body.string();
            if (response.code() == NOT_FOUND) {
                return null;
            }
            if (!response.isSuccessful()) {
                throw new IllegalStateException("HTTP " + response.code() + " from " + request.url().host());
            }
            return mapper.readTree(raw.isBlank() ? "{}" : raw);
        } catch (IOException e) {
            throw new UncheckedIOException("request to " + request.url().host() + " failed", e);
        }
    }
}
