package io.jerry.core.slack;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class SlackClient {
    private static final Logger LOG = LoggerFactory.getLogger(SlackClient.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final String botToken;
    private final HttpUrl apiBase;
    private final OkHttpClient client;
    private final ObjectMapper mapper;

    public SlackClient(String botToken, String apiBase) {
        this.botToken = Objects.requireNonNull(botToken, "botToken must not be null");
        this.apiBase = HttpUrl.get(Objects.requireNonNull(apiBase, "apiBase must not be null"));
        this.client = new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(10))
            .readTimeout(Duration.ofSeconds(30))
            .build();
        this.mapper = new ObjectMapper();
    }

    public String postMessage(String channel, String text, String threadTs) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("channel", channel);
        payload.put("text", text);
        if (threadTs != null && !threadTs.isBlank()) {
            payload.put("thread_ts", threadTs);
        }
        JsonNode body = call("chat.postMessage", payload);
        return body.path("ts").asText("");
    }

    public void setStatus(String channel, String threadTs, String status) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("channel_id", channel);
        payload.put("thread_ts", threadTs);
        payload.put("status", status);
        call("assistant.threads.setStatus", payload);
    }

    public void setSuggestedPrompts(String channel, String threadTs, List<SuggestedPrompt> prompts) {
        List<Map<String, String>> encoded = new ArrayList<>(prompts.size());
        for (SuggestedPrompt prompt : prompts) {
            encoded.add(Map.of("title", prompt.title(), "message", prompt.message()));
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("channel_id", channel);
        payload.put("thread_ts", threadTs);
        payload.put("prompts", encoded);
        call("assistant.threads.setSuggestedPrompts", payload);
    }

    // Oldest first, starting with the thread parent.
    public List<ThreadMessage> threadReplies(String channel, String threadTs, int limit) {
        HttpUrl url = apiBase.newBuilder()
            .addPathSegment("conversations.replies")
            .addQueryParameter("channel", channel)
            .addQueryParameter("ts", threadTs)
            .addQueryParameter("limit", Integer.toString(limit))
            .build();
        JsonNode body = execute("conversations.replies", new Request.Builder().url(url).get());
        List<ThreadMessage> messages = new ArrayList<>();
        for (JsonNode message : body.path("messages")) {
            messages.add(new ThreadMessage(
                message.path("user").asText(""),
                message.path("bot_id").asText(""),
                message.path("text").asText(""),
                message.path("ts").asText("")
            ));
        }
        return messages;
    }

    private JsonNode call(String method, Map<String, Object> payload) {
        HttpUrl url = apiBase.newBuilder().addPathSegment(method).build();
        try {
            return execute(method, new Request.Builder()
                .url(url)
                .post(RequestBody.create(mapper.writeValueAsString(payload), JSON)));
        } catch (IOException e) {
            throw new SlackApiException(method + " failed: " + e.getMessage(), e);
        }
    }

    private JsonNode execute(String method, Request.Builder builder) {
        Request request = builder.header("Authorization", "Bearer " + botToken).build();
        try (Response response = client.newCall(request).execute()) {
            ResponseBody responseBody = response.body();
            String raw = responseBody == null ? "" : responseBody.string();
            if (!response.isSuccessful()) {
                throw new SlackApiException(method + " failed with HTTP " + response.code());
            }
            JsonNode body = mapper.readTree(raw.isBlank() ? "{}" : raw);
            if (!body.path("ok").asBoolean(false)) {
                throw new SlackApiException(method + " failed: " + body.path("error").asText("unknown_error"));
            }
            LOG.debug("Slack {} succeeded", method);
            return body;
        } catch (IOException e) {
            throw new SlackApiException(method + " failed: " + e.getMessage(), e);
        }
    }
}
