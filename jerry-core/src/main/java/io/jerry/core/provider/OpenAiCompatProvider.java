package io.jerry.core.provider;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.jerry.core.model.ChatMessage;
import io.jerry.core.model.MessageRole;
import io.jerry.core.model.ToolCall;
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
import okio.BufferedSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class OpenAiCompatProvider implements LlmProvider {
    private static final Logger LOG = LoggerFactory.getLogger(OpenAiCompatProvider.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final String name;
    private final String apiKey;
    private final HttpUrl apiBase;
    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final Map<String, String> extraHeaders;
    private final int maxAttempts;
    private final long baseDelayMs;

    public OpenAiCompatProvider(String name, String apiKey, String apiBase, Map<String, String> extraHeaders) {
        this(name, apiKey, apiBase, extraHeaders, 3, Duration.ofMillis(250), Duration.ofSeconds(90));
    }

    public OpenAiCompatProvider(
        String name,
        String apiKey,
        String apiBase,
        Map<String, String> extraHeaders,
        int maxAttempts,
        Duration baseDelay,
        Duration readTimeout
    ) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.apiKey = apiKey == null ? "" : apiKey;
        this.apiBase = HttpUrl.get(Objects.requireNonNull(apiBase, "apiBase must not be null"));
        this.extraHeaders = extraHeaders == null ? Map.of() : Map.copyOf(extraHeaders);
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseDelayMs = Math.max(0, baseDelay.toMillis());
        this.client = new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(20))
            .readTimeout(readTimeout)
            .writeTimeout(Duration.ofSeconds(20))
            .build();
        this.mapper = new ObjectMapper();
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public LlmResponse chat(ModelRequest request) {
        if (apiKey.isBlank()) {
            return LlmResponse.error("missing API key for provider " + name);
        }

        long delayMs = baseDelayMs;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try (Response response = client.newCall(buildRequest(request)).execute()) {
                if (!response.isSuccessful()) {
                    String errorBody = response.body() == null ? "" : response.body().string();
                    boolean retryable = response.code() == 429 || response.code() >= 500;
                    if (retryable && attempt < maxAttempts) {
                        LOG.debug("Provider {} returned HTTP {}, retrying", name, response.code());
                        sleep(delayMs);
                        delayMs = Math.min(delayMs * 2, 2000);
                        continue;
                    }
                    return new LlmResponse(
                        LlmResponse.ERROR_PREFIX + " HTTP " + response.code() + " " + errorBody,
                        List.of(),
                        Map.of("http_status", response.code())
                    );
                }

                ResponseBody body = response.body();
                if (body == null) {
                    return new LlmResponse("", List.of(), Map.of());
                }
                String contentType = response.header("Content-Type", "");
                if (contentType.contains("text/event-stream")) {
                    return parseSse(body.source());
                }
                return parseJson(body.string());
            } catch (IOException ioe) {
                if (attempt < maxAttempts) {
                    sleep(delayMs);
                    delayMs = Math.min(delayMs * 2, 2000);
                    continue;
                }
                return LlmResponse.error(ioe.getMessage());
            } catch (RuntimeException e) {
                return LlmResponse.error(e.getMessage());
            }
        }
        return LlmResponse.error("exhausted retries");
    }

    private Request buildRequest(ModelRequest request) throws IOException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", request.model());
        payload.put("messages", toWireMessages(request.messages()));
        payload.put("temperature", request.temperature());
        payload.put("max_tokens", request.maxTokens());
        payload.put("stream", true);
        if (!request.tools().isEmpty()) {
            payload.put("tools", request.tools());
            payload.put("tool_choice", "auto");
            payload.put("parallel_tool_calls", request.parallelToolCalls());
        }

        RequestBody body = RequestBody.create(mapper.writeValueAsString(payload), JSON);
        Request.Builder builder = new Request.Builder()
            .url(completionsUrl())
            .post(body)
            .header("Authorization", "Bearer " + apiKey)
            .header("Content-Type", "application/json")
            .header("Accept", "application/json, text/event-stream");
        for (Map.Entry<String, String> header : extraHeaders.entrySet()) {
            builder.header(header.getKey(), header.getValue());
        }
        return builder.build();
    }

    private HttpUrl completionsUrl() {
        return apiBase.newBuilder()
            .addPathSegment("chat")
            .addPathSegment("completions")
            .build();
    }

    private List<Map<String, Object>> toWireMessages(List<ChatMessage> messages) {
        List<Map<String, Object>> wire = new ArrayList<>(messages.size());
        messages.forEach(message -> wire.add(toWireMessage(message)));
        return wire;
    }

    private Map<String, Object> toWireMessage(ChatMessage message) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("role", toRoleValue(message.role()));
        row.put("content", message.content());
        switch (message.role()) {
            case ASSISTANT -> {
                if (message.hasToolCalls()) {
                    List<Map<String, Object>> calls = new ArrayList<>();
                    List<ToolCall> toolCalls = message.toolCalls();
                    for (int i = 0; i < toolCalls.size(); i++) {
                        calls.add(toWireToolCall(toolCalls.get(i), i));
                    }
                    row.put("tool_calls", calls);
                }
            }
            case TOOL -> {
                if (message.toolCallId() != null && !message.toolCallId().isBlank()) {
                    row.put("tool_call_id", message.toolCallId());
                }
            }
            default -> {
                // system and user turns carry content only
            }
        }
        return row;
    }

    private Map<String, Object> toWireToolCall(ToolCall call, int position) {
        String arguments;
        try {
            arguments = mapper.writeValueAsString(call.arguments());
        } catch (IOException e) {
            LOG.debug("Could not serialize arguments of tool call {}: {}", call.name(), e.getMessage());
            arguments = "{}";
        }
        return Map.of(
            "id", call.id() == null || call.id().isBlank() ? "call_" + position : call.id(),
            "type", "function",
            "function", Map.of("name", call.name(), "arguments", arguments)
        );
    }

    private static String toRoleValue(MessageRole role) {
        return switch (role) {
            case SYSTEM -> "system";
            case USER -> "user";
            case ASSISTANT -> "assistant";
            case TOOL -> "tool";
        };
    }

    private LlmResponse parseJson(String body) throws IOException {
        JsonNode root = mapper.readTree(body);
        JsonNode message = root.path("choices").path(0).path("message");
        String content = message.path("content").asText("");
        List<ToolCall> toolCalls = parseToolCalls(message.path("tool_calls"));
        return new LlmResponse(content, toolCalls, usageAsMap(root.path("usage")));
    }

    private LlmResponse parseSse(BufferedSource source) throws IOException {
        StreamedCompletion completion = new StreamedCompletion();
        String line;
        while ((line = source.readUtf8Line()) != null) {
            if (!line.startsWith("data:")) {
                continue;
            }
            String payload = line.substring("data:".length()).trim();
            if ("[DONE]".equals(payload)) {
                break;
            }
            if (!payload.isEmpty()) {
                completion.accept(mapper.readTree(payload));
            }
        }
        return completion.toResponse(this::parseArguments, this::usageAsMap);
    }

    private List<ToolCall> parseToolCalls(JsonNode node) {
        if (node == null || !node.isArray()) {
            return List.of();
        }
        List<ToolCall> toolCalls = new ArrayList<>();
        for (JsonNode item : node) {
            JsonNode function = item.path("function");
            JsonNode argsNode = function.path("arguments");
            Map<String, Object> args = argsNode.isTextual()
                ? parseArguments(argsNode.asText("{}"))
                : argsNode.isObject() ? mapper.convertValue(argsNode, MAP_TYPE) : Map.of();
            toolCalls.add(new ToolCall(item.path("id").asText(""), function.path("name").asText(""), args));
        }
        return toolCalls;
    }

    private Map<String, Object> usageAsMap(JsonNode usage) {
        if (usage == null || usage.isMissingNode() || usage.isNull()) {
            return Map.of();
        }
        return mapper.convertValue(usage, MAP_TYPE);
    }

    private Map<String, Object> parseArguments(String raw) {
        if (raw == null || raw.isBlank()) {
            return Map.of();
        }
        try {
            return mapper.readValue(raw, MAP_TYPE);
        } catch (IOException e) {
            LOG.debug("Provider {} sent unparseable tool arguments: {}", name, e.getMessage());
            return Map.of();
        }
    }

    private void sleep(long delayMs) {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }
}
