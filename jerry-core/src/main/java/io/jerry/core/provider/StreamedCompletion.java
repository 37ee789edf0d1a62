package io.jerry.core.provider;

import com.fasterxml.jackson.databind.JsonNode;
import io.jerry.core.model.ToolCall;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.Function;

final class StreamedCompletion {
    private final StringBuilder content = new StringBuilder();
    private final SortedMap<Integer, PartialCall> calls = new TreeMap<>();
    private JsonNode usage;

    void accept(JsonNode chunk) {
        JsonNode chunkUsage = chunk.path("usage");
        if (chunkUsage.isObject()) {
            usage = chunkUsage;
        }
        for (JsonNode choice : chunk.path("choices")) {
            JsonNode delta = choice.path("delta");
            JsonNode text = delta.path("content");
            if (text.isTextual()) {
                content.append(text.asText());
            }
            for (JsonNode fragment : delta.path("tool_calls")) {
                int index = Math.max(fragment.path("index").asInt(0), 0);
                calls.computeIfAbsent(index, ignored -> new PartialCall()).merge(fragment);
            }
        }
    }

    LlmResponse toResponse(
        Function<String, Map<String, Object>> argumentParser,
        Function<JsonNode, Map<String, Object>> usageParser
    ) {
        List<ToolCall> toolCalls = new ArrayList<>(calls.size());
        calls.forEach((index, call) -> toolCalls.add(new ToolCall(
            call.id.isEmpty() ? "call_" + index : call.id,
            call.name,
            argumentParser.apply(call.arguments.toString())
        )));
        return new LlmResponse(content.toString(), toolCalls, usageParser.apply(usage));
    }

    private static final class PartialCall {
        private String id = "";
        private String name = "";
        private final StringBuilder arguments = new StringBuilder();

        void merge(JsonNode fragment) {
            String fragmentId = fragment.path("id").asText("");
            if (id.isEmpty() && !fragmentId.isBlank()) {
                id = fragmentId;
            }
            JsonNode function = fragment.path("function");
            String fragmentName = function.path("name").asText("");
            if (!fragmentName.isBlank()) {
                name = fragmentName;
            }
            arguments.append(function.path("arguments").asText(""));
        }
    }
}
