package io.jerry.core.tool.impl;

import com.fasterxml.jackson.databind.JsonNode;
import io.jerry.core.config.model.WebSearchConfig;
import io.jerry.core.tool.Tool;
import io.jerry.core.tool.ToolContext;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import okhttp3.HttpUrl;
import okhttp3.Request;

public final class SearchTool implements Tool {
    private final String apiKey;
    private final HttpUrl apiBase;
    private final int defaultMaxResults;
    private final HttpJson http;

    public SearchTool(WebSearchConfig config) {
        this.apiKey = config.apiKey() == null ? "" : config.apiKey();
        this.apiBase = HttpUrl.get(config.apiBase());
        this.defaultMaxResults = Math.max(1, config.maxResults());
        this.http = new HttpJson();
    }

    @Override
    public String name() {
        return "search";
    }

    @Override
    public String description() {
        return "Search the web and return titles, links and snippets.\n"
            + "Use for current events or facts you are unsure about.";
    }

    @Override
    public Map<String, Object> schema() {
        return Map.of(
            "type", "object",
            "properties", Map.of(
                "query", Map.of("type", "string", "description", "Search terms"),
                "count", Map.of("type", "integer", "description", "Number of results (1-10)")
            ),
            "required", List.of("query")
        );
    }

    @Override
    public String execute(Map<String, Object> input, ToolContext context) {
        String query = ToolArguments.required(input, "query");
        int count = ToolArguments.integer(input, "count", defaultMaxResults, 1, 10);
        if (apiKey.isBlank()) {
            throw new IllegalStateException("BRAVE_API_KEY not configured");
        }

        HttpUrl url = apiBase.newBuilder()
            .addPathSegments("web/search")
            .addQueryParameter("q", query)
            .addQueryParameter("count", String.valueOf(count))
            .build();
        Request request = new Request.Builder()
            .url(url)
            .header("Accept", "application/json")
            .header("X-Subscription-Token", apiKey)
            .get()
            .build();
        JsonNode root = http.execute(request);
        return format(root, query);
    }

    private static String format(JsonNode root, String query) {
        JsonNode results = root == null ? null : root.path("web").path("results");
        if (results == null || !results.isArray() || results.isEmpty()) {
            return "No results for: " + query;
        }

        List<String> lines = new ArrayList<>();
        lines.add("Results for: " + query);
        int index = 1;
        for (JsonNode result : results) {
            lines.add(index + ". " + result.path("title").asText(""));
            lines.add("   " + result.path("url").asText(""));
            String description = result.path("description").asText("");
            if (!description.isBlank()) {
                lines.add("   " + description);
            }
            index++;
        }
        return String.join("\n", lines);
    }
}
