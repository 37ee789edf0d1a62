package io.jerry.core.tool.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import io.jerry.core.config.model.GoogleConfig;
import io.jerry.core.tool.Tool;
import io.jerry.core.tool.ToolContext;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import okhttp3.HttpUrl;
import okhttp3.Request;

public final class GoogleTool implements Tool {
    private static final String DOCS_MIME = "application/vnd.google-apps.document";
    private static final Duration CALENDAR_WINDOW = Duration.ofDays(7);

    private final boolean configured;
    private final HttpUrl apiBase;
    private final HttpJson http;
    private final GoogleAccessTokens tokens;
    private final Clock clock;

    public GoogleTool(GoogleConfig config) {
        this(config, Clock.systemUTC());
    }

    public GoogleTool(GoogleConfig config, Clock clock) {
        this.configured = config.configured();
        this.apiBase = HttpUrl.get(config.apiBase());
        this.http = new HttpJson();
        this.clock = clock;
        this.tokens = new GoogleAccessTokens(config, http, clock);
    }

    @Override
    public String name() {
        return "google";
    }

    @Override
    public String description() {
        return "Search Gmail, list Drive files, read upcoming Calendar events and find Google Docs.\n"
            + "Actions: search_gmail, list_drive_files, calendar_events, search_docs.";
    }

    @Override
    public Map<String, Object> schema() {
        return Map.of(
            "type", "object",
            "properties", Map.of(
                "action", Map.of("type", "string", "enum", List.of(
                    "search_gmail", "list_drive_files", "calendar_events", "search_docs")),
                "query", Map.of("type", "string"),
                "max_results", Map.of("type", "integer")
            ),
            "required", List.of("action")
        );
    }

    @Override
    public String execute(Map<String, Object> input, ToolContext context) {
        if (!configured) {
            throw new IllegalStateException("Google is not configured. Set GOOGLE_CLIENT_ID, "
                + "GOOGLE_CLIENT_SECRET and GOOGLE_REFRESH_TOKEN.");
        }
        String action = ToolArguments.action(input);
        return switch (action) {
            case "search_gmail" -> searchGmail(ToolArguments.required(input, "query"),
                ToolArguments.integer(input, "max_results", 5, 1, 25));
            case "list_drive_files" -> listDriveFiles(ToolArguments.text(input, "query", ""),
                ToolArguments.integer(input, "max_results", 10, 1, 50));
            case "calendar_events" -> calendarEvents(ToolArguments.integer(input, "max_results", 10, 1, 50));
            case "search_docs" -> searchDocs(ToolArguments.required(input, "query"),
                ToolArguments.integer(input, "max_results", 5, 1, 25));
            default -> throw new IllegalArgumentException("unsupported action: " + action);
        };
    }

    private String searchGmail(String query, int maxResults) {
        HttpUrl messagesUrl = apiBase.newBuilder().addPathSegments("gmail/v1/users/me/messages").build();
        JsonNode list = get(messagesUrl.newBuilder()
            .addQueryParameter("q", query)
            .addQueryParameter("maxResults", String.valueOf(maxResults))
            .build());
        JsonNode messages = list == null ? null : list.path("messages");
        if (messages == null || !messages.isArray() || messages.isEmpty()) {
            return "No emails found for query: " + query;
        }

        StringBuilder out = new StringBuilder("Found ").append(messages.size())
            .append(" emails for '").append(query).append("':\n\n");
        for (JsonNode message : messages) {
            JsonNode detail = get(messagesUrl.newBuilder()
                .addPathSegment(message.path("id").asText())
                .addQueryParameter("format", "metadata")
                .addQueryParameter("metadataHeaders", "Subject")
                .addQueryParameter("metadataHeaders", "From")
                .addQueryParameter("metadataHeaders", "Date")
                .build());
            JsonNode headers = detail == null ? null : detail.path("payload").path("headers");
            out.append("• **").append(header(headers, "Subject", "No Subject")).append("**\n")
                .append("  From: ").append(header(headers, "From", "Unknown Sender")).append('\n')
                .append("  Date: ").append(header(headers, "Date", "Unknown Date")).append("\n\n");
        }
        return out.toString().stripTrailing();
    }

    private String listDriveFiles(String query, int maxResults) {
        HttpUrl.Builder url = driveFiles(maxResults, "files(id,name,mimeType,createdTime,modifiedTime,webViewLink)");
        if (!query.isBlank()) {
            url.addQueryParameter("q", query);
        }
        JsonNode files = files(get(url.build()));
        if (files.isEmpty()) {
            return "No files found for query: " + (query.isBlank() ? "all files" : query);
        }
        StringBuilder out = new StringBuilder("Found ").append(files.size()).append(" files in Google Drive:\n\n");
        for (JsonNode file : files) {
            out.append("• **").append(file.path("name").asText()).append("**\n")
                .append("  Type: ").append(file.path("mimeType").asText("Unknown")).append('\n')
                .append("  Created: ").append(file.path("createdTime").asText("Unknown")).append('\n')
                .append("  Modified: ").append(file.path("modifiedTime").asText("Unknown")).append('\n')
                .append("  URL: ").append(file.path("webViewLink").asText("No URL")).append("\n\n");
        }
        return out.toString().stripTrailing();
    }

    private String calendarEvents(int maxResults) {
        Instant now = clock.instant();
        JsonNode root = get(apiBase.newBuilder()
            .addPathSegments("calendar/v3/calendars/primary/events")
            .addQueryParameter("timeMin", now.toString())
            .addQueryParameter("timeMax", now.plus(CALENDAR_WINDOW).toString())
            .addQueryParameter("maxResults", String.valueOf(maxResults))
            .addQueryParameter("singleEvents", "true")
            .addQueryParameter("orderBy", "startTime")
            .build());
        JsonNode items = root == null ? null : root.path("items");
        if (items == null || !items.isArray() || items.isEmpty()) {
            return "No upcoming events found in the next 7 days.";
        }
        StringBuilder out = new StringBuilder("Upcoming events (next 7 days):\n\n");
        for (JsonNode event : items) {
            JsonNode start = event.path("start");
            String time = start.hasNonNull("dateTime") ? start.path("dateTime").asText() : start.path("date").asText();
            out.append("• **").append(event.path("summary").asText("No Title")).append("**\n")
                .append("  Time: ").append(time).append('\n')
                .append("  Location: ").append(event.path("location").asText("No Location")).append("\n\n");
        }
        return out.toString().stripTrailing();
    }

    private String searchDocs(String query, int maxResults) {
        String escaped = query.replace("\\", "\\\\").replace("'", "\\'");
        HttpUrl url = driveFiles(maxResults, "files(id,name,createdTime,modifiedTime,webViewLink)")
            .addQueryParameter("q", "name contains '" + escaped + "' and mimeType='" + DOCS_MIME + "'")
            .build();
        JsonNode files = files(get(url));
        if (files.isEmpty()) {
            return "No Google Docs found for query: " + query;
        }
        StringBuilder out = new StringBuilder("Found ").append(files.size())
            .append(" Google Docs for '").append(query).append("':\n\n");
        for (JsonNode file : files) {
            out.append("• **").append(file.path("name").asText()).append("**\n")
                .append("  Created: ").append(file.path("createdTime").asText("Unknown")).append('\n')
                .append("  Modified: ").append(file.path("modifiedTime").asText("Unknown")).append('\n')
                .append("  URL: ").append(file.path("webViewLink").asText("No URL")).append("\n\n");
        }
        return out.toString().stripTrailing();
    }

    private HttpUrl.Builder driveFiles(int pageSize, String fields) {
        return apiBase.newBuilder()
            .addPathSegments("drive/v3/files")
            .addQueryParameter("pageSize", String.valueOf(pageSize))
            .addQueryParameter("fields", fields);
    }

    private JsonNode get(HttpUrl url) {
        return http.execute(new Request.Builder()
            .url(url)
            .header("Authorization", "Bearer " + tokens.current())
            .get()
            .build());
    }

    private static JsonNode files(JsonNode root) {
        JsonNode files = root == null ? null : root.path("files");
        return files != null && files.isArray() ? files : MissingNode.getInstance();
    }

    private static String header(JsonNode headers, String name, String fallback) {
        if (headers == null || !headers.isArray()) {
            return fallback;
        }
        for (JsonNode header : headers) {
            if (name.equalsIgnoreCase(header.path("name").asText())) {
                return header.path("value").asText(fallback);
            }
        }
        return fallback;
    }
}
