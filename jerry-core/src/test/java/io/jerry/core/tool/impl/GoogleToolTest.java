package io.jerry.core.tool.impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.jerry.core.config.model.GoogleConfig;
import io.jerry.core.tool.ToolContext;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class GoogleToolTest {
    private static final String TOKEN = "{\"access_token\":\"ya29.test\",\"expires_in\":3600}";

    private final Clock clock = Clock.fixed(Instant.parse("2026-03-02T09:00:00Z"), ZoneOffset.UTC);
    private MockWebServer server;
    private GoogleTool tool;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        tool = new GoogleTool(new GoogleConfig(
            "client-id",
            "client-secret",
            "refresh-token",
            server.url("/token").toString(),
            server.url("/").toString()
        ), clock);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void shouldRefreshTokenOnceAndListDriveFiles() throws Exception {
        server.enqueue(new MockResponse().setBody(TOKEN));
        server.enqueue(new MockResponse().setBody("""
            {"files":[{"name":"Roadmap","mimeType":"application/pdf","createdTime":"2026-01-01",
              "modifiedTime":"2026-02-01","webViewLink":"https://drive.google.com/file/1"}]}"""));
        server.enqueue(new MockResponse().setBody("{\"files\":[]}"));

        String first = tool.execute(Map.of("action", "list_drive_files"), ToolContext.detached());
        String second = tool.execute(Map.of("action", "list_drive_files", "query", "name contains 'x'"),
            ToolContext.detached());

        assertThat(first).startsWith("Found 1 files in Google Drive:").contains("• **Roadmap**");
        assertThat(second).isEqualTo("No files found for query: name contains 'x'");

        RecordedRequest token = server.takeRequest();
        assertThat(token.getPath()).isEqualTo("/token");
        assertThat(token.getBody().readUtf8()).contains("grant_type=refresh_token", "refresh_token=refresh-token");
        RecordedRequest files = server.takeRequest();
        assertThat(files.getRequestUrl().encodedPath()).isEqualTo("/drive/v3/files");
        assertThat(files.getHeader("Authorization")).isEqualTo("Bearer ya29.test");
        assertThat(server.takeRequest().getPath()).startsWith("/drive/v3/files");
        assertThat(server.getRequestCount()).isEqualTo(3);
    }

    @Test
    void shouldSummarizeGmailMessages() throws Exception {
        server.enqueue(new MockResponse().setBody(TOKEN));
        server.enqueue(new MockResponse().setBody("{\"messages\":[{\"id\":\"m1\"}]}"));
        server.enqueue(new MockResponse().setBody("""
            {"payload":{"headers":[{"name":"Subject","value":"Invoice"},{"name":"From","value":"billing@example.com"}]}}"""));

        String result = tool.execute(Map.of("action", "search_gmail", "query", "invoice"), ToolContext.detached());

        assertThat(result).isEqualTo("""
            Found 1 emails for 'invoice':

            • **Invoice**
              From: billing@example.com
              Date: Unknown Date""");
        server.takeRequest();
        assertThat(server.takeRequest().getRequestUrl().queryParameter("q")).isEqualTo("invoice");
        assertThat(server.takeRequest().getRequestUrl().encodedPath()).isEqualTo("/gmail/v1/users/me/messages/m1");
    }

    @Test
    void shouldQueryCalendarForNextSevenDays() throws Exception {
        server.enqueue(new MockResponse().setBody(TOKEN));
        server.enqueue(new MockResponse().setBody("""
            {"items":[{"summary":"Standup","start":{"dateTime":"2026-03-02T10:00:00Z"},"location":"Zoom"}]}"""));

        String result = tool.execute(Map.of("action", "calendar_events"), ToolContext.detached());

        assertThat(result).contains("• **Standup**", "Time: 2026-03-02T10:00:00Z", "Location: Zoom");
        server.takeRequest();
        RecordedRequest events = server.takeRequest();
        assertThat(events.getRequestUrl().queryParameter("timeMin")).isEqualTo("2026-03-02T09:00:00Z");
        assertThat(events.getRequestUrl().queryParameter("timeMax")).isEqualTo("2026-03-09T09:00:00Z");
    }

    @Test
    void shouldEscapeDocsQuery() throws Exception {
        server.enqueue(new MockResponse().setBody(TOKEN));
        server.enqueue(new MockResponse().setBody("{\"files\":[]}"));

        String result = tool.execute(Map.of("action", "search_docs", "query", "q1 'plan'"), ToolContext.detached());

        assertThat(result).isEqualTo("No Google Docs found for query: q1 'plan'");
        server.takeRequest();
        assertThat(server.takeRequest().getRequestUrl().queryParameter("q"))
            .isEqualTo("name contains 'q1 \\'plan\\'' and mimeType='application/vnd.google-apps.document'");
    }

    @Test
    void shouldRefuseWhenNotConfigured() {
        GoogleTool unconfigured = new GoogleTool(new GoogleConfig("", "", "",
            server.url("/token").toString(), server.url("/").toString()), clock);

        assertThatThrownBy(() -> unconfigured.execute(Map.of("action", "calendar_events"), ToolContext.detached()))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("GOOGLE_REFRESH_TOKEN");
        assertThat(server.getRequestCount()).isZero();
    }
}
