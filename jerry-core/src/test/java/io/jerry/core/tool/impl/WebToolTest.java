package io.jerry.core.tool.impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.jerry.core.config.model.WebFetchConfig;
import io.jerry.core.tool.ToolContext;
import java.io.IOException;
import java.util.Map;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class WebToolTest {
    private static final String PAGE = """
        <html>
          <head>
            <title>Example Domain</title>
            <meta name="description" content="An example page">
            <script>var hidden = 1;</script>
          </head>
          <body>
            <nav><a href="/about">About</a> <a href="https://other.example/x">Other</a></nav>
            <main><p>This domain is for use in examples.</p></main>
          </body>
        </html>""";

    private MockWebServer server;
    private final WebTool tool = new WebTool(new WebFetchConfig(20_000, true));

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void shouldReturnPageTitle() {
        server.enqueue(html(PAGE));

        String result = tool.execute(Map.of("action", "title", "url", server.url("/page").toString()), ToolContext.detached());

        assertThat(result).startsWith("Title of ").endsWith("/page: Example Domain");
    }

    @Test
    void shouldScrapeVisibleTextWithinLimit() {
        server.enqueue(html(PAGE));

        String result = tool.execute(
            Map.of("action", "scrape", "url", server.url("/page").toString(), "max_length", 30), ToolContext.detached());

        assertThat(result).startsWith("Content from ");
        assertThat(result).doesNotContain("hidden");
        String content = result.substring(result.indexOf(":\n\n") + 3);
        assertThat(content).hasSize(33).endsWith("...");
    }

    @Test
    void shouldSummarizeWithDescriptionAndMainContent() {
        server.enqueue(html(PAGE));

        String result = tool.execute(Map.of("action", "summary", "url", server.url("/page").toString()), ToolContext.detached());

        assertThat(result).startsWith("**Example Domain**");
        assertThat(result).contains("Description: An example page");
        assertThat(result).endsWith("Content Preview:\nThis domain is for use in examples.");
    }

    @Test
    void shouldListAbsoluteLinks() {
        server.enqueue(html(PAGE));

        String result = tool.execute(
            Map.of("action", "links", "url", server.url("/page").toString(), "max_links", 1), ToolContext.detached());

        assertThat(result).contains("1. **About**\n   " + server.url("/about"));
        assertThat(result).doesNotContain("Other");
    }

    @Test
    void shouldFollowRedirects() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(302).setHeader("Location", "/final"));
        server.enqueue(html(PAGE));

        String result = tool.execute(Map.of("action", "title", "url", server.url("/start").toString()), ToolContext.detached());

        assertThat(result).endsWith("/final: Example Domain");
        assertThat(server.takeRequest().getPath()).isEqualTo("/start");
        assertThat(server.takeRequest().getPath()).isEqualTo("/final");
    }

    @Test
    void shouldBlockPrivateTargetsByDefault() {
        WebTool guarded = new WebTool(new WebFetchConfig(20_000, false));

        assertThatThrownBy(() -> guarded.execute(
            Map.of("action", "title", "url", "http://127.0.0.1:" + server.getPort() + "/page"),
            ToolContext.detached()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("blocked");
        assertThatThrownBy(() -> guarded.execute(Map.of("action", "title", "url", "http://10.0.0.7/admin"),
            ToolContext.detached()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Private or loopback addresses are blocked");
        assertThatThrownBy(() -> guarded.execute(Map.of("action", "title", "url", "http://169.254.169.254/latest"),
            ToolContext.detached()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Link-local addresses are blocked");
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void shouldRejectUnknownActionAndMissingUrl() {
        assertThatThrownBy(() -> tool.execute(Map.of("action", "crawl", "url", "example.com"), ToolContext.detached()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("unsupported action");
        assertThatThrownBy(() -> tool.execute(Map.of("action", "title"), ToolContext.detached()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("url is required");
    }

    private static MockResponse html(String body) {
        return new MockResponse().setHeader("Content-Type", "text/html; charset=utf-8").setBody(body);
    }
}
