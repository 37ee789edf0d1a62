package io.jerry.core.tool.impl;

import io.jerry.core.config.model.WebFetchConfig;
import io.jerry.core.tool.Tool;
import io.jerry.core.tool.ToolContext;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;

// Private and loopback targets are refused unless allowed; redirects are re-checked per hop.
public final class WebTool implements Tool {
    private static final int MAX_REDIRECTS = 5;
    private static final int SUMMARY_CHARS = 1000;
    private static final int DEFAULT_SCRAPE_CHARS = 2000;

    private final int maxChars;
    private final boolean allowPrivateNetworks;
    private final OkHttpClient client;

    public WebTool(WebFetchConfig config) {
        this.maxChars = Math.max(1, config.maxChars());
        this.allowPrivateNetworks = config.allowPrivateNetworks();
        this.client = new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(10))
            .readTimeout(Duration.ofSeconds(20))
            .followRedirects(false)
            .followSslRedirects(false)
            .build();
    }

    @Override
    public String name() {
        return "web";
    }

    @Override
    public String description() {
        return "Read a web page: scrape its text, summarize it, list its links or get its title.\n"
            + "Actions: scrape, summary, links, title.";
    }

    @Override
    public Map<String, Object> schema() {
        return Map.of(
            "type", "object",
            "properties", Map.of(
                "action", Map.of("type", "string", "enum", List.of("scrape", "summary", "links", "title")),
                "url", Map.of("type", "string", "description", "http or https URL"),
                "max_length", Map.of("type", "integer", "description", "Character limit for scrape"),
                "max_links", Map.of("type", "integer", "description", "Link limit for links")
            ),
            "required", List.of("action", "url")
        );
    }

    @Override
    public String execute(Map<String, Object> input, ToolContext context) {
        String action = ToolArguments.action(input);
        HttpUrl url = parseUrl(ToolArguments.required(input, "url"));
        return switch (action) {
            case "scrape" -> scrape(url, ToolArguments.integer(input, "max_length", DEFAULT_SCRAPE_CHARS, 1, maxChars));
            case "summary" -> summary(url);
            case "links" -> links(url, ToolArguments.integer(input, "max_links", 10, 1, 100));
            case "title" -> title(url);
            default -> throw new IllegalArgumentException("unsupported action: " + action);
        };
    }

    private String scrape(HttpUrl url, int limit) {
        Document document = fetch(url);
        document.select("script, style").remove();
        return "Content from " + url + ":\n\n" + truncate(document.text(), limit);
    }

    private String summary(HttpUrl url) {
        Document document = fetch(url);
        String title = document.title().isBlank() ? "No title found" : document.title().trim();
        Element meta = document.selectFirst("meta[name=description]");
        String description = meta == null || meta.attr("content").isBlank()
            ? "No description found"
            : meta.attr("content").trim();

        Element main = document.selectFirst("main, article, div.content");
        String content;
        if (main == null) {
            content = "No main content found";
        } else {
            main.select("script, style").remove();
            content = truncate(main.text(), SUMMARY_CHARS);
        }

        return "**" + title + "**\n\n"
            + "URL: " + url + "\n\n"
            + "Description: " + description + "\n\n"
            + "Content Preview:\n" + content;
    }

    private String links(HttpUrl url, int maxLinks) {
        Document document = fetch(url);
        Elements anchors = document.select("a[href]");
        if (anchors.isEmpty()) {
            return "No links found on " + url;
        }
        StringBuilder out = new StringBuilder("Links found on ").append(url).append(":\n\n");
        int index = 1;
        for (Element anchor : anchors) {
            if (index > maxLinks) {
                break;
            }
            String href = anchor.absUrl("href");
            if (href.isBlank()) {
                href = anchor.attr("href");
            }
            String text = anchor.text().isBlank() ? href : anchor.text().trim();
            out.append(index).append(". **").append(text).append("**\n   ").append(href).append("\n\n");
            index++;
        }
        return out.toString().stripTrailing();
    }

    private String title(HttpUrl url) {
        Document document = fetch(url);
        String title = document.title();
        return title.isBlank() ? "No title found for " + url : "Title of " + url + ": " + title.trim();
    }

    private Document fetch(HttpUrl url) {
        HttpUrl current = url;
        for (int hop = 0; hop <= MAX_REDIRECTS; hop++) {
            checkTarget(current);
            Request request = new Request.Builder()
                .url(current)
                .header("User-Agent", "jerry/0.1")
                .get()
                .build();
            try (Response response = client.newCall(request).execute()) {
                if (response.isRedirect()) {
                    String location = response.header("Location");
                    HttpUrl next = location == null ? null : current.resolve(location);
                    if (next == null) {
                        throw new IllegalStateException("redirect without a usable Location from " + current);
                    }
                    current = next;
                    continue;
                }
                if (!response.isSuccessful()) {
                    throw new IllegalStateException("HTTP " + response.code() + " from " + current);
                }
                ResponseBody body = response.body();
                return Jsoup.parse(body == null ? "" : body.string(), current.toString());
            } catch (IOException e) {
                throw new UncheckedIOException("Error accessing website " + current, e);
            }
        }
        throw new IllegalStateException("too many redirects from " + url);
    }

    private void checkTarget(HttpUrl url) {
        if (allowPrivateNetworks) {
            return;
        }
        InetAddress address;
        try {
            address = InetAddress.getByName(url.host());
        } catch (UnknownHostException e) {
            throw new IllegalArgumentException("unknown host: " + url.host(), e);
        }
        if (address.isLoopbackAddress() || address.isAnyLocalAddress() || address.isSiteLocalAddress()) {
            throw new IllegalArgumentException("Private or loopback addresses are blocked");
        }
        if (address.isLinkLocalAddress()) {
            throw new IllegalArgumentException("Link-local addresses are blocked");
        }
    }

    private static HttpUrl parseUrl(String raw) {
        String candidate = raw.contains("://") ? raw : "https://" + raw;
        HttpUrl url = HttpUrl.parse(candidate);
        if (url == null) {
            throw new IllegalArgumentException("Invalid URL provided: " + raw);
        }
        return url;
    }

    private static String truncate(String text, int limit) {
        return text.length() > limit ? text.substring(0, limit) + "..." : text;
    }
}
