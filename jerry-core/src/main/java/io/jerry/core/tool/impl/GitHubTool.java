package io.jerry.core.tool.impl;

import com.fasterxml.jackson.databind.JsonNode;
import io.jerry.core.config.model.GitHubConfig;
import io.jerry.core.tool.Tool;
import io.jerry.core.tool.ToolContext;
import java.util.List;
import java.util.Map;
import okhttp3.HttpUrl;
import okhttp3.Request;

public final class GitHubTool implements Tool {
    private static final int SEARCH_LIMIT = 5;
    private static final int PR_BODY_CHARS = 500;

    private final String token;
    private final HttpUrl apiBase;
    private final HttpJson http;

    public GitHubTool(GitHubConfig config) {
        this.token = config.token() == null ? "" : config.token();
        this.apiBase = HttpUrl.get(config.apiBase());
        this.http = new HttpJson();
    }

    @Override
    public String name() {
        return "github";
    }

    @Override
    public String description() {
        return "Look up GitHub repositories, pull requests and issues.\n"
            + "Actions: search_repositories, repository_info, list_pull_requests, pull_request, search_issues.";
    }

    @Override
    public Map<String, Object> schema() {
        return Map.of(
            "type", "object",
            "properties", Map.of(
                "action", Map.of("type", "string", "enum", List.of(
                    "search_repositories", "repository_info", "list_pull_requests", "pull_request", "search_issues")),
                "query", Map.of("type", "string"),
                "owner", Map.of("type", "string"),
                "repo", Map.of("type", "string"),
                "number", Map.of("type", "integer"),
                "limit", Map.of("type", "integer"),
                "state", Map.of("type", "string", "enum", List.of("open", "closed", "all"))
            ),
            "required", List.of("action")
        );
    }

    @Override
    public String execute(Map<String, Object> input, ToolContext context) {
        if (token.isBlank()) {
            throw new IllegalStateException("GitHub token not configured. Please set GITHUB_TOKEN environment variable.");
        }
        String action = ToolArguments.action(input);
        return switch (action) {
            case "search_repositories" -> searchRepositories(ToolArguments.required(input, "query"));
            case "repository_info" -> repositoryInfo(owner(input), repo(input));
            case "list_pull_requests" -> listPullRequests(owner(input), repo(input),
                ToolArguments.integer(input, "limit", 5, 1, 30));
            case "pull_request" -> pullRequest(owner(input), repo(input),
                ToolArguments.integer(input, "number", 0, 0, Integer.MAX_VALUE));
            case "search_issues" -> searchIssues(owner(input), repo(input),
                ToolArguments.text(input, "query", ""), ToolArguments.text(input, "state", "open"));
            default -> throw new IllegalArgumentException("unsupported action: " + action);
        };
    }

    private String searchRepositories(String query) {
        JsonNode root = get(apiBase.newBuilder()
            .addPathSegments("search/repositories")
            .addQueryParameter("q", query)
            .addQueryParameter("per_page", String.valueOf(SEARCH_LIMIT))
            .build());
        JsonNode items = root == null ? null : root.path("items");
        if (items == null || !items.isArray() || items.isEmpty()) {
            return "No repositories found for query: " + query;
        }
        StringBuilder out = new StringBuilder("Found ").append(items.size())
            .append(" repositories for '").append(query).append("':\n\n");
        for (JsonNode repo : items) {
            out.append("• **").append(repo.path("full_name").asText()).append("** (")
                .append(repo.path("stargazers_count").asInt()).append(" stars)\n")
                .append("  ").append(orDefault(repo.path("description"), "No description")).append('\n')
                .append("  ").append(repo.path("html_url").asText()).append("\n\n");
        }
        return out.toString().stripTrailing();
    }

    private String repositoryInfo(String owner, String repo) {
        JsonNode info = get(repoUrl(owner, repo).build());
        if (info == null) {
            return "Repository " + owner + "/" + repo + " not found.";
        }
        return "**" + info.path("full_name").asText() + "**\n\n"
            + "Description: " + orDefault(info.path("description"), "No description") + "\n"
            + "Language: " + orDefault(info.path("language"), "Not specified") + "\n"
            + "Stars: " + info.path("stargazers_count").asInt()
            + " | Forks: " + info.path("forks_count").asInt()
            + " | Watchers: " + info.path("watchers_count").asInt() + "\n"
            + "Created: " + info.path("created_at").asText() + "\n"
            + "Updated: " + info.path("updated_at").asText() + "\n"
            + "URL: " + info.path("html_url").asText();
    }

    private String listPullRequests(String owner, String repo, int limit) {
        JsonNode pulls = get(repoUrl(owner, repo)
            .addPathSegment("pulls")
            .addQueryParameter("state", "all")
            .addQueryParameter("sort", "created")
            .addQueryParameter("direction", "desc")
            .addQueryParameter("per_page", String.valueOf(limit))
            .build());
        if (pulls == null) {
            return "Repository " + owner + "/" + repo + " not found.";
        }
        if (!pulls.isArray() || pulls.isEmpty()) {
            return "No pull requests found for " + owner + "/" + repo + ".";
        }
        StringBuilder out = new StringBuilder("Recent pull requests for ").append(owner).append('/').append(repo)
            .append(":\n\n");
        for (JsonNode pr : pulls) {
            out.append("• **#").append(pr.path("number").asInt()).append("** ").append(pr.path("title").asText())
                .append(' ').append(status(pr)).append('\n')
                .append("  Author: ").append(pr.path("user").path("login").asText()).append('\n')
                .append("  Created: ").append(pr.path("created_at").asText()).append('\n')
                .append("  URL: ").append(pr.path("html_url").asText()).append("\n\n");
        }
        return out.toString().stripTrailing();
    }

    private String pullRequest(String owner, String repo, int number) {
        if (number <= 0) {
            throw new IllegalArgumentException("number is required");
        }
        JsonNode pr = get(repoUrl(owner, repo).addPathSegment("pulls").addPathSegment(String.valueOf(number)).build());
        if (pr == null) {
            return "Pull request #" + number + " not found in " + owner + "/" + repo + ".";
        }
        StringBuilder out = new StringBuilder("**Pull Request #").append(number).append(": ")
            .append(pr.path("title").asText()).append("**\n\n")
            .append("Status: ").append(status(pr)).append('\n')
            .append("Author: ").append(pr.path("user").path("login").asText()).append('\n')
            .append("Created: ").append(pr.path("created_at").asText()).append('\n')
            .append("Updated: ").append(pr.path("updated_at").asText()).append('\n')
            .append("URL: ").append(pr.path("html_url").asText());
        String body = pr.path("body").isTextual() ? pr.path("body").asText() : "";
        if (!body.isBlank()) {
            String excerpt = body.length() > PR_BODY_CHARS ? body.substring(0, PR_BODY_CHARS) + "..." : body;
            out.append("\n\nDescription:\n").append(excerpt);
        }
        return out.toString();
    }

    private String searchIssues(String owner, String repo, String query, String state) {
        String q = "repo:" + owner + "/" + repo + " is:issue" + ("all".equals(state) ? "" : " state:" + state)
            + (query.isBlank() ? "" : " " + query);
        JsonNode root = get(apiBase.newBuilder()
            .addPathSegments("search/issues")
            .addQueryParameter("q", q)
            .addQueryParameter("per_page", String.valueOf(SEARCH_LIMIT))
            .build());
        JsonNode items = root == null ? null : root.path("items");
        if (items == null || !items.isArray() || items.isEmpty()) {
            return "No " + state + " issues found for query '" + query + "' in " + owner + "/" + repo + ".";
        }
        StringBuilder out = new StringBuilder("Found ").append(items.size()).append(' ').append(state)
            .append(" issues for '").append(query).append("' in ").append(owner).append('/').append(repo)
            .append(":\n\n");
        for (JsonNode issue : items) {
            out.append("• **#").append(issue.path("number").asInt()).append("** ")
                .append(issue.path("title").asText()).append(' ').append(status(issue)).append('\n')
                .append("  Author: ").append(issue.path("user").path("login").asText()).append('\n')
                .append("  Created: ").append(issue.path("created_at").asText()).append('\n')
                .append("  URL: ").append(issue.path("html_url").asText()).append("\n\n");
        }
        return out.toString().stripTrailing();
    }

    private JsonNode get(HttpUrl url) {
        return http.execute(new Request.Builder()
            .url(url)
            .header("Accept", "application/vnd.github+json")
            .header("Authorization", "Bearer " + token)
            .header("X-GitHub-Api-Version", "2022-11-28")
            .get()
            .build());
    }

    private HttpUrl.Builder repoUrl(String owner, String repo) {
        return apiBase.newBuilder().addPathSegment("repos").addPathSegment(owner).addPathSegment(repo);
    }

    private static String owner(Map<String, Object> input) {
        return ToolArguments.required(input, "owner");
    }

    private static String repo(Map<String, Object> input) {
        return ToolArguments.required(input, "repo");
    }

    private static String status(JsonNode item) {
        return "open".equals(item.path("state").asText()) ? "Open" : "Closed";
    }

    private static String orDefault(JsonNode node, String fallback) {
        return node.isTextual() && !node.asText().isBlank() ? node.asText() : fallback;
    }
}
