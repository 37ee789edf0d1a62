package io.jerry.core.runtime;

import static org.assertj.core.api.Assertions.assertThat;

import io.jerry.core.config.ConfigService;
import io.jerry.core.config.model.JerryConfig;
import io.jerry.core.config.model.ProvidersConfig;
import io.jerry.core.provider.LlmProvider;
import io.jerry.core.provider.LlmResponse;
import io.jerry.core.provider.ModelRequest;
import io.jerry.core.provider.ProviderRegistry;
import io.jerry.core.slack.SlackSignatureVerifier;
import io.jerry.core.tool.Tool;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JerryRuntimeTest {

    private MockWebServer server;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                String path = request.getPath() == null ? "" : request.getPath();
                if (path.startsWith("/v1/chat/completions")) {
                    return new MockResponse()
                        .setHeader("Content-Type", "application/json")
                        .setBody("{\"choices\":[{\"message\":{\"content\":\"runtime-ok\"}}]}");
                }
                if (path.startsWith("/api/chat.postMessage")) {
                    return new MockResponse()
                        .setHeader("Content-Type", "application/json")
                        .setBody("{\"ok\":true,\"ts\":\"2.2\"}");
                }
                return new MockResponse().setResponseCode(404);
            }
        });
        server.start();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void shouldBuildDisabledProvidersWhenNoKeysAreConfigured() {
        ProviderRegistry registry = JerryRuntime.buildProviders(ProvidersConfig.defaults());

        assertThat(registry.names()).contains("mistral", "openai", "openrouter");
        LlmProvider mistral = registry.find("mistral").orElseThrow();
        LlmResponse response = mistral.chat(ModelRequest.of("mistral-large-latest", List.of(), List.of()));
        assertThat(response.content()).startsWith(LlmResponse.ERROR_PREFIX).contains("provider openrouter is not configured (set providers.openrouter.apiKey");
    }

    @Test
    void shouldRegisterBuiltInToolsAndSkipUnconfiguredServices() {
        try (JerryRuntime runtime = new JerryRuntime(JerryConfig.defaults())) {
            runtime.startServices();

            assertThat(runtime.toolRegistry().all())
                .extracting(Tool::name)
                .containsExactlyInAnyOrder("search", "web", "github", "google");
            assertThat(runtime.slackPort()).isEqualTo(-1);
        }
    }

    @Test
    void shouldAnswerSignedSlackMentionThroughConfiguredModel() throws Exception {
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            {
              "agent": { "provider": "mistral", "model": "mistral-small-latest" },
              "providers": { "mistral": { "apiKey": "sk-test", "apiBase": "%s" } },
              "slack": {
                "botToken": "xoxb-test",
                "signingSecret": "signing-secret",
                "apiBase": "%s",
                "host": "127.0.0.1",
                "port": 0
              }
            }
            """.formatted(server.url("/v1"), server.url("/api")), StandardCharsets.UTF_8);
        JerryConfig config = new ConfigService().load(configPath, Map.of());

        try (JerryRuntime runtime = new JerryRuntime(config)) {
            runtime.startServices();
            assertThat(runtime.slackPort()).isPositive();

            byte[] body = """
                {"type":"event_callback","event_id":"EvRuntime",
                 "event":{"type":"app_mention","channel":"C9","user":"U1","text":"<@U0BOT> ping","ts":"1.1"}}"""
                .getBytes(StandardCharsets.UTF_8);
            String timestamp = String.valueOf(Clock.systemUTC().instant().getEpochSecond());
            SlackSignatureVerifier signer = new SlackSignatureVerifier("signing-secret", Clock.systemUTC());
            HttpResponse<String> ack = HttpClient.newHttpClient().send(
                HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + runtime.slackPort() + "/slack/events"))
                    .header("Content-Type", "application/json")
                    .header("X-Slack-Request-Timestamp", timestamp)
                    .header("X-Slack-Signature", signer.sign(timestamp, body))
                    .POST(HttpRequest.BodyPublishers.ofByteArray(body))
                    .build(),
                HttpResponse.BodyHandlers.ofString()
            );
            assertThat(ack.statusCode()).isEqualTo(200);

            RecordedRequest modelCall = server.takeRequest(10, TimeUnit.SECONDS);
            RecordedRequest slackCall = server.takeRequest(10, TimeUnit.SECONDS);

            assertThat(modelCall).isNotNull();
            assertThat(modelCall.getPath()).isEqualTo("/v1/chat/completions");
            assertThat(modelCall.getBody().readUtf8()).contains("ping");
            assertThat(slackCall).isNotNull();
            assertThat(slackCall.getPath()).isEqualTo("/api/chat.postMessage");
            assertThat(slackCall.getHeader("Authorization")).isEqualTo("Bearer xoxb-test");
            assertThat(slackCall.getBody().readUtf8()).contains("runtime-ok").contains("C9");
        }
    }
}
