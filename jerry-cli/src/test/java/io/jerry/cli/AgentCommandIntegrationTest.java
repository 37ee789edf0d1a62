package io.jerry.cli;

import static org.assertj.core.api.Assertions.assertThat;

import io.jerry.core.config.ConfigService;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class AgentCommandIntegrationTest {

    private MockWebServer server;

    @TempDir
    Path tempDir;

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
    void shouldExecuteAgentCommandUsingHttpProvider() throws Exception {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("""
                {
                  "choices": [
                    { "message": { "content": "integration-ok" } }
                  ]
                }
                """));

        Path configPath = writeConfig();
        CliContext context = new CliContext(new ConfigService(), configPath, Map.of());

        PrintStream originalOut = System.out;
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
            int code = new CommandLine(new AgentCommand(context)).execute("hello");
            assertThat(code).isEqualTo(0);
        } finally {
            System.setOut(originalOut);
        }

        assertThat(out.toString(StandardCharsets.UTF_8)).contains("integration-ok");
        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/v1/chat/completions");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer sk-test");
        assertThat(request.getBody().readUtf8()).contains("hello").contains("mistral-small-latest");
    }

    @Test
    void shouldPrintMaskedStatusJson() throws Exception {
        Path configPath = writeConfig();
        CliContext context = new CliContext(new ConfigService(), configPath, Map.of());

        String output = captureOut(() -> new CommandLine(new StatusCommand(context)).execute("--json"));

        assertThat(output).contains("\"provider\" : \"mistral\"").contains("********");
        assertThat(output).doesNotContain("sk-test");
    }

    @Test
    void shouldPrintStatusSummary() throws Exception {
        Path configPath = writeConfig();
        CliContext context = new CliContext(new ConfigService(), configPath, Map.of());

        String output = captureOut(() -> new CommandLine(new StatusCommand(context)).execute());

        assertThat(output)
            .contains("Config exists: true")
            .contains("Default provider: mistral")
            .contains("Mistral configured: true")
            .contains("Slack configured: false");
    }

    @Test
    void shouldCreateThenKeepConfigOnOnboard() throws Exception {
        Path configPath = tempDir.resolve("nested").resolve("config.json");
        CliContext context = new CliContext(new ConfigService(), configPath, Map.of());

        String first = captureOut(() -> new CommandLine(new OnboardCommand(context)).execute());
        String second = captureOut(() -> new CommandLine(new OnboardCommand(context)).execute());

        assertThat(first).contains("Created config: " + configPath);
        assertThat(first).contains("Still missing:").contains("MODEL_API_KEY").contains("SLACK_BOT_TOKEN");
        assertThat(second).contains("Kept existing config: " + configPath);
        assertThat(Files.exists(configPath)).isTrue();
    }

    @Test
    void shouldDelegateServeToRunner() {
        CliContext context = new CliContext(new ConfigService(), tempDir.resolve("config.json"), Map.of(), () -> 7);

        int code = new CommandLine(new ServeCommand(context)).execute();

        assertThat(code).isEqualTo(7);
    }

    @Test
    void shouldListOnlyCredentialsThatAreStillMissing() throws Exception {
        Path configPath = writeConfig();
        CliContext context = new CliContext(new ConfigService(), configPath, Map.of());

        String output = captureOut(() -> new CommandLine(new OnboardCommand(context)).execute());

        assertThat(output).contains("Kept existing config").doesNotContain("MODEL_API_KEY").contains("CORAL_CONNECTION_URL");
    }

    private Path writeConfig() throws IOException {
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            {
              "agent": {
                "provider": "mistral",
                "model": "mistral-small-latest"
              },
              "providers": {
                "mistral": {
                  "apiKey": "sk-test",
                  "apiBase": "%s"
                }
              }
            }
            """.formatted(server.url("/v1").toString()), StandardCharsets.UTF_8);
        return configPath;
    }

    private static String captureOut(Runnable action) {
        PrintStream originalOut = System.out;
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
            action.run();
        } finally {
            System.setOut(originalOut);
        }
        return out.toString(StandardCharsets.UTF_8);
    }
}
