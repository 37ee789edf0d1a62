package io.jerry.core.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.jerry.core.config.model.JerryConfig;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigServiceTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldLoadDefaultsWhenConfigMissing() {
        ConfigService service = new ConfigService();
        Path configPath = tempDir.resolve("config.json");

        JerryConfig config = service.load(configPath, Map.of());

        assertThat(config.agent().provider()).isEqualTo("mistral");
        assertThat(config.agent().model()).isEqualTo("mistral-large-latest");
        assertThat(config.agent().temperature()).isEqualTo(0.3);
        assertThat(config.agent().maxTokens()).isEqualTo(16000);
        assertThat(config.agent().maxIterations()).isEqualTo(8);
        assertThat(config.providers().mistral().configured()).isFalse();
        assertThat(config.slack().enabled()).isFalse();
        assertThat(config.coral().enabled()).isFalse();
    }

    @Test
    void shouldMergeFileOverDefaults() throws Exception {
        ConfigService service = new ConfigService();
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            {
              "agent": {
                "model": "mistral-small-latest"
              },
              "providers": {
                "mistral": {
                  "apiKey": "sk-test"
                }
              }
            }
            """);

        JerryConfig config = service.load(configPath, Map.of());

        assertThat(config.agent().model()).isEqualTo("mistral-small-latest");
        assertThat(config.agent().maxIterations()).isEqualTo(8);
        assertThat(config.providers().mistral().apiKey()).isEqualTo("sk-test");
        assertThat(config.providers().mistral().apiBase()).isEqualTo("https://api.mistral.ai/v1");
        assertThat(config.providers().openai().apiKey()).isEqualTo("");
    }

    @Test
    void shouldApplyEnvironmentOverridesAfterFile() throws Exception {
        ConfigService service = new ConfigService();
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, "{\"agent\": {\"model\": \"from-file\"}}");

        JerryConfig config = service.load(configPath, Map.of(
            "MODEL_NAME", "from-env",
            "MODEL_API_KEY", "sk-env",
            "MODEL_TEMPERATURE", "0.7",
            "MODEL_MAX_TOKENS", "2048",
            "CORAL_CONNECTION_URL", "ws://coral:5555/ws",
            "CORAL_AGENT_ID", "jerry-1",
            "SLACK_BOT_TOKEN", "xoxb-1",
            "SLACK_SIGNING_SECRET", "secret",
            "REDACTION_ENABLED", "true"
        ));

        assertThat(config.agent().model()).isEqualTo("from-env");
        assertThat(config.agent().temperature()).isEqualTo(0.7);
        assertThat(config.agent().maxTokens()).isEqualTo(2048);
        assertThat(config.providers().mistral().apiKey()).isEqualTo("sk-env");
        assertThat(config.coral().enabled()).isTrue();
        assertThat(config.coral().agentId()).isEqualTo("jerry-1");
        assertThat(config.slack().enabled()).isTrue();
        assertThat(config.privacy().redactionEnabled()).isTrue();
    }

    @Test
    void shouldRejectTemperatureOutsideRange() {
        ConfigService service = new ConfigService();

        assertThatThrownBy(() -> service.load(tempDir.resolve("missing.json"), Map.of("MODEL_TEMPERATURE", "2.5")))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("temperature");
    }

    @Test
    void shouldRejectNonPositiveMaxTokens() {
        ConfigService service = new ConfigService();

        assertThatThrownBy(() -> service.load(tempDir.resolve("missing.json"), Map.of("MODEL_MAX_TOKENS", "0")))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("max tokens");
    }

    @Test
    void shouldRejectUnparseableNumbersAndUnknownProvider() {
        ConfigService service = new ConfigService();

        assertThatThrownBy(() -> service.load(tempDir.resolve("missing.json"), Map.of("MODEL_MAX_TOKENS", "lots")))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("MODEL_MAX_TOKENS");
        assertThatThrownBy(() -> service.load(tempDir.resolve("missing.json"), Map.of("MODEL_PROVIDER", "acme")))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("acme");
    }

    @Test
    void shouldRejectMalformedConfigFile() throws Exception {
        ConfigService service = new ConfigService();
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, "{ not json");

        assertThatThrownBy(() -> service.load(configPath, Map.of()))
            .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void shouldMaskSecretsInJsonDump() {
        ConfigService service = new ConfigService();
        JerryConfig config = service.load(tempDir.resolve("missing.json"), Map.of(
            "MODEL_API_KEY", "sk-very-secret",
            "SLACK_BOT_TOKEN", "xoxb-secret",
            "SLACK_SIGNING_SECRET", "signing-secret"
        ));

        String masked = service.toMaskedJson(config);

        assertThat(masked).doesNotContain("sk-very-secret", "xoxb-secret", "signing-secret");
        assertThat(masked).contains("********");
    }

    @Test
    void onboardShouldCreateConfigOnceUnlessOverwriting() throws Exception {
        ConfigService service = new ConfigService();
        Path configPath = tempDir.resolve(".jerry/config.json");

        OnboardResult first = service.onboard(configPath, false);
        OnboardResult second = service.onboard(configPath, false);
        OnboardResult third = service.onboard(configPath, true);

        assertThat(first.createdConfig()).isTrue();
        assertThat(Files.exists(configPath)).isTrue();
        assertThat(second.createdConfig()).isFalse();
        assertThat(second.overwrittenConfig()).isFalse();
        assertThat(third.overwrittenConfig()).isTrue();
        assertThat(service.load(configPath, Map.of()).agent().model()).isEqualTo("mistral-large-latest");
    }

    @Test
    void shouldResolveConfigPathFromEnvironment() {
        assertThat(ConfigPaths.defaultConfigPath(Map.of(ConfigPaths.CONFIG_ENV, "/etc/jerry/config.json")))
            .isEqualTo(Path.of("/etc/jerry/config.json"));
        assertThat(ConfigPaths.defaultConfigPath(Map.of()).toString()).endsWith("config.json");
    }
}
