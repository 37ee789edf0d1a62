package io.jerry.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.jerry.core.config.model.AgentDefaults;
import io.jerry.core.config.model.CoralConfig;
import io.jerry.core.config.model.JerryConfig;
import io.jerry.core.config.model.RuntimeConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

public final class ConfigService {
    private static final Set<String> SECRET_FIELDS = Set.of(
        "apiKey", "token", "botToken", "signingSecret", "clientSecret", "refreshToken"
    );

    private final ObjectMapper mapper;

    public ConfigService() {
        mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public JerryConfig load(Path configPath) {
        return load(configPath, System.getenv());
    }

    public JerryConfig load(Path configPath, Map<String, String> env) {
        Objects.requireNonNull(configPath, "configPath must not be null");
        JsonNode defaultsNode = mapper.valueToTree(JerryConfig.defaults());
        JsonNode merged = defaultsNode;
        if (Files.exists(configPath)) {
            try {
                merged = deepMerge(defaultsNode, mapper.readTree(Files.readString(configPath)));
            } catch (IOException e) {
                throw new ConfigurationException("Cannot read config file " + configPath + ": " + e.getMessage(), e);
            }
        }
        if (!(merged instanceof ObjectNode root)) {
            throw new ConfigurationException("Config file " + configPath + " must contain a JSON object");
        }
        EnvironmentOverrides.apply(root, env == null ? Map.of() : env);
        JerryConfig config;
        try {
            config = mapper.treeToValue(root, JerryConfig.class);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Invalid config: " + e.getOriginalMessage(), e);
        }
        validate(config);
        return config;
    }

    public void validate(JerryConfig config) {
        AgentDefaults agent = config.agent();
        if (agent.temperature() < 0 || agent.temperature() > 2) {
            throw new ConfigurationException("Model temperature must be between 0 and 2, got " + agent.temperature());
        }
        if (agent.maxTokens() <= 0) {
            throw new ConfigurationException("Model max tokens must be positive, got " + agent.maxTokens());
        }
        if (agent.maxIterations() < 1) {
            throw new ConfigurationException("Iteration cap must be at least 1, got " + agent.maxIterations());
        }
        if (agent.decisionAttempts() < 1) {
            throw new ConfigurationException("Decision attempts must be at least 1, got " + agent.decisionAttempts());
        }
        if (agent.contextMaxTurns() < 1 || agent.contextMaxTokens() < 1) {
            throw new ConfigurationException("Context budget must be positive");
        }
        if (config.providers().byName(agent.provider()) == null) {
            throw new ConfigurationException("Unknown model provider '" + agent.provider() + "'");
        }
        requirePositive("agent.modelTimeoutMs", agent.modelTimeoutMs());
        requirePositive("agent.toolTimeoutMs", agent.toolTimeoutMs());
        requirePositive("agent.cycleTimeoutMs", agent.cycleTimeoutMs());

        RuntimeConfig runtime = config.runtime();
        requirePositive("runtime.lockTimeoutMs", runtime.lockTimeoutMs());
        requirePositive("runtime.idleEvictionMs", runtime.idleEvictionMs());
        requirePositive("runtime.evictionIntervalMs", runtime.evictionIntervalMs());

        CoralConfig coral = config.coral();
        if (coral.enabled()) {
            String scheme = coral.connectionUrl().toLowerCase(Locale.ROOT);
            if (!(scheme.startsWith("ws://") || scheme.startsWith("wss://")
                || scheme.startsWith("http://") || scheme.startsWith("https://"))) {
                throw new ConfigurationException("CORAL_CONNECTION_URL must be a ws(s) or http(s) URL");
            }
            requirePositive("coral.heartbeatMs", coral.heartbeatMs());
            if (coral.reconnectJitter() < 0 || coral.reconnectJitter() > 1) {
                throw new ConfigurationException("coral.reconnectJitter must be within [0, 1]");
            }
        }
    }

    public void save(Path configPath, JerryConfig config) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Path parent = configPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        Files.writeString(configPath, json + System.lineSeparator());
    }

    public OnboardResult onboard(Path configPath, boolean overwrite) throws IOException {
        boolean created = !Files.exists(configPath);
        if (!created && !overwrite) {
            return new OnboardResult(configPath, false, false);
        }
        save(configPath, JerryConfig.defaults());
        return new OnboardResult(configPath, created, !created);
    }

    public String toPrettyJson(JerryConfig config) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize config", e);
        }
    }

    public String toMaskedJson(JerryConfig config) {
        JsonNode tree = mapper.valueToTree(config);
        mask(tree);
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(tree);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize config", e);
        }
    }

    private void mask(JsonNode node) {
        if (!(node instanceof ObjectNode object)) {
            return;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (SECRET_FIELDS.contains(field.getKey()) && value.isTextual() && !value.asText().isEmpty()) {
                field.setValue(TextNode.valueOf("********"));
            } else {
                mask(value);
            }
        }
    }

    private static void requirePositive(String name, long value) {
        if (value <= 0) {
            throw new ConfigurationException(name + " must be positive, got " + value);
        }
    }

    private JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (base == null) {
            return override;
        }
        if (override == null) {
            return base;
        }
        if (!base.isObject() || !override.isObject()) {
            return override;
        }

        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            JsonNode existing = merged.get(entry.getKey());
            merged.set(entry.getKey(), deepMerge(existing, entry.getValue()));
        });
        return merged;
    }
}
