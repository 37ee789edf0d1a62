package io.jerry.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Locale;
import java.util.Map;
import java.util.function.Consumer;

final class EnvironmentOverrides {

    private EnvironmentOverrides() {
    }

    static void apply(ObjectNode root, Map<String, String> env) {
        ObjectNode agent = child(root, "agent");
        text(env, "MODEL_PROVIDER", value -> agent.put("provider", value.toLowerCase(Locale.ROOT)));
        text(env, "MODEL_NAME", value -> agent.put("model", value));
        text(env, "MODEL_TEMPERATURE", value -> agent.put("temperature", parseDouble("MODEL_TEMPERATURE", value)));
        text(env, "MODEL_MAX_TOKENS", value -> agent.put("maxTokens", parseInt("MODEL_MAX_TOKENS", value)));
        text(env, "TIMEOUT_MS", value -> agent.put("modelTimeoutMs", parseLong("TIMEOUT_MS", value)));

        String providerName = agent.path("provider").asText("mistral");
        ObjectNode provider = child(child(root, "providers"), providerName);
        text(env, "MODEL_API_KEY", value -> provider.put("apiKey", value));
        text(env, "MODEL_BASE_URL", value -> provider.put("apiBase", value));

        ObjectNode coral = child(root, "coral");
        text(env, "CORAL_CONNECTION_URL", value -> coral.put("connectionUrl", value));
        text(env, "CORAL_AGENT_ID", value -> coral.put("agentId", value));
        text(env, "CORAL_ORCHESTRATION_RUNTIME", value -> coral.put("orchestrationRuntime", value));

        ObjectNode slack = child(root, "slack");
        text(env, "SLACK_BOT_TOKEN", value -> slack.put("botToken", value));
        text(env, "SLACK_SIGNING_SECRET", value -> slack.put("signingSecret", value));
        text(env, "PORT", value -> slack.put("port", parseInt("PORT", value)));

        ObjectNode tools = child(root, "tools");
        text(env, "BRAVE_API_KEY", value -> child(tools, "search").put("apiKey", value));
        text(env, "GITHUB_TOKEN", value -> child(tools, "github").put("token", value));
        ObjectNode google = child(tools, "google");
        text(env, "GOOGLE_CLIENT_ID", value -> google.put("clientId", value));
        text(env, "GOOGLE_CLIENT_SECRET", value -> google.put("clientSecret", value));
        text(env, "GOOGLE_REFRESH_TOKEN", value -> google.put("refreshToken", value));

        ObjectNode privacy = child(root, "privacy");
        text(env, "REDACTION_ENABLED", value -> privacy.put("redactionEnabled", parseFlag(value)));
        text(env, "REDACT_USER_DEFINED_PATTERN", value -> privacy.put("customPattern", value));
    }

    private static ObjectNode child(ObjectNode parent, String field) {
        JsonNode node = parent.get(field);
        if (node instanceof ObjectNode object) {
            return object;
        }
        return parent.putObject(field);
    }

    private static void text(Map<String, String> env, String name, Consumer<String> sink) {
        String value = env.get(name);
        if (value != null && !value.isBlank()) {
            sink.accept(value.trim());
        }
    }

    private static boolean parseFlag(String value) {
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "1", "true", "yes", "on" -> true;
            default -> false;
        };
    }

    private static double parseDouble(String name, String value) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException(name + " must be a number, got '" + value + "'", e);
        }
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException(name + " must be an integer, got '" + value + "'", e);
        }
    }

    private static long parseLong(String name, String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException(name + " must be an integer, got '" + value + "'", e);
        }
    }
}
