package io.jerry.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record JerryConfig(
    AgentDefaults agent,
    ProvidersConfig providers,
    CoralConfig coral,
    SlackConfig slack,
    ToolsConfig tools,
    RuntimeConfig runtime,
    PrivacyConfig privacy
) {

    public static JerryConfig defaults() {
        return new JerryConfig(
            AgentDefaults.defaults(),
            ProvidersConfig.defaults(),
            CoralConfig.defaults(),
            SlackConfig.defaults(),
            ToolsConfig.defaults(),
            RuntimeConfig.defaults(),
            PrivacyConfig.defaults()
        );
    }

    public JerryConfig withAgent(AgentDefaults newAgent) {
        return new JerryConfig(newAgent, providers, coral, slack, tools, runtime, privacy);
    }
}
