package io.jerry.cli;

import io.jerry.core.config.ConfigService;
import java.nio.file.Path;
import java.util.Map;

public record CliContext(
    ConfigService configService,
    Path configPath,
    Map<String, String> env,
    ServeRunner serveRunner
) {
    public CliContext {
        env = env == null ? Map.of() : Map.copyOf(env);
    }

    public CliContext(ConfigService configService, Path configPath, Map<String, String> env) {
        this(configService, configPath, env, () -> {
            throw new UnsupportedOperationException("serve runner is not configured");
        });
    }
}
