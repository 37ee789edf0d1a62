package io.jerry.cli;

import io.jerry.core.config.model.JerryConfig;
import java.nio.file.Files;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "status", description = "Show resolved configuration status")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--json", description = "Print the full resolved configuration with secrets masked")
    boolean json;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            JerryConfig config = context.configService().load(context.configPath(), context.env());
            if (json) {
                System.out.println(context.configService().toMaskedJson(config));
                return 0;
            }
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Default provider: " + config.agent().provider());
            System.out.println("Default model: " + config.agent().model());
            System.out.println("Mistral configured: " + config.providers().mistral().configured());
            System.out.println("OpenAI configured: " + config.providers().openai().configured());
            System.out.println("OpenRouter configured: " + config.providers().openrouter().configured());
            System.out.println("Slack configured: " + config.slack().enabled());
            System.out.println("Coral configured: " + config.coral().enabled());
            System.out.println("Redaction enabled: " + config.privacy().redactionEnabled());
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}
