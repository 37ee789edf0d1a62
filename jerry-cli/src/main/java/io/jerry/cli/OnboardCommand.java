package io.jerry.cli;

import io.jerry.core.config.OnboardResult;
import io.jerry.core.config.model.JerryConfig;
import io.jerry.core.config.model.ProviderConfig;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "onboard", description = "Write a default config file and list the credentials still missing")
public final class OnboardCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--overwrite", description = "Replace an existing config with defaults")
    boolean overwrite;

    public OnboardCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            OnboardResult result = context.configService().onboard(context.configPath(), overwrite);
            String verb = result.createdConfig() ? "Created" : result.overwrittenConfig() ? "Reset" : "Kept existing";
            System.out.println(verb + " config: " + result.configPath());

            List<String> missing = missingCredentials(context.configService().load(context.configPath(), context.env()));
            if (missing.isEmpty()) {
                System.out.println("All credentials are configured.");
            } else {
                System.out.println("Still missing:");
                missing.forEach(item -> System.out.println("  - " + item));
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Onboard failed: " + e.getMessage());
            return 1;
        }
    }

    static List<String> missingCredentials(JerryConfig config) {
        List<String> missing = new ArrayList<>();
        String provider = config.agent().provider();
        ProviderConfig providerConfig = config.providers().byName(provider);
        if (providerConfig == null || !providerConfig.configured()) {
            missing.add("model API key for " + provider + " (MODEL_API_KEY)");
        }
        if (!config.slack().enabled()) {
            missing.add("Slack bot token and signing secret (SLACK_BOT_TOKEN, SLACK_SIGNING_SECRET)");
        }
        if (!config.coral().enabled()) {
            missing.add("coordination network URL (CORAL_CONNECTION_URL)");
        }
        return missing;
    }
}
