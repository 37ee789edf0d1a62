package io.jerry.app;

import io.jerry.cli.AgentCommand;
import io.jerry.cli.CliContext;
import io.jerry.cli.JerryCliCommand;
import io.jerry.cli.OnboardCommand;
import io.jerry.cli.ServeCommand;
import io.jerry.cli.StatusCommand;
import io.jerry.core.config.ConfigPaths;
import io.jerry.core.config.ConfigService;
import io.jerry.core.config.model.JerryConfig;
import io.jerry.core.runtime.JerryRuntime;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

public final class JerryApplication {
    private static final Logger LOG = LoggerFactory.getLogger(JerryApplication.class);

    private JerryApplication() {
    }

    public static void main(String[] args) {
        Map<String, String> env = System.getenv();
        ConfigService configService = new ConfigService();
        Path configPath = ConfigPaths.defaultConfigPath(env);

        CliContext context = new CliContext(
            configService,
            configPath,
            env,
            () -> serve(configService, configPath, env)
        );

        CommandLine commandLine = new CommandLine(new JerryCliCommand());
        commandLine.addSubcommand("onboard", new OnboardCommand(context));
        commandLine.addSubcommand("agent", new AgentCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));
        commandLine.addSubcommand("serve", new ServeCommand(context));

        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private static int serve(ConfigService configService, Path configPath, Map<String, String> env) throws Exception {
        JerryConfig config = configService.load(configPath, env);
        if (!config.slack().enabled() && !config.coral().enabled()) {
            System.err.println("Neither Slack nor Coral is configured; nothing to serve. Run 'jerry status' to check.");
            return 1;
        }

        CountDownLatch shutdown = new CountDownLatch(1);
        AtomicInteger exitCode = new AtomicInteger(0);
        try (JerryRuntime runtime = new JerryRuntime(config, Clock.systemUTC(), error -> {
            LOG.error("Coordination network session failed permanently, shutting down", error);
            exitCode.set(2);
            shutdown.countDown();
        })) {
            Runtime.getRuntime().addShutdownHook(new Thread(shutdown::countDown, "jerry-shutdown"));
            runtime.startServices();
            if (config.slack().enabled()) {
                System.out.println("Slack events endpoint on http://127.0.0.1:" + runtime.slackPort() + "/slack/events");
            }
            if (config.coral().enabled()) {
                System.out.println("Coral agent '" + config.coral().agentId() + "' connecting to " + config.coral().connectionUrl());
            }
            shutdown.await();
        }
        return exitCode.get();
    }
}
