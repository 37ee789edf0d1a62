package io.jerry.cli;

import io.jerry.core.agent.CycleOutcome;
import io.jerry.core.agent.CycleResult;
import io.jerry.core.agent.InboundEvent;
import io.jerry.core.config.model.JerryConfig;
import io.jerry.core.runtime.JerryRuntime;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "agent", description = "Send a prompt to the agent and print its reply")
public final class AgentCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "Prompt to send")
    String prompt;

    @Option(names = {"-m", "--model"}, description = "Model override")
    String model;

    @Option(names = {"-p", "--provider"}, description = "Provider override")
    String provider;

    @Option(names = {"-s", "--session"}, description = "Conversation key", defaultValue = "cli:default")
    String session;

    public AgentCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            JerryConfig loaded = context.configService().load(context.configPath(), context.env());
            JerryConfig config = loaded.withAgent(loaded.agent().withModel(provider, model));

            try (JerryRuntime runtime = new JerryRuntime(config)) {
                CycleResult result = runtime.loop().handleInboundMessage(
                    InboundEvent.cli(session, prompt),
                    (event, reply) -> System.out.println(reply)
                );
                return succeeded(result.outcome()) ? 0 : 1;
            }
        } catch (Exception e) {
            System.err.println("Agent command failed: " + e.getMessage());
            return 1;
        }
    }

    private static boolean succeeded(CycleOutcome outcome) {
        return outcome == CycleOutcome.ANSWERED || outcome == CycleOutcome.ITERATION_CAP;
    }
}
