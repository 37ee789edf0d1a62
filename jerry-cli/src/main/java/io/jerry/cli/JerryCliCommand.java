package io.jerry.cli;

import picocli.CommandLine.Command;

@Command(name = "jerry", mixinStandardHelpOptions = true, description = "Jerry conversational agent for Slack and Coral")
public final class JerryCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}
