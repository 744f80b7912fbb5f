package com.acme.retry.cli;

import com.acme.retry.cli.commands.BackoffCommands;
import com.acme.retry.cli.commands.MessageCommands;
import com.acme.retry.cli.commands.TopologyCommands;
import picocli.CommandLine;
import picocli.CommandLine.Command;

@Command(
        name = "retry-cli",
        description = "Delayed retry for RabbitMQ consumers - topology, test messages and demo consumer",
        mixinStandardHelpOptions = true,
        version = "1.0.0",
        subcommands = {
                TopologyCommands.class,
                MessageCommands.class,
                BackoffCommands.class
        }
)
public class CliApplication implements Runnable {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new CliApplication()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public void run() {
        // When run without subcommand, show help
        CommandLine.usage(this, System.out);
    }
}
