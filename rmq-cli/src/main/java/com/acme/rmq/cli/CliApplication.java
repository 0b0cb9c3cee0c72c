package com.acme.rmq.cli;

import com.acme.rmq.cli.commands.ConsumeCommand;
import com.acme.rmq.cli.commands.PeekCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;

@Command(
        name = "rmq",
        description = "RabbitMQ message retrieval - consume or peek at queued messages",
        mixinStandardHelpOptions = true,
        version = "1.0.0",
        subcommands = {
                ConsumeCommand.class,
                PeekCommand.class
        }
)
public class CliApplication implements Runnable {

    public static void main(String[] args) {
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }

    public static CommandLine createCommandLine() {
        return new CommandLine(new CliApplication())
                .setCaseInsensitiveEnumValuesAllowed(true);
    }

    @Override
    public void run() {
        // When run without subcommand, show help
        CommandLine.usage(this, System.out);
    }
}
