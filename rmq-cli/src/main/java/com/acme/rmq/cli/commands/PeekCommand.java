package com.acme.rmq.cli.commands;

import com.acme.rmq.cli.config.CliConfiguration;
import com.acme.rmq.cli.service.RabbitConnectionService;
import com.acme.rmq.retrieval.model.RetrievalOptions;
import com.acme.rmq.retrieval.strategy.RetrievalStrategy;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;

import java.util.function.Function;
import java.util.function.Supplier;

@Command(
        name = "peek",
        description = "Show messages without removing them. Every message is put back on the queue.",
        mixinStandardHelpOptions = true
)
public class PeekCommand extends AbstractRetrievalCommand {

    @Option(names = {"-c", "--count"}, defaultValue = "1",
            description = "Number of messages to peek at (default: ${DEFAULT-VALUE})")
    int count;

    public PeekCommand() {
        super();
    }

    PeekCommand(Supplier<CliConfiguration> configuration,
                Function<CliConfiguration, RabbitConnectionService> connections) {
        super(configuration, connections);
    }

    @Override
    protected RetrievalStrategy strategy() {
        return RetrievalStrategy.PEEK;
    }

    @Override
    protected RetrievalOptions retrievalOptions() {
        if (count < 1) {
            throw new ParameterException(spec.commandLine(), "--count must be at least 1");
        }
        return RetrievalOptions.peek(queue, count);
    }
}
