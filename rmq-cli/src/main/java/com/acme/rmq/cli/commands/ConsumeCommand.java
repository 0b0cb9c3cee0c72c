package com.acme.rmq.cli.commands;

import com.acme.rmq.cli.config.CliConfiguration;
import com.acme.rmq.cli.service.RabbitConnectionService;
import com.acme.rmq.retrieval.model.AckOutcome;
import com.acme.rmq.retrieval.model.RetrievalOptions;
import com.acme.rmq.retrieval.strategy.RetrievalStrategy;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;

import java.util.function.Function;
import java.util.function.Supplier;

@Command(
        name = "consume",
        description = "Consume messages from a queue. Consumed messages are acknowledged, rejected or requeued according to the ack mode.",
        mixinStandardHelpOptions = true
)
public class ConsumeCommand extends AbstractRetrievalCommand {

    @Option(names = {"-a", "--ack-mode"}, defaultValue = "ack", converter = AckModeConverter.class,
            description = "What to do with consumed messages: ack, reject or requeue (default: ${DEFAULT-VALUE})")
    AckOutcome ackMode;

    @Option(names = {"-c", "--count"}, defaultValue = "-1",
            description = "Number of messages to consume, -1 consumes until cancelled (default: ${DEFAULT-VALUE})")
    int count;

    @Option(names = {"-p", "--prefetch-count"},
            description = "Messages the broker may push ahead of acknowledgments, 0 is unlimited (default: 100, 0 with requeue)")
    Integer prefetchCount;

    public ConsumeCommand() {
        super();
    }

    ConsumeCommand(Supplier<CliConfiguration> configuration,
                   Function<CliConfiguration, RabbitConnectionService> connections) {
        super(configuration, connections);
    }

    @Override
    protected RetrievalStrategy strategy() {
        return RetrievalStrategy.CONSUME;
    }

    @Override
    protected RetrievalOptions retrievalOptions() {
        if (count == 0 || count < -1) {
            throw new ParameterException(spec.commandLine(),
                    "--count must be a positive number, or -1 to consume until cancelled");
        }
        return new RetrievalOptions(queue, ackMode, count, prefetchCount);
    }

    static class AckModeConverter implements CommandLine.ITypeConverter<AckOutcome> {
        @Override
        public AckOutcome convert(String value) {
            try {
                return AckOutcome.fromLabel(value);
            } catch (IllegalArgumentException e) {
                throw new CommandLine.TypeConversionException(e.getMessage());
            }
        }
    }
}
