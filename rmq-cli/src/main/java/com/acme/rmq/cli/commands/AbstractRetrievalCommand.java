package com.acme.rmq.cli.commands;

import com.acme.rmq.cli.config.CliConfiguration;
import com.acme.rmq.cli.output.ConsoleStatusReporter;
import com.acme.rmq.cli.output.MessageSinks;
import com.acme.rmq.cli.output.OutputFormat;
import com.acme.rmq.cli.output.OutputOptions;
import com.acme.rmq.cli.output.RetrievalResultPrinter;
import com.acme.rmq.cli.service.InterruptHandler;
import com.acme.rmq.cli.service.RabbitConnectionService;
import com.acme.rmq.retrieval.broker.QueueValidator;
import com.acme.rmq.retrieval.core.ErrorInfo;
import com.acme.rmq.retrieval.core.MessageSinkException;
import com.acme.rmq.retrieval.core.QueueNotFoundException;
import com.acme.rmq.retrieval.core.RetrievalConfigurationException;
import com.acme.rmq.retrieval.core.TransientException;
import com.acme.rmq.retrieval.model.RetrievalOptions;
import com.acme.rmq.retrieval.model.RetrievalResult;
import com.acme.rmq.retrieval.pipeline.CancellationSignal;
import com.acme.rmq.retrieval.pipeline.MessageSink;
import com.acme.rmq.retrieval.service.MessageRetrievalService;
import com.acme.rmq.retrieval.strategy.RetrievalStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Options and run flow shared by the retrieval commands. Exit codes: {@code 0} when the run
 * completed or was cancelled by the user, {@code 1} when it failed, {@code 2} for invalid usage.
 */
abstract class AbstractRetrievalCommand implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(AbstractRetrievalCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    @Spec
    CommandSpec spec;

    @Option(names = {"-q", "--queue"}, required = true, description = "Queue to read messages from")
    String queue;

    @Option(names = {"-o", "--output"}, defaultValue = "plain",
            description = "Output format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    OutputFormat outputFormat;

    @Option(names = "--to-file", paramLabel = "<file>",
            description = "Write messages to a file instead of standard output. RMQ_MESSAGES_PER_FILE controls rotation.")
    Path outputFile;

    @Option(names = "--quiet", description = "Suppress status lines and the summary")
    boolean quiet;

    private final Supplier<CliConfiguration> configuration;
    private final Function<CliConfiguration, RabbitConnectionService> connections;

    AbstractRetrievalCommand() {
        this(CliConfiguration::getInstance, RabbitConnectionService::new);
    }

    AbstractRetrievalCommand(Supplier<CliConfiguration> configuration,
                             Function<CliConfiguration, RabbitConnectionService> connections) {
        this.configuration = configuration;
        this.connections = connections;
    }

    protected abstract RetrievalStrategy strategy();

    /** Maps the command line options; throws {@link ParameterException} for invalid combinations. */
    protected abstract RetrievalOptions retrievalOptions();

    @Override
    public Integer call() {
        RetrievalOptions options = retrievalOptions();
        try {
            strategy().validate(options);
        } catch (RetrievalConfigurationException e) {
            String suggestion = e.getErrorInfo().suggestion();
            throw new ParameterException(spec.commandLine(),
                    e.getMessage() + (suggestion != null ? ". " + suggestion : ""), e);
        }

        CliConfiguration config = configuration.get();
        OutputOptions outputOptions = new OutputOptions(outputFormat, outputFile, quiet, config.getMessagesPerFile());
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        RetrievalResultPrinter printer = new RetrievalResultPrinter(outputOptions, err);
        CancellationSignal signal = new CancellationSignal();

        try (RabbitConnectionService connection = connections.apply(config);
             InterruptHandler interrupts = InterruptHandler.install(
                     signal, Duration.ofSeconds(config.getShutdownGraceSeconds()));
             MessageSink sink = MessageSinks.create(outputOptions, out)) {

            MessageRetrievalService service = new MessageRetrievalService(
                    connection, new QueueValidator(), strategy(), sink,
                    new ConsoleStatusReporter(err, quiet));
            RetrievalResult result = service.run(options, signal);
            printer.printResult(result);
            return EXIT_OK;
        } catch (QueueNotFoundException e) {
            printer.printError(queue, e.getErrorInfo());
            return EXIT_FAILURE;
        } catch (MessageSinkException e) {
            printer.printError(queue, new ErrorInfo("output", "OUTPUT_FAILED", e.getMessage(),
                    "Unacknowledged messages were left on the queue; check that the output destination is writable"));
            return EXIT_FAILURE;
        } catch (TransientException e) {
            logger.debug("Broker failure", e);
            printer.printError(queue, new ErrorInfo("connection", "BROKER_ERROR", describe(e),
                    "Check that RabbitMQ is reachable and the RABBITMQ_* settings are correct"));
            return EXIT_FAILURE;
        } catch (IOException e) {
            printer.printError(queue, new ErrorInfo("output", "OUTPUT_FAILED",
                    "Failed to close output: " + e.getMessage(), null));
            return EXIT_FAILURE;
        }
    }

    private static String describe(Exception e) {
        Throwable cause = e.getCause();
        if (cause != null && cause.getMessage() != null) {
            return e.getMessage() + ": " + cause.getMessage();
        }
        return e.getMessage();
    }
}
