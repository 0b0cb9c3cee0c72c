package com.acme.rmq.cli.output;

import com.acme.rmq.retrieval.core.ErrorInfo;
import com.acme.rmq.retrieval.model.RetrievalResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.PrintWriter;
import java.time.Clock;
import java.time.Instant;

/**
 * Prints the end-of-run summary and fatal errors to standard error, as an indented block or as a
 * JSON document depending on the output format.
 */
public class RetrievalResultPrinter {
    private final OutputOptions options;
    private final PrintWriter err;
    private final ObjectMapper mapper;
    private final Clock clock;

    public RetrievalResultPrinter(OutputOptions options, PrintWriter err) {
        this(options, err, CliJson.mapper(), Clock.systemUTC());
    }

    RetrievalResultPrinter(OutputOptions options, PrintWriter err, ObjectMapper mapper, Clock clock) {
        this.options = options;
        this.err = err;
        this.mapper = mapper;
        this.clock = clock;
    }

    public void printResult(RetrievalResult result) {
        if (options.quiet()) {
            return;
        }
        if (options.format() == OutputFormat.JSON) {
            printJson(RetrievalSummary.success(result, Instant.now(clock)));
            return;
        }
        err.println("  Queue:      " + result.queue());
        err.println("  Mode:       " + result.retrievalMode());
        err.println("  Ack Mode:   " + result.ackMode().label());
        err.println("  Received:   " + OutputUtilities.messageCountString(result.messagesReceived()));
        if (result.messagesSkipped() > 0) {
            err.println("  Processed:  " + OutputUtilities.messageCountString(result.messagesProcessed())
                    + " (" + result.messagesSkipped() + " skipped & requeued by RabbitMQ)");
        } else {
            err.println("  Processed:  " + OutputUtilities.messageCountString(result.messagesProcessed()));
        }
        err.println("  Total size: " + OutputUtilities.toSizeString(result.totalBytes()));
        err.flush();
    }

    /** Errors are printed even in quiet mode. */
    public void printError(String queue, ErrorInfo error) {
        if (options.format() == OutputFormat.JSON) {
            printJson(RetrievalSummary.failure(queue, error, Instant.now(clock)));
            return;
        }
        err.println("Error: " + error.error());
        if (error.suggestion() != null) {
            err.println("Suggestion: " + error.suggestion());
        }
        err.flush();
    }

    private void printJson(RetrievalSummary summary) {
        try {
            err.println(mapper.writeValueAsString(summary));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to format summary as JSON", e);
        }
        err.flush();
    }
}
