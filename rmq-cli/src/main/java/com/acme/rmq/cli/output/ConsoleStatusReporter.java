package com.acme.rmq.cli.output;

import com.acme.rmq.retrieval.model.RetrievalResult;
import com.acme.rmq.retrieval.model.StopReason;
import com.acme.rmq.retrieval.service.StatusReporter;
import com.acme.rmq.retrieval.strategy.RetrievalStrategy;

import java.io.PrintWriter;

/** Status lines on standard error, kept apart from the messages on standard output. */
public class ConsoleStatusReporter implements StatusReporter {
    private final PrintWriter err;
    private final boolean quiet;

    public ConsoleStatusReporter(PrintWriter err, boolean quiet) {
        this.err = err;
        this.quiet = quiet;
    }

    @Override
    public void retrievalStarting(String queue, RetrievalStrategy strategy, int messageLimit) {
        String action = strategy == RetrievalStrategy.PEEK ? "Peeking at" : "Consuming";
        String limit = messageLimit > 0
                ? "up to " + OutputUtilities.messageCountString(messageLimit)
                : "until cancelled";
        print(action + " messages from queue '" + queue + "' (" + limit + ", press Ctrl+C to stop)");
    }

    @Override
    public void warning(String message) {
        print("Warning: " + message);
    }

    @Override
    public void retrievalFinished(RetrievalResult result) {
        if (result.stopReason() == StopReason.QUEUE_EMPTY) {
            return;
        }
        if (result.cancelledByUser()) {
            print("Retrieval cancelled by user");
        } else if (result.stopReason() == StopReason.BROKER_CANCELLED
                || result.stopReason() == StopReason.CHANNEL_CLOSED) {
            print("Retrieval stopped: " + result.stopReason().description());
        }
        print("Retrieved " + OutputUtilities.messageCountString(result.messagesProcessed())
                + " in " + OutputUtilities.elapsedString(result.elapsed()));
    }

    private void print(String line) {
        if (quiet) {
            return;
        }
        err.println(line);
        err.flush();
    }
}
