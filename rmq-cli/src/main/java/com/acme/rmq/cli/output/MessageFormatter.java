package com.acme.rmq.cli.output;

import com.acme.rmq.retrieval.model.DeliveredMessage;

/** Renders a single message as text. */
public interface MessageFormatter {

    String format(DeliveredMessage message);

    static MessageFormatter forFormat(OutputFormat format) {
        return switch (format) {
            case PLAIN -> new PlainMessageFormatter();
            case JSON -> new JsonMessageFormatter();
        };
    }
}
