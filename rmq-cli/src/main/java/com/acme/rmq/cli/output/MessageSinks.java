package com.acme.rmq.cli.output;

import com.acme.rmq.retrieval.pipeline.MessageSink;

import java.io.PrintWriter;

public final class MessageSinks {

    private MessageSinks() {
    }

    public static MessageSink create(OutputOptions options, PrintWriter stdout) {
        if (options.writesToFile()) {
            return new FileMessageSink(options.outputFile(), options.format(), options.messagesPerFile());
        }
        return new ConsoleMessageSink(stdout, options.format());
    }
}
