package com.acme.rmq.cli.output;

import com.acme.rmq.retrieval.model.DeliveredMessage;
import com.acme.rmq.retrieval.pipeline.MessageSink;

import java.io.IOException;
import java.io.PrintWriter;

/**
 * Writes formatted messages to standard output. Plain messages are separated by a blank line,
 * JSON messages are written one per line.
 */
public class ConsoleMessageSink implements MessageSink {
    private final PrintWriter out;
    private final MessageFormatter formatter;
    private final OutputFormat format;
    private long written;

    public ConsoleMessageSink(PrintWriter out, OutputFormat format) {
        this.out = out;
        this.format = format;
        this.formatter = MessageFormatter.forFormat(format);
    }

    @Override
    public void write(DeliveredMessage message) throws IOException {
        if (written > 0 && format == OutputFormat.PLAIN) {
            out.println();
        }
        out.println(formatter.format(message));
        out.flush();
        // PrintWriter never throws, a closed pipe only shows up here
        if (out.checkError()) {
            throw new IOException("Standard output is no longer writable");
        }
        written++;
    }
}
