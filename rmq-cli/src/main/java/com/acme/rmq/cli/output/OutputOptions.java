package com.acme.rmq.cli.output;

import java.nio.file.Path;

/**
 * How retrieved messages and the run summary are rendered.
 *
 * @param format message and summary format
 * @param outputFile file to write messages to, {@code null} for standard output
 * @param quiet suppress status lines and the summary
 * @param messagesPerFile rotate the output file after this many messages, {@code 0} never rotates
 */
public record OutputOptions(OutputFormat format, Path outputFile, boolean quiet, int messagesPerFile) {

    public OutputOptions {
        format = format == null ? OutputFormat.PLAIN : format;
    }

    public boolean writesToFile() {
        return outputFile != null;
    }
}
