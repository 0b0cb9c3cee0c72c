package com.acme.rmq.cli.output;

import com.acme.rmq.retrieval.model.DeliveredMessage;
import com.acme.rmq.retrieval.pipeline.MessageSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Writes formatted messages to a file. With rotation enabled the messages go to
 * {@code name.1.ext}, {@code name.2.ext}, ... holding at most {@code messagesPerFile} messages each;
 * otherwise everything goes to the given file, which is replaced if it exists.
 */
public class FileMessageSink implements MessageSink {
    private static final Logger logger = LoggerFactory.getLogger(FileMessageSink.class);

    private final Path outputFile;
    private final MessageFormatter formatter;
    private final OutputFormat format;
    private final int messagesPerFile;
    private final List<Path> files = new ArrayList<>();
    private BufferedWriter writer;
    private int messagesInCurrentFile;

    public FileMessageSink(Path outputFile, OutputFormat format, int messagesPerFile) {
        this.outputFile = outputFile;
        this.format = format;
        this.formatter = MessageFormatter.forFormat(format);
        this.messagesPerFile = Math.max(0, messagesPerFile);
    }

    @Override
    public void write(DeliveredMessage message) throws IOException {
        if (writer == null || (messagesPerFile > 0 && messagesInCurrentFile >= messagesPerFile)) {
            openNextFile();
        }
        if (messagesInCurrentFile > 0 && format == OutputFormat.PLAIN) {
            writer.newLine();
        }
        writer.write(formatter.format(message));
        writer.newLine();
        messagesInCurrentFile++;
        logger.trace("Message #{} written to {}", message.deliveryTag(), files.get(files.size() - 1));
    }

    private void openNextFile() throws IOException {
        closeWriter();
        Path next = messagesPerFile > 0 ? rotatedFile(files.size() + 1) : outputFile;
        Path parent = next.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        writer = Files.newBufferedWriter(next, StandardCharsets.UTF_8);
        files.add(next);
        messagesInCurrentFile = 0;
        logger.debug("Writing messages to {}", next);
    }

    Path rotatedFile(int index) {
        String name = outputFile.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        String extension = dot > 0 ? name.substring(dot) : "";
        return outputFile.resolveSibling(base + "." + index + extension);
    }

    /** Files written so far, in order. */
    public List<Path> files() {
        return Collections.unmodifiableList(files);
    }

    @Override
    public void close() throws IOException {
        closeWriter();
    }

    private void closeWriter() throws IOException {
        if (writer != null) {
            writer.close();
            writer = null;
        }
    }
}
