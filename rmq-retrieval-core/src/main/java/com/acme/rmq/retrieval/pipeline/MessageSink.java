package com.acme.rmq.retrieval.pipeline;

import com.acme.rmq.retrieval.model.DeliveredMessage;
import java.io.IOException;

/** Destination of retrieved messages (console, files, ...). Called from a single thread. */
public interface MessageSink extends AutoCloseable {

  /**
   * Writes one message. Any exception aborts the run.
   */
  void write(DeliveredMessage message) throws IOException;

  @Override
  default void close() throws IOException {}
}
