package com.acme.rmq.retrieval.core;

/** Broker I/O failure that may succeed on a later run. Retrieval never retries on its own. */
public class TransientException extends RuntimeException {
  public TransientException(String message) {
    super(message);
  }

  public TransientException(String message, Throwable e) {
    super(message, e);
  }
}
