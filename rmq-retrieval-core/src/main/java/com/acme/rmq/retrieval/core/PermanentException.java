package com.acme.rmq.retrieval.core;

/** A failure that ends the retrieval run; retrying with the same input cannot succeed. */
public class PermanentException extends RuntimeException {
  public PermanentException(String message) {
    super(message);
  }

  public PermanentException(String message, Throwable e) {
    super(message, e);
  }
}
