package com.acme.rmq.retrieval.core;

/** The output sink failed to accept a message. Fatal to the run. */
public class MessageSinkException extends PermanentException {
  private final long deliveryTag;

  public MessageSinkException(long deliveryTag, Throwable cause) {
    super("Failed to write message #" + deliveryTag + ": " + cause.getMessage(), cause);
    this.deliveryTag = deliveryTag;
  }

  public long getDeliveryTag() {
    return deliveryTag;
  }
}
