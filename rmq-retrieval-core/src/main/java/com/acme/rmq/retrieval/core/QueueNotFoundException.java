package com.acme.rmq.retrieval.core;

/** The passive queue check reported that the queue does not exist. */
public class QueueNotFoundException extends PermanentException {
  private final String queue;
  private final ErrorInfo errorInfo;

  public QueueNotFoundException(String queue, Throwable cause) {
    super("Queue '" + queue + "' not found", cause);
    this.queue = queue;
    this.errorInfo = ErrorInfo.queueNotFound(queue);
  }

  public String getQueue() {
    return queue;
  }

  public ErrorInfo getErrorInfo() {
    return errorInfo;
  }
}
