package com.acme.rmq.retrieval.model;

/** Point-in-time result of a passive queue check. */
public record QueueSnapshot(boolean exists, String queue, long messageCount, int consumerCount) {

  public static QueueSnapshot of(String queue, long messageCount, int consumerCount) {
    return new QueueSnapshot(true, queue, messageCount, consumerCount);
  }

  public boolean isEmpty() {
    return messageCount == 0;
  }
}
