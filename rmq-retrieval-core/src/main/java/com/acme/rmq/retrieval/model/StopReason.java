package com.acme.rmq.retrieval.model;

/** Why a retrieval run stopped receiving messages. */
public enum StopReason {
  NONE("Not stopped"),
  USER_CANCELLED("User cancellation (Ctrl+C)"),
  COUNT_REACHED("Message count limit reached"),
  BROKER_CANCELLED("Consumer cancelled by the broker"),
  CHANNEL_CLOSED("Channel closed by the broker"),
  OUTPUT_FAILED("Output failed"),
  QUEUE_EMPTY("Queue is empty");

  private final String description;

  StopReason(String description) {
    this.description = description;
  }

  public String description() {
    return description;
  }
}
