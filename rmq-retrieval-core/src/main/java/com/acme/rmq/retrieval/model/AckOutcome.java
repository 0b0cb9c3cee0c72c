package com.acme.rmq.retrieval.model;

import java.util.Locale;

/** What happens to a message on the broker once it has been processed. */
public enum AckOutcome {
  /** Acknowledge the message, removing it from the queue. */
  ACCEPT("ack"),
  /** Reject the message without requeue; the broker discards or dead-letters it. */
  REJECT("reject"),
  /** Reject the message and put it back on the queue. */
  REQUEUE("requeue");

  private final String label;

  AckOutcome(String label) {
    this.label = label;
  }

  /** Name used on the command line and in reports. */
  public String label() {
    return label;
  }

  public static AckOutcome fromLabel(String value) {
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (AckOutcome outcome : values()) {
      if (outcome.label.equals(normalized) || outcome.name().equalsIgnoreCase(normalized)) {
        return outcome;
      }
    }
    throw new IllegalArgumentException(
        "Unknown ack mode '" + value + "', expected one of: ack, reject, requeue");
  }
}
