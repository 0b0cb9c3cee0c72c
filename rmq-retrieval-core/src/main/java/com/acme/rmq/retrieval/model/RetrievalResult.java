package com.acme.rmq.retrieval.model;

import java.time.Duration;

/**
 * Outcome of a retrieval run. Always produced, including after cancellation, so partial progress
 * is visible to the caller.
 *
 * <p>{@code messagesReceived} counts deliveries accepted into the pipeline. {@code messagesDropped}
 * counts deliveries that arrived after the stop request and were left unacknowledged.
 */
public record RetrievalResult(
    String queue,
    String retrievalMode,
    AckOutcome ackMode,
    long messagesReceived,
    long messagesProcessed,
    long messagesDropped,
    long acksDispatched,
    long ackFailures,
    long totalBytes,
    Duration elapsed,
    StopReason stopReason) {

  /**
   * Deliveries that never reached the output: dropped after the stop plus accepted but unwritten
   * ones. The broker redelivers all of them.
   */
  public long messagesSkipped() {
    return messagesDropped + Math.max(0, messagesReceived - messagesProcessed);
  }

  public boolean cancelledByUser() {
    return stopReason == StopReason.USER_CANCELLED;
  }

  public double messagesPerSecond() {
    double seconds = elapsed.toNanos() / 1_000_000_000.0;
    if (seconds <= 0) {
      return 0;
    }
    return Math.round(messagesProcessed / seconds * 100.0) / 100.0;
  }
}
