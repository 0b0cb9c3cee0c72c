package com.acme.rmq.retrieval.model;

/**
 * Caller supplied settings for one retrieval run.
 *
 * @param queue queue to retrieve from
 * @param ackMode outcome for processed messages; only honoured by destructive retrieval
 * @param messageCountLimit number of messages to retrieve, {@code <= 0} means unbounded
 * @param prefetchCount QoS prefetch requested by the user, {@code null} when not set explicitly;
 *     {@code 0} means unlimited
 */
public record RetrievalOptions(
    String queue, AckOutcome ackMode, int messageCountLimit, Integer prefetchCount) {

  public RetrievalOptions {
    ackMode = ackMode == null ? AckOutcome.ACCEPT : ackMode;
  }

  public static RetrievalOptions consume(String queue, AckOutcome ackMode, int messageCountLimit) {
    return new RetrievalOptions(queue, ackMode, messageCountLimit, null);
  }

  public static RetrievalOptions peek(String queue, int messageCountLimit) {
    return new RetrievalOptions(queue, AckOutcome.REQUEUE, messageCountLimit, null);
  }

  public RetrievalOptions withPrefetchCount(Integer prefetch) {
    return new RetrievalOptions(queue, ackMode, messageCountLimit, prefetch);
  }

  public boolean isBounded() {
    return messageCountLimit > 0;
  }

  public boolean hasExplicitPrefetch() {
    return prefetchCount != null;
  }
}
