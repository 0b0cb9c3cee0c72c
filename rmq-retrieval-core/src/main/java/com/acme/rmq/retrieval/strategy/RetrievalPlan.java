package com.acme.rmq.retrieval.strategy;

import com.acme.rmq.retrieval.model.AckDecision;
import com.acme.rmq.retrieval.model.AckOutcome;
import com.acme.rmq.retrieval.model.DeliveredMessage;
import java.util.List;

/**
 * Effective settings of a retrieval run, resolved once from the caller's options.
 *
 * @param strategy consume or peek
 * @param prefetchCount QoS prefetch to configure on the channel, {@code 0} is unlimited
 * @param ackOutcome outcome applied to every processed message
 * @param messageLimit number of deliveries to accept, {@code <= 0} is unbounded
 * @param warnings non-fatal conditions to surface to the operator
 * @param nothingToRetrieve true when the run should end without subscribing
 */
public record RetrievalPlan(
    RetrievalStrategy strategy,
    int prefetchCount,
    AckOutcome ackOutcome,
    int messageLimit,
    List<String> warnings,
    boolean nothingToRetrieve) {

  public RetrievalPlan {
    warnings = List.copyOf(warnings);
  }

  public AckDecision decide(DeliveredMessage message) {
    return new AckDecision(message.deliveryTag(), ackOutcome);
  }

  public boolean isBounded() {
    return messageLimit > 0;
  }
}
