package com.acme.rmq.retrieval.pipeline;

import com.acme.rmq.retrieval.model.AckDecision;
import com.rabbitmq.client.Channel;
import java.io.IOException;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sole issuer of acknowledgments on the channel. Decisions are sent one at a time in the order
 * they were produced; delivery tags are only meaningful in that order. A failed call is logged and
 * the remaining decisions are still sent.
 */
public class AckDispatcher implements Callable<AckSummary> {
  private static final Logger log = LoggerFactory.getLogger(AckDispatcher.class);

  private final Channel channel;
  private final HandoffQueue<AckDecision> ackQueue;

  public AckDispatcher(Channel channel, HandoffQueue<AckDecision> ackQueue) {
    this.channel = channel;
    this.ackQueue = ackQueue;
  }

  @Override
  public AckSummary call() throws InterruptedException {
    log.debug("Starting acknowledgment dispatcher");
    long dispatched = 0;
    long failed = 0;
    AckDecision decision;
    while ((decision = ackQueue.take()) != null) {
      try {
        dispatch(decision);
        dispatched++;
      } catch (IOException | RuntimeException e) {
        failed++;
        log.warn(
            "Failed to {} message #{}: {}",
            decision.outcome().label(),
            decision.deliveryTag(),
            e.getMessage());
      }
    }
    log.debug("Acknowledgment dispatcher finished (dispatched: {}, failed: {})", dispatched, failed);
    return new AckSummary(dispatched, failed);
  }

  private void dispatch(AckDecision decision) throws IOException {
    long tag = decision.deliveryTag();
    switch (decision.outcome()) {
      case ACCEPT -> {
        log.trace("Acknowledging message #{}", tag);
        channel.basicAck(tag, false);
      }
      case REJECT -> {
        log.trace("Rejecting message #{} without requeue", tag);
        channel.basicReject(tag, false);
      }
      case REQUEUE -> {
        log.trace("Requeuing message #{}", tag);
        channel.basicReject(tag, true);
      }
    }
  }
}
