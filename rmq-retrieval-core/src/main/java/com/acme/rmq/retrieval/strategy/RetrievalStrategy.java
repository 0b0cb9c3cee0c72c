package com.acme.rmq.retrieval.strategy;

import com.acme.rmq.retrieval.core.RetrievalConfigurationException;
import com.acme.rmq.retrieval.model.AckOutcome;
import com.acme.rmq.retrieval.model.QueueSnapshot;
import com.acme.rmq.retrieval.model.RetrievalOptions;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Retrieval policy. {@link #CONSUME} removes messages according to the configured ack mode;
 * {@link #PEEK} always puts every message back on the queue.
 */
public enum RetrievalStrategy {
  CONSUME("consume"),
  PEEK("peek");

  public static final int DEFAULT_PREFETCH = 100;
  /** AMQP encodes the prefetch count as an unsigned short. */
  public static final int MAX_PREFETCH = 65_535;

  static final String UNBOUNDED_REQUEUE_WARNING =
      "Using requeue mode without a message count may lead to memory issues due to "
          + "unacknowledged messages accumulating (unbound buffer growth).";
  static final String EMPTY_QUEUE_WARNING =
      "Target queue is empty, no messages will be peeked. Consider using 'rmq consume' instead.";

  private static final Logger log = LoggerFactory.getLogger(RetrievalStrategy.class);

  private final String modeName;

  RetrievalStrategy(String modeName) {
    this.modeName = modeName;
  }

  public String modeName() {
    return modeName;
  }

  /** Checks the options that can be rejected without talking to the broker. */
  public void validate(RetrievalOptions options) {
    if (options.queue() == null || options.queue().isBlank()) {
      throw new RetrievalConfigurationException(
          "A queue name is required", "Pass the queue to retrieve from with --queue");
    }
    Integer prefetch = options.prefetchCount();
    if (prefetch != null && (prefetch < 0 || prefetch > MAX_PREFETCH)) {
      throw new RetrievalConfigurationException(
          "Prefetch count must be between 0 and " + MAX_PREFETCH + ", got " + prefetch,
          "Use 0 for unlimited prefetch");
    }
    if (this == CONSUME
        && options.ackMode() == AckOutcome.REQUEUE
        && prefetch != null
        && prefetch != 0) {
      throw new RetrievalConfigurationException(
          "Cannot use an explicit prefetch count with ack mode requeue: requeued messages are"
              + " redelivered immediately and the same messages would loop forever",
          "Omit --prefetch-count (it is set to 0 automatically) or use 'rmq peek' instead");
    }
  }

  /**
   * Resolves the effective plan for a run.
   *
   * @param options caller supplied options
   * @param snapshot result of the passive queue check
   * @throws RetrievalConfigurationException if the options are contradictory
   */
  public RetrievalPlan resolve(RetrievalOptions options, QueueSnapshot snapshot) {
    validate(options);
    return switch (this) {
      case CONSUME -> resolveConsume(options);
      case PEEK -> resolvePeek(options, snapshot);
    };
  }

  private RetrievalPlan resolveConsume(RetrievalOptions options) {
    List<String> warnings = new ArrayList<>();
    int prefetch;
    if (options.hasExplicitPrefetch()) {
      prefetch = options.prefetchCount();
    } else if (options.ackMode() == AckOutcome.REQUEUE) {
      // bounded prefetch + requeue redelivers the same window forever
      prefetch = 0;
    } else {
      prefetch = DEFAULT_PREFETCH;
    }

    if (options.ackMode() == AckOutcome.REQUEUE && !options.isBounded()) {
      warnings.add(UNBOUNDED_REQUEUE_WARNING);
    }

    return new RetrievalPlan(
        this, prefetch, options.ackMode(), options.messageCountLimit(), warnings, false);
  }

  private RetrievalPlan resolvePeek(RetrievalOptions options, QueueSnapshot snapshot) {
    if (options.ackMode() != AckOutcome.REQUEUE) {
      log.debug("Ignoring ack mode {} for peek, messages are always requeued", options.ackMode());
    }
    if (options.hasExplicitPrefetch() && options.prefetchCount() != 0) {
      log.debug("Ignoring prefetch count {} for peek", options.prefetchCount());
    }

    List<String> warnings = new ArrayList<>();
    if (snapshot.isEmpty()) {
      warnings.add(EMPTY_QUEUE_WARNING);
      return new RetrievalPlan(this, 0, AckOutcome.REQUEUE, 0, warnings, true);
    }

    // requeued messages come straight back, so never read past the depth seen at start
    int depth = (int) Math.min(Integer.MAX_VALUE, snapshot.messageCount());
    int limit = options.messageCountLimit();
    limit = limit <= 0 ? depth : Math.min(limit, depth);
    return new RetrievalPlan(this, 0, AckOutcome.REQUEUE, limit, warnings, false);
  }
}
