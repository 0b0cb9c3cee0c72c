package com.acme.rmq.retrieval.service;

import com.acme.rmq.retrieval.model.RetrievalResult;
import com.acme.rmq.retrieval.strategy.RetrievalStrategy;

/** Operator facing progress notifications of a retrieval run. */
public interface StatusReporter {

  StatusReporter NOOP = new StatusReporter() {};

  /**
   * @param messageLimit number of messages the run stops after, {@code <= 0} for unbounded
   */
  default void retrievalStarting(String queue, RetrievalStrategy strategy, int messageLimit) {}

  default void warning(String message) {}

  default void retrievalFinished(RetrievalResult result) {}
}
