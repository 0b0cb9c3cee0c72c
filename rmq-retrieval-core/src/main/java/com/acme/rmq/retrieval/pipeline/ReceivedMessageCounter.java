package com.acme.rmq.retrieval.pipeline;

import java.util.concurrent.atomic.AtomicLong;

/** Number of deliveries accepted into the pipeline. */
public final class ReceivedMessageCounter {
  private final AtomicLong count = new AtomicLong();

  /**
   * Counts one accepted delivery.
   *
   * @param limit target count, {@code <= 0} for none
   * @return {@code true} for exactly the delivery that makes the count equal to the limit
   */
  public boolean incrementAndCheckLimit(int limit) {
    long value = count.incrementAndGet();
    // equality, not >=: only one delivery can observe the limit
    return limit > 0 && value == limit;
  }

  public long value() {
    return count.get();
  }
}
