package com.acme.rmq.retrieval.pipeline;

/** Counts of acknowledgment calls issued by the {@link AckDispatcher}. */
public record AckSummary(long dispatched, long failed) {}
