package com.acme.rmq.retrieval.model;

/** Acknowledgment to send for one delivery. */
public record AckDecision(long deliveryTag, AckOutcome outcome) {}
