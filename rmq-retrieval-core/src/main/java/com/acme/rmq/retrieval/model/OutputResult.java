package com.acme.rmq.retrieval.model;

/**
 * Statistics of the output stage.
 *
 * @param processedCount messages written to the sink
 * @param totalBytes sum of the body sizes of the written messages
 */
public record OutputResult(long processedCount, long totalBytes) {
  public static final OutputResult EMPTY = new OutputResult(0, 0);
}
