package com.acme.rmq.retrieval.pipeline;

import com.acme.rmq.retrieval.core.MessageSinkException;
import com.acme.rmq.retrieval.model.AckDecision;
import com.acme.rmq.retrieval.model.DeliveredMessage;
import com.acme.rmq.retrieval.model.OutputResult;
import com.acme.rmq.retrieval.model.StopReason;
import com.acme.rmq.retrieval.strategy.RetrievalPlan;
import java.io.IOException;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drains the message queue in delivery order, writes every message to the sink and produces one
 * {@link AckDecision} per written message. Closes the ack queue when done, including on failure,
 * so the dispatcher always terminates.
 */
public class OutputStage implements Callable<OutputResult> {
  private static final Logger log = LoggerFactory.getLogger(OutputStage.class);

  private final HandoffQueue<DeliveredMessage> messageQueue;
  private final HandoffQueue<AckDecision> ackQueue;
  private final MessageSink sink;
  private final RetrievalPlan plan;
  private final CancellationCoordinator coordinator;
  private final AtomicLong processed = new AtomicLong();
  private final AtomicLong totalBytes = new AtomicLong();

  public OutputStage(
      HandoffQueue<DeliveredMessage> messageQueue,
      HandoffQueue<AckDecision> ackQueue,
      MessageSink sink,
      RetrievalPlan plan,
      CancellationCoordinator coordinator) {
    this.messageQueue = messageQueue;
    this.ackQueue = ackQueue;
    this.sink = sink;
    this.plan = plan;
    this.coordinator = coordinator;
  }

  @Override
  public OutputResult call() throws InterruptedException {
    log.debug("Starting message output");
    try {
      DeliveredMessage message;
      while ((message = messageQueue.take()) != null) {
        write(message);
        ackQueue.offer(plan.decide(message));
        processed.incrementAndGet();
        totalBytes.addAndGet(message.bodySizeBytes());
        log.trace("Message #{} written", message.deliveryTag());
      }
    } finally {
      ackQueue.close();
    }
    log.debug("Message output completed (processed: {})", processed.get());
    return currentResult();
  }

  private void write(DeliveredMessage message) {
    try {
      sink.write(message);
    } catch (IOException | RuntimeException e) {
      log.error("Failed to write message #{}", message.deliveryTag(), e);
      coordinator.trigger(StopReason.OUTPUT_FAILED);
      throw new MessageSinkException(message.deliveryTag(), e);
    }
  }

  /** Progress so far; final once {@link #call()} has returned or failed. */
  public OutputResult currentResult() {
    return new OutputResult(processed.get(), totalBytes.get());
  }
}
