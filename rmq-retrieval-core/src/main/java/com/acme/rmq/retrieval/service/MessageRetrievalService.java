package com.acme.rmq.retrieval.service;

import com.acme.rmq.retrieval.broker.ChannelProvider;
import com.acme.rmq.retrieval.broker.QueueValidator;
import com.acme.rmq.retrieval.core.MessageSinkException;
import com.acme.rmq.retrieval.core.TransientException;
import com.acme.rmq.retrieval.model.AckDecision;
import com.acme.rmq.retrieval.model.DeliveredMessage;
import com.acme.rmq.retrieval.model.OutputResult;
import com.acme.rmq.retrieval.model.QueueSnapshot;
import com.acme.rmq.retrieval.model.RetrievalOptions;
import com.acme.rmq.retrieval.model.RetrievalResult;
import com.acme.rmq.retrieval.model.StopReason;
import com.acme.rmq.retrieval.pipeline.AckDispatcher;
import com.acme.rmq.retrieval.pipeline.AckSummary;
import com.acme.rmq.retrieval.pipeline.CancellationCoordinator;
import com.acme.rmq.retrieval.pipeline.CancellationSignal;
import com.acme.rmq.retrieval.pipeline.DeliveryBridge;
import com.acme.rmq.retrieval.pipeline.HandoffQueue;
import com.acme.rmq.retrieval.pipeline.MessageSink;
import com.acme.rmq.retrieval.pipeline.NamedDaemonThreadFactory;
import com.acme.rmq.retrieval.pipeline.OutputStage;
import com.acme.rmq.retrieval.pipeline.ReceivedMessageCounter;
import com.acme.rmq.retrieval.strategy.RetrievalPlan;
import com.acme.rmq.retrieval.strategy.RetrievalStrategy;
import com.rabbitmq.client.Channel;
import java.io.IOException;
import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one retrieval from a queue: validates the queue, subscribes with the resolved prefetch and
 * pushes every delivery through the output stage and the ack dispatcher until the message limit
 * is reached or the caller cancels.
 *
 * <p>Threads: deliveries arrive on the broker client's dispatch thread, the output stage and the
 * ack dispatcher each run on their own thread, and {@link #run} waits for both before closing the
 * channel.
 */
public class MessageRetrievalService {
  private static final Logger log = LoggerFactory.getLogger(MessageRetrievalService.class);

  private final ChannelProvider channelProvider;
  private final QueueValidator queueValidator;
  private final RetrievalStrategy strategy;
  private final MessageSink sink;
  private final StatusReporter statusReporter;

  public MessageRetrievalService(
      ChannelProvider channelProvider,
      QueueValidator queueValidator,
      RetrievalStrategy strategy,
      MessageSink sink,
      StatusReporter statusReporter) {
    this.channelProvider = channelProvider;
    this.queueValidator = queueValidator;
    this.strategy = strategy;
    this.sink = sink;
    this.statusReporter = statusReporter != null ? statusReporter : StatusReporter.NOOP;
  }

  /**
   * Retrieves messages until the message limit is reached, the signal fires or the broker ends
   * the subscription.
   *
   * @return counts of received and processed messages and why retrieval stopped
   * @throws com.acme.rmq.retrieval.core.RetrievalConfigurationException for invalid options,
   *     before the broker is contacted
   * @throws com.acme.rmq.retrieval.core.QueueNotFoundException if the queue does not exist
   * @throws MessageSinkException if the sink failed; unacknowledged messages are redelivered
   * @throws TransientException for broker I/O failures before the subscription was active
   */
  public RetrievalResult run(RetrievalOptions options, CancellationSignal cancellationSignal) {
    strategy.validate(options);
    long startNanos = System.nanoTime();
    log.debug(
        "Starting message retrieval: mode={}, queue={}, count={}",
        strategy.modeName(),
        options.queue(),
        options.messageCountLimit());

    Channel channel = openChannel();
    try {
      QueueSnapshot snapshot = queueValidator.validate(channel, options.queue());
      RetrievalPlan plan = strategy.resolve(options, snapshot);
      for (String warning : plan.warnings()) {
        log.debug("Warning: {}", warning);
        statusReporter.warning(warning);
      }

      if (plan.nothingToRetrieve()) {
        RetrievalResult result =
            buildResult(
                options, plan, 0, 0, OutputResult.EMPTY, new AckSummary(0, 0), startNanos,
                StopReason.QUEUE_EMPTY);
        statusReporter.retrievalFinished(result);
        return result;
      }

      RetrievalResult result = retrieve(channel, options, plan, cancellationSignal, startNanos);
      statusReporter.retrievalFinished(result);
      return result;
    } finally {
      closeQuietly(channel);
    }
  }

  private RetrievalResult retrieve(
      Channel channel,
      RetrievalOptions options,
      RetrievalPlan plan,
      CancellationSignal cancellationSignal,
      long startNanos) {
    configureQos(channel, plan.prefetchCount());
    statusReporter.retrievalStarting(options.queue(), strategy, plan.messageLimit());

    HandoffQueue<DeliveredMessage> messageQueue = new HandoffQueue<>();
    HandoffQueue<AckDecision> ackQueue = new HandoffQueue<>();
    ReceivedMessageCounter counter = new ReceivedMessageCounter();
    String consumerTag = "rmq-" + strategy.modeName() + "-" + UUID.randomUUID();

    CancellationCoordinator coordinator =
        new CancellationCoordinator(channel, consumerTag, messageQueue);
    DeliveryBridge bridge =
        new DeliveryBridge(
            channel, options.queue(), messageQueue, counter, coordinator, plan.messageLimit());
    OutputStage outputStage = new OutputStage(messageQueue, ackQueue, sink, plan, coordinator);
    AckDispatcher ackDispatcher = new AckDispatcher(channel, ackQueue);

    ExecutorService executor =
        Executors.newFixedThreadPool(2, new NamedDaemonThreadFactory("rmq-retrieval-"));
    try {
      Future<OutputResult> outputTask = executor.submit(outputStage);
      Future<AckSummary> ackTask = executor.submit(ackDispatcher);

      try {
        channel.basicConsume(options.queue(), false, consumerTag, bridge);
      } catch (IOException | RuntimeException e) {
        messageQueue.close();
        awaitQuietly(ackTask, coordinator);
        throw new TransientException(
            "Failed to subscribe to queue '" + options.queue() + "'", e);
      }
      coordinator.subscriptionRegistered();
      log.debug("Consumer {} registered on queue '{}'", consumerTag, options.queue());

      cancellationSignal.onCancel(() -> coordinator.trigger(StopReason.USER_CANCELLED));

      MessageSinkException sinkFailure = null;
      OutputResult outputResult;
      try {
        outputResult = await(outputTask, coordinator);
      } catch (MessageSinkException e) {
        sinkFailure = e;
        outputResult = outputStage.currentResult();
      }
      AckSummary ackSummary = await(ackTask, coordinator);

      log.debug(
          "Message retrieval stopped (mode={}, reason={}, dropped after stop={})",
          strategy.modeName(),
          coordinator.stopReason(),
          bridge.droppedCount());

      if (sinkFailure != null) {
        log.error(
            "Output failed after {} of {} received messages; unacknowledged messages will be"
                + " redelivered by the broker",
            outputResult.processedCount(),
            counter.value());
        throw sinkFailure;
      }

      return buildResult(
          options,
          plan,
          counter.value(),
          bridge.droppedCount(),
          outputResult,
          ackSummary,
          startNanos,
          coordinator.stopReason());
    } finally {
      executor.shutdownNow();
    }
  }

  /**
   * Waits for a pipeline task. Interrupting the waiting thread is treated like an operator
   * cancellation: the pipeline is stopped and still drained.
   */
  private static <T> T await(Future<T> task, CancellationCoordinator coordinator) {
    boolean interrupted = false;
    try {
      while (true) {
        try {
          return task.get();
        } catch (InterruptedException e) {
          interrupted = true;
          coordinator.trigger(StopReason.USER_CANCELLED);
        } catch (ExecutionException e) {
          Throwable cause = e.getCause();
          if (cause instanceof RuntimeException runtime) {
            throw runtime;
          }
          throw new IllegalStateException("Retrieval pipeline task failed", cause);
        }
      }
    } finally {
      if (interrupted) {
        Thread.currentThread().interrupt();
      }
    }
  }

  private static void awaitQuietly(Future<?> task, CancellationCoordinator coordinator) {
    try {
      await(task, coordinator);
    } catch (RuntimeException e) {
      log.debug("Pipeline task ended with {}", e.toString());
    }
  }

  private RetrievalResult buildResult(
      RetrievalOptions options,
      RetrievalPlan plan,
      long received,
      long dropped,
      OutputResult outputResult,
      AckSummary ackSummary,
      long startNanos,
      StopReason stopReason) {
    return new RetrievalResult(
        options.queue(),
        strategy.modeName(),
        plan.ackOutcome(),
        received,
        outputResult.processedCount(),
        dropped,
        ackSummary.dispatched(),
        ackSummary.failed(),
        outputResult.totalBytes(),
        Duration.ofNanos(System.nanoTime() - startNanos),
        stopReason);
  }

  private Channel openChannel() {
    try {
      return channelProvider.openChannel();
    } catch (IOException e) {
      throw new TransientException("Failed to open RabbitMQ channel", e);
    }
  }

  private static void configureQos(Channel channel, int prefetchCount) {
    try {
      channel.basicQos(prefetchCount);
      log.debug("Configured QoS with prefetch count: {}", prefetchCount);
    } catch (IOException e) {
      throw new TransientException("Failed to set prefetch count " + prefetchCount, e);
    }
  }

  private static void closeQuietly(Channel channel) {
    if (channel == null || !channel.isOpen()) {
      return;
    }
    try {
      channel.close();
      log.debug("RabbitMQ channel closed");
    } catch (Exception e) {
      log.warn("Error closing RabbitMQ channel: {}", e.getMessage());
    }
  }
}
