package com.acme.rmq.retrieval.pipeline;

import com.acme.rmq.retrieval.broker.MessagePropertyExtractor;
import com.acme.rmq.retrieval.model.DeliveredMessage;
import com.acme.rmq.retrieval.model.StopReason;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownSignalException;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Broker consumer feeding the message queue. Runs on the client's consumer dispatch thread and
 * never blocks it.
 *
 * <p>Deliveries arriving after shutdown was requested are dropped without acknowledgment; the
 * broker redelivers them once the channel closes.
 */
public class DeliveryBridge extends DefaultConsumer {
  private static final Logger log = LoggerFactory.getLogger(DeliveryBridge.class);

  private final String queue;
  private final HandoffQueue<DeliveredMessage> messageQueue;
  private final ReceivedMessageCounter counter;
  private final CancellationCoordinator coordinator;
  private final int messageLimit;
  private final AtomicLong dropped = new AtomicLong();

  public DeliveryBridge(
      Channel channel,
      String queue,
      HandoffQueue<DeliveredMessage> messageQueue,
      ReceivedMessageCounter counter,
      CancellationCoordinator coordinator,
      int messageLimit) {
    super(channel);
    this.queue = queue;
    this.messageQueue = messageQueue;
    this.counter = counter;
    this.coordinator = coordinator;
    this.messageLimit = messageLimit;
  }

  @Override
  public void handleDelivery(
      String consumerTag, Envelope envelope, AMQP.BasicProperties properties, byte[] body) {
    long deliveryTag = envelope.getDeliveryTag();
    if (coordinator.isShutdownRequested()) {
      dropped.incrementAndGet();
      log.trace("Skipping message #{} after stop request", deliveryTag);
      return;
    }

    DeliveredMessage message =
        new DeliveredMessage(
            envelope.getExchange(),
            envelope.getRoutingKey(),
            queue,
            deliveryTag,
            envelope.isRedeliver(),
            MessagePropertyExtractor.extract(properties),
            body);

    if (!messageQueue.offer(message)) {
      // lost the race against a concurrent stop
      dropped.incrementAndGet();
      log.trace("Skipping message #{}, message queue already closed", deliveryTag);
      return;
    }
    log.trace("Received message #{}", deliveryTag);

    if (counter.incrementAndCheckLimit(messageLimit)) {
      log.debug("Message limit {} reached", messageLimit);
      coordinator.trigger(StopReason.COUNT_REACHED);
    }
  }

  @Override
  public void handleCancelOk(String consumerTag) {
    log.debug("Broker confirmed cancellation of consumer {}", consumerTag);
  }

  @Override
  public void handleCancel(String consumerTag) {
    log.warn("Consumer {} was cancelled by the broker", consumerTag);
    coordinator.trigger(StopReason.BROKER_CANCELLED);
  }

  @Override
  public void handleShutdownSignal(String consumerTag, ShutdownSignalException sig) {
    if (!sig.isInitiatedByApplication()) {
      log.warn("Channel shut down during retrieval: {}", sig.getMessage());
    }
    coordinator.trigger(StopReason.CHANNEL_CLOSED);
  }

  /** Deliveries dropped because they arrived after the stop request. */
  public long droppedCount() {
    return dropped.get();
  }
}
