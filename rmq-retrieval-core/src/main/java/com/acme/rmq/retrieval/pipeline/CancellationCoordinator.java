package com.acme.rmq.retrieval.pipeline;

import com.acme.rmq.retrieval.model.DeliveredMessage;
import com.acme.rmq.retrieval.model.StopReason;
import com.rabbitmq.client.Channel;
import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single shutdown path for a retrieval run.
 *
 * <p>Any trigger (operator cancellation, message limit, broker cancel, channel loss, output
 * failure) moves the run from {@code RUNNING} to {@code SHUTTING_DOWN}. Only the first trigger
 * performs the shutdown: it cancels the broker subscription and closes the message queue for
 * writing so the output stage drains what is queued and ends. Later triggers are no-ops.
 */
public class CancellationCoordinator {
  private static final Logger log = LoggerFactory.getLogger(CancellationCoordinator.class);

  public enum State {
    RUNNING,
    SHUTTING_DOWN,
    CLOSED
  }

  private final Channel channel;
  private final String consumerTag;
  private final HandoffQueue<DeliveredMessage> messageQueue;
  private final AtomicReference<State> state = new AtomicReference<>(State.RUNNING);
  private final AtomicBoolean unsubscribed = new AtomicBoolean();
  private volatile StopReason stopReason = StopReason.NONE;
  private volatile boolean subscribed;

  public CancellationCoordinator(
      Channel channel, String consumerTag, HandoffQueue<DeliveredMessage> messageQueue) {
    this.channel = channel;
    this.consumerTag = consumerTag;
    this.messageQueue = messageQueue;
  }

  /**
   * Starts the shutdown sequence unless it is already under way.
   *
   * @return {@code true} if this call performed the shutdown
   */
  public boolean trigger(StopReason reason) {
    if (!state.compareAndSet(State.RUNNING, State.SHUTTING_DOWN)) {
      log.debug("Ignoring stop request ({}), already {}", reason, state.get());
      return false;
    }
    stopReason = reason;
    log.debug(
        "Stopping consumer {} (reason: {})", consumerTag, reason.description());

    if (subscribed && needsUnsubscribe(reason)) {
      unsubscribe();
    }
    messageQueue.close();
    log.debug("Message queue closed for writing ({} messages left to drain)", messageQueue.size());
    state.set(State.CLOSED);
    return true;
  }

  /**
   * Called once the broker confirmed the subscription. Cancels it right away when a stop was
   * requested before the confirmation arrived.
   */
  public void subscriptionRegistered() {
    subscribed = true;
    if (state.get() != State.RUNNING && needsUnsubscribe(stopReason)) {
      unsubscribe();
    }
  }

  public boolean isShutdownRequested() {
    return state.get() != State.RUNNING;
  }

  public State state() {
    return state.get();
  }

  public StopReason stopReason() {
    return stopReason;
  }

  public String consumerTag() {
    return consumerTag;
  }

  private static boolean needsUnsubscribe(StopReason reason) {
    return reason != StopReason.BROKER_CANCELLED && reason != StopReason.CHANNEL_CLOSED;
  }

  private void unsubscribe() {
    if (!unsubscribed.compareAndSet(false, true)) {
      return;
    }
    try {
      channel.basicCancel(consumerTag);
      log.debug("Consumer {} cancelled", consumerTag);
    } catch (IOException | RuntimeException e) {
      // closing the channel at the end of the run ends the subscription anyway
      log.warn("Failed to cancel consumer {}: {}", consumerTag, e.getMessage());
    }
  }
}
