package com.acme.rmq.retrieval.pipeline;

import static com.acme.rmq.retrieval.support.TestMessages.message;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.acme.rmq.retrieval.model.DeliveredMessage;
import com.acme.rmq.retrieval.model.StopReason;
import com.rabbitmq.client.Channel;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CancellationCoordinatorTest {

  private static final String TAG = "rmq-consume-test";

  @Mock private Channel channel;

  private HandoffQueue<DeliveredMessage> messageQueue;
  private CancellationCoordinator coordinator;

  @BeforeEach
  void setUp() {
    messageQueue = new HandoffQueue<>();
    coordinator = new CancellationCoordinator(channel, TAG, messageQueue);
  }

  @Nested
  @DisplayName("Trigger")
  class TriggerTests {

    @Test
    @DisplayName("first trigger cancels the subscription and closes the queue")
    void testTrigger_firstCallShutsDown() throws Exception {
      coordinator.subscriptionRegistered();

      boolean performed = coordinator.trigger(StopReason.COUNT_REACHED);

      assertThat(performed).isTrue();
      assertThat(coordinator.state()).isEqualTo(CancellationCoordinator.State.CLOSED);
      assertThat(coordinator.stopReason()).isEqualTo(StopReason.COUNT_REACHED);
      assertThat(messageQueue.isClosed()).isTrue();
      verify(channel).basicCancel(TAG);
    }

    @Test
    @DisplayName("later triggers are no-ops and keep the first reason")
    void testTrigger_isIdempotent() throws Exception {
      coordinator.subscriptionRegistered();

      coordinator.trigger(StopReason.USER_CANCELLED);
      boolean second = coordinator.trigger(StopReason.COUNT_REACHED);

      assertThat(second).isFalse();
      assertThat(coordinator.stopReason()).isEqualTo(StopReason.USER_CANCELLED);
      verify(channel, times(1)).basicCancel(TAG);
    }

    @Test
    @DisplayName("broker cancellation does not issue basic.cancel")
    void testTrigger_brokerCancelledSkipsUnsubscribe() throws Exception {
      coordinator.subscriptionRegistered();

      coordinator.trigger(StopReason.BROKER_CANCELLED);

      verify(channel, never()).basicCancel(anyString());
      assertThat(messageQueue.isClosed()).isTrue();
    }

    @Test
    @DisplayName("channel loss does not issue basic.cancel")
    void testTrigger_channelClosedSkipsUnsubscribe() throws Exception {
      coordinator.subscriptionRegistered();

      coordinator.trigger(StopReason.CHANNEL_CLOSED);

      verify(channel, never()).basicCancel(anyString());
    }

    @Test
    @DisplayName("failure to cancel the subscription still closes the queue")
    void testTrigger_unsubscribeFailureIsTolerated() throws Exception {
      coordinator.subscriptionRegistered();
      doThrow(new IOException("channel gone")).when(channel).basicCancel(TAG);

      assertThatCode(() -> coordinator.trigger(StopReason.USER_CANCELLED))
          .doesNotThrowAnyException();

      assertThat(messageQueue.isClosed()).isTrue();
      assertThat(coordinator.state()).isEqualTo(CancellationCoordinator.State.CLOSED);
    }

    @Test
    @DisplayName("queued messages remain available after shutdown")
    void testTrigger_queuedMessagesCanBeDrained() throws Exception {
      messageQueue.offer(message(1, "one"));
      messageQueue.offer(message(2, "two"));

      coordinator.trigger(StopReason.USER_CANCELLED);

      assertThat(messageQueue.take().deliveryTag()).isEqualTo(1);
      assertThat(messageQueue.take().deliveryTag()).isEqualTo(2);
      assertThat(messageQueue.take()).isNull();
    }

    @Test
    @DisplayName("concurrent triggers perform the shutdown exactly once")
    void testTrigger_concurrentCallersShutDownOnce() throws Exception {
      coordinator.subscriptionRegistered();
      int threads = 8;
      ExecutorService executor = Executors.newFixedThreadPool(threads);
      CountDownLatch start = new CountDownLatch(1);
      List<Future<Boolean>> results = new ArrayList<>();
      try {
        for (int i = 0; i < threads; i++) {
          StopReason reason = i % 2 == 0 ? StopReason.USER_CANCELLED : StopReason.COUNT_REACHED;
          results.add(executor.submit(() -> {
            start.await();
            return coordinator.trigger(reason);
          }));
        }
        start.countDown();

        int performed = 0;
        for (Future<Boolean> result : results) {
          if (result.get(5, TimeUnit.SECONDS)) {
            performed++;
          }
        }

        assertThat(performed).isEqualTo(1);
        verify(channel, times(1)).basicCancel(TAG);
      } finally {
        executor.shutdownNow();
      }
    }
  }

  @Nested
  @DisplayName("Subscription registration")
  class RegistrationTests {

    @Test
    @DisplayName("stop before registration cancels once the subscription is registered")
    void testSubscriptionRegistered_afterEarlyStop() throws Exception {
      coordinator.trigger(StopReason.USER_CANCELLED);
      verify(channel, never()).basicCancel(anyString());

      coordinator.subscriptionRegistered();

      verify(channel).basicCancel(TAG);
    }

    @Test
    @DisplayName("registration while running does not cancel")
    void testSubscriptionRegistered_whileRunning() throws Exception {
      coordinator.subscriptionRegistered();

      verify(channel, never()).basicCancel(anyString());
      assertThat(coordinator.isShutdownRequested()).isFalse();
      assertThat(coordinator.stopReason()).isEqualTo(StopReason.NONE);
    }
  }
}
