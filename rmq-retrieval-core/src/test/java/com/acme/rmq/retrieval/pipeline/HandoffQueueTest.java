package com.acme.rmq.retrieval.pipeline;

import static org.assertj.core.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class HandoffQueueTest {

  @Test
  void testTake_returnsElementsInOfferOrder() throws Exception {
    HandoffQueue<String> queue = new HandoffQueue<>();
    queue.offer("a");
    queue.offer("b");
    queue.offer("c");

    assertThat(queue.take()).isEqualTo("a");
    assertThat(queue.take()).isEqualTo("b");
    assertThat(queue.take()).isEqualTo("c");
    assertThat(queue.size()).isZero();
  }

  @Test
  void testClose_remainingElementsAreStillDrained() throws Exception {
    HandoffQueue<Integer> queue = new HandoffQueue<>();
    queue.offer(1);
    queue.offer(2);
    queue.close();

    List<Integer> drained = new ArrayList<>();
    Integer next;
    while ((next = queue.take()) != null) {
      drained.add(next);
    }

    assertThat(drained).containsExactly(1, 2);
    assertThat(queue.isClosed()).isTrue();
  }

  @Test
  void testOffer_afterCloseIsRefused() {
    HandoffQueue<String> queue = new HandoffQueue<>();
    queue.close();

    assertThat(queue.offer("late")).isFalse();
    assertThat(queue.size()).isZero();
  }

  @Test
  void testOffer_nullIsRejected() {
    HandoffQueue<String> queue = new HandoffQueue<>();

    assertThatThrownBy(() -> queue.offer(null)).isInstanceOf(NullPointerException.class);
  }

  @Test
  void testTake_blockedReaderIsReleasedByClose() throws Exception {
    HandoffQueue<String> queue = new HandoffQueue<>();
    CompletableFuture<String> reader = CompletableFuture.supplyAsync(() -> {
      try {
        return queue.take();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new IllegalStateException(e);
      }
    });

    Thread.sleep(50);
    assertThat(reader).isNotDone();

    queue.close();

    assertThat(reader.get(2, TimeUnit.SECONDS)).isNull();
  }

  @Test
  void testTake_blockedReaderReceivesLaterOffer() throws Exception {
    HandoffQueue<String> queue = new HandoffQueue<>();
    CompletableFuture<String> reader = CompletableFuture.supplyAsync(() -> {
      try {
        return queue.take();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new IllegalStateException(e);
      }
    });

    queue.offer("hello");

    assertThat(reader.get(2, TimeUnit.SECONDS)).isEqualTo("hello");
  }

  @Test
  void testClose_isIdempotent() {
    HandoffQueue<String> queue = new HandoffQueue<>();
    queue.close();
    queue.close();

    assertThat(queue.isClosed()).isTrue();
  }
}
