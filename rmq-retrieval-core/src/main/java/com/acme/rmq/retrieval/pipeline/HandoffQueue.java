package com.acme.rmq.retrieval.pipeline;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Unbounded FIFO handoff between two pipeline stages that can be closed for writing.
 *
 * <p>{@link #offer} never blocks. After {@link #close()} further offers are refused, while the
 * reader keeps receiving the elements already queued; {@link #take()} returns {@code null} once
 * the queue is both closed and drained.
 *
 * @param <T> element type
 */
public final class HandoffQueue<T> {
  private final Deque<T> elements = new ArrayDeque<>();
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition notEmpty = lock.newCondition();
  private boolean closed;

  /**
   * Appends an element.
   *
   * @return {@code false} if the queue is already closed and the element was not added
   */
  public boolean offer(T element) {
    if (element == null) {
      throw new NullPointerException("element");
    }
    lock.lock();
    try {
      if (closed) {
        return false;
      }
      elements.addLast(element);
      notEmpty.signal();
      return true;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Waits for the next element.
   *
   * @return the next element, or {@code null} at end of stream
   */
  public T take() throws InterruptedException {
    lock.lockInterruptibly();
    try {
      while (elements.isEmpty() && !closed) {
        notEmpty.await();
      }
      return elements.pollFirst();
    } finally {
      lock.unlock();
    }
  }

  /** Closes the queue for writing. Idempotent. */
  public void close() {
    lock.lock();
    try {
      closed = true;
      notEmpty.signalAll();
    } finally {
      lock.unlock();
    }
  }

  public boolean isClosed() {
    lock.lock();
    try {
      return closed;
    } finally {
      lock.unlock();
    }
  }

  public int size() {
    lock.lock();
    try {
      return elements.size();
    } finally {
      lock.unlock();
    }
  }
}
