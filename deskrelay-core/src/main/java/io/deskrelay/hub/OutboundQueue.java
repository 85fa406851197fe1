package io.deskrelay.hub;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Bounded, closable queue between the hub and one session's outbound task.
 *
 * <p>Offers never block. Closing is one-way and happens once; it is the signal that
 * ends the outbound task, and anything still queued at that point is discarded.
 */
final class OutboundQueue {

  enum Offer { ACCEPTED, FULL, CLOSED }

  private final BlockingQueue<OutboundMessage> queue;
  private final int capacity;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  OutboundQueue(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be > 0");
    }
    this.capacity = capacity;
    this.queue = new ArrayBlockingQueue<>(capacity);
  }

  Offer offer(OutboundMessage message) {
    if (closed.get()) {
      return Offer.CLOSED;
    }
    return queue.offer(message) ? Offer.ACCEPTED : Offer.FULL;
  }

  OutboundMessage poll(long timeout, TimeUnit unit) throws InterruptedException {
    return queue.poll(timeout, unit);
  }

  /**
   * Closes the queue. Returns {@code true} only for the call that closed it.
   */
  boolean close() {
    if (closed.compareAndSet(false, true)) {
      queue.clear();
      return true;
    }
    return false;
  }

  boolean isClosed() {
    return closed.get();
  }

  int size() {
    return queue.size();
  }

  int capacity() {
    return capacity;
  }
}
