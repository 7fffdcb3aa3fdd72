/*
 * Where: Alarm pipeline realtime hub
 * What: One live subscriber with its bounded outbound queue and backpressure counter
 * Why: A slow client only ever fills its own queue; the oldest frame is dropped when full
 */
package com.example.alarm.realtime;

import com.example.alarm.model.SubscriptionScope;
import java.util.ArrayDeque;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

public final class ConnectionRecord {

  private final String connectionId;
  private final SubscriptionScope scope;
  private final RealtimeChannel channel;
  private final int capacity;
  // guarded by this
  private final ArrayDeque<String> queue;
  private final AtomicLong backpressure = new AtomicLong();
  private final AtomicBoolean draining = new AtomicBoolean(false);
  private final AtomicBoolean evicting = new AtomicBoolean(false);
  private volatile boolean closed;
  // System.nanoTime() when the in-progress send began, 0 while idle
  private volatile long sendStartedNanos;

  ConnectionRecord(
      String connectionId, SubscriptionScope scope, RealtimeChannel channel, int capacity) {
    this.connectionId = connectionId;
    this.scope = scope;
    this.channel = channel;
    this.capacity = capacity;
    this.queue = new ArrayDeque<>(capacity);
  }

  public String connectionId() {
    return connectionId;
  }

  public SubscriptionScope scope() {
    return scope;
  }

  RealtimeChannel channel() {
    return channel;
  }

  /**
   * Enqueues a frame, evicting the oldest queued frame when the queue is at capacity.
   *
   * @return true when a frame had to be dropped
   */
  boolean offer(String frame) {
    if (closed) {
      return false;
    }
    synchronized (this) {
      boolean dropped = false;
      if (queue.size() >= capacity) {
        queue.pollFirst();
        backpressure.incrementAndGet();
        dropped = true;
      }
      queue.addLast(frame);
      return dropped;
    }
  }

  synchronized String poll() {
    return queue.pollFirst();
  }

  synchronized boolean hasPending() {
    return !queue.isEmpty();
  }

  public synchronized int queueSize() {
    return queue.size();
  }

  public long backpressureCount() {
    return backpressure.get();
  }

  boolean tryStartDrain() {
    return draining.compareAndSet(false, true);
  }

  void finishDrain() {
    draining.set(false);
  }

  void beginSend(long nowNanos) {
    sendStartedNanos = nowNanos == 0 ? 1 : nowNanos;
  }

  void endSend() {
    sendStartedNanos = 0;
  }

  /** True while a send has been in progress for longer than the timeout. */
  boolean isSendOverdue(long nowNanos, long timeoutNanos) {
    final long startedAt = sendStartedNanos;
    return startedAt != 0 && nowNanos - startedAt > timeoutNanos;
  }

  /** Claims the eviction of this connection. Returns false if it was already claimed. */
  boolean markEvicting() {
    return !closed && evicting.compareAndSet(false, true);
  }

  boolean isClosed() {
    return closed;
  }

  /** Marks the record closed and discards queued frames. Returns false if already closed. */
  boolean markClosed() {
    synchronized (this) {
      if (closed) {
        return false;
      }
      closed = true;
      queue.clear();
      return true;
    }
  }
}
