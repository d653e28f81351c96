package com.agri.hub;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Дескриптор подписки: ограниченная очередь событий и признак активной доставки.
 * Создаётся только {@link BroadcastHub#subscribe(EventSink)}.
 */
public final class Subscription {

  private static final AtomicLong SEQUENCE = new AtomicLong();

  private final long id = SEQUENCE.incrementAndGet();
  private final EventSink sink;
  private final BlockingQueue<HubEvent> queue;
  private final AtomicBoolean draining = new AtomicBoolean(false);
  private final AtomicLong dropped = new AtomicLong();

  Subscription(EventSink sink, int capacity) {
    this.sink = sink;
    this.queue = new ArrayBlockingQueue<>(capacity);
  }

  public long getId() {
    return id;
  }

  /** Сколько событий отброшено из-за переполнения очереди. */
  public long getDroppedCount() {
    return dropped.get();
  }

  EventSink sink() {
    return sink;
  }

  BlockingQueue<HubEvent> queue() {
    return queue;
  }

  AtomicBoolean draining() {
    return draining;
  }

  boolean offer(HubEvent event) {
    if (queue.offer(event)) {
      return true;
    }
    dropped.incrementAndGet();
    return false;
  }

  @Override
  public String toString() {
    return "Subscription#" + id;
  }
}
