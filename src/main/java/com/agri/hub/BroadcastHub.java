package com.agri.hub;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Рассылка событий всем активным подписчикам.
 * <p>
 * {@link #publish(String, Object)} не блокирует издателя: событие кладётся в ограниченную очередь
 * каждого подписчика, а доставка идёт в отдельном пуле. Если очередь подписчика заполнена,
 * событие для него отбрасывается. События одному подписчику доставляются в порядке публикации.
 * <p>
 * Множество подписчиков защищено независимо от хранилища, поэтому подключения и отключения
 * клиентов не задерживают запись в БД.
 */
public class BroadcastHub implements AutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger(BroadcastHub.class);

  private final Set<Subscription> subscriptions = ConcurrentHashMap.newKeySet();
  private final int queueCapacity;
  private final ExecutorService deliveryExecutor;

  public BroadcastHub(int queueCapacity) {
    this(queueCapacity, Executors.newCachedThreadPool(daemonThreads()));
  }

  public BroadcastHub(int queueCapacity, ExecutorService deliveryExecutor) {
    if (queueCapacity < 1) {
      throw new IllegalArgumentException("queueCapacity must be positive: " + queueCapacity);
    }
    this.queueCapacity = queueCapacity;
    this.deliveryExecutor = deliveryExecutor;
  }

  public Subscription subscribe(EventSink sink) {
    Subscription subscription = new Subscription(sink, queueCapacity);
    subscriptions.add(subscription);
    logger.info("Подписчик {} подключён, всего: {}", subscription, subscriptions.size());
    return subscription;
  }

  public void unsubscribe(Subscription subscription) {
    if (subscriptions.remove(subscription)) {
      subscription.queue().clear();
      logger.info("Подписчик {} отключён, всего: {}", subscription, subscriptions.size());
    }
  }

  public int subscriberCount() {
    return subscriptions.size();
  }

  /**
   * Публикует событие всем текущим подписчикам (fire-and-forget).
   */
  public void publish(String eventName, Object payload) {
    HubEvent event = new HubEvent(eventName, payload);
    for (Subscription subscription : subscriptions) {
      if (!subscription.offer(event)) {
        logger.debug("Очередь {} переполнена, событие {} отброшено", subscription, eventName);
        continue;
      }
      scheduleDrain(subscription);
    }
  }

  private void scheduleDrain(Subscription subscription) {
    if (!subscription.draining().compareAndSet(false, true)) {
      return;
    }
    try {
      deliveryExecutor.execute(() -> drain(subscription));
    } catch (RejectedExecutionException e) {
      subscription.draining().set(false);
      logger.debug("Доставка для {} отклонена: хаб остановлен", subscription);
    }
  }

  private void drain(Subscription subscription) {
    try {
      HubEvent event;
      while ((event = subscription.queue().poll()) != null) {
        EventSink sink = subscription.sink();
        if (!sink.isOpen()) {
          unsubscribe(subscription);
          return;
        }
        try {
          sink.deliver(event);
        } catch (Exception e) {
          logger.debug("Не удалось доставить {} подписчику {}: {}", event.getName(), subscription, e.toString());
        }
      }
    } finally {
      subscription.draining().set(false);
    }
    // событие могло прийти между последним poll и сбросом флага
    if (!subscription.queue().isEmpty() && subscriptions.contains(subscription)) {
      scheduleDrain(subscription);
    }
  }

  @Override
  public void close() {
    subscriptions.clear();
    deliveryExecutor.shutdown();
    try {
      if (!deliveryExecutor.awaitTermination(2, TimeUnit.SECONDS)) {
        deliveryExecutor.shutdownNow();
      }
    } catch (InterruptedException e) {
      deliveryExecutor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  private static ThreadFactory daemonThreads() {
    AtomicInteger counter = new AtomicInteger();
    return r -> {
      Thread t = new Thread(r, "hub-delivery-" + counter.incrementAndGet());
      t.setDaemon(true);
      return t;
    };
  }
}
