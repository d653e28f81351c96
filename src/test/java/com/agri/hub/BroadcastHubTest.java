package com.agri.hub;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class BroadcastHubTest {

  private BroadcastHub hub;

  @BeforeEach
  void setUp() {
    hub = new BroadcastHub(4);
  }

  @AfterEach
  void tearDown() {
    hub.close();
  }

  @Test
  @DisplayName("Каждый подписчик получает события в порядке публикации")
  void shouldDeliverInPublishOrder() {
    RecordingSink first = new RecordingSink();
    RecordingSink second = new RecordingSink();
    hub.subscribe(first);
    hub.subscribe(second);

    for (int i = 0; i < 3; i++) {
      hub.publish("sensor_data", i);
    }

    await().atMost(Duration.ofSeconds(5)).until(() -> first.events.size() == 3 && second.events.size() == 3);
    assertThat(first.payloads()).containsExactly(0, 1, 2);
    assertThat(second.payloads()).containsExactly(0, 1, 2);
  }

  @Test
  @DisplayName("Медленный подписчик не задерживает издателя и остальных")
  void shouldNotBlockOnSlowSubscriber() throws Exception {
    CountDownLatch release = new CountDownLatch(1);
    BlockingSink slow = new BlockingSink(release);
    RecordingSink fast = new RecordingSink();
    Subscription slowSubscription = hub.subscribe(slow);
    hub.subscribe(fast);

    long started = System.nanoTime();
    for (int i = 0; i < 20; i++) {
      hub.publish("sensor_data", i);
    }
    long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

    assertThat(elapsedMillis).isLessThan(1000);
    await().atMost(Duration.ofSeconds(5)).until(() -> fast.events.size() >= 4);
    // очередь медленного подписчика вмещает 4 события, одно может быть уже в доставке
    assertThat(slowSubscription.getDroppedCount()).isGreaterThanOrEqualTo(15);
    release.countDown();
  }

  @Test
  @DisplayName("Ошибка доставки одному подписчику не мешает другим")
  void shouldIsolateFailingSubscriber() {
    EventSink failing = new EventSink() {
      @Override
      public void deliver(HubEvent event) {
        throw new IllegalStateException("boom");
      }

      @Override
      public boolean isOpen() {
        return true;
      }
    };
    RecordingSink healthy = new RecordingSink();
    hub.subscribe(failing);
    hub.subscribe(healthy);

    hub.publish("new_command", "a");
    hub.publish("new_command", "b");

    await().atMost(Duration.ofSeconds(5)).until(() -> healthy.events.size() == 2);
    assertThat(hub.subscriberCount()).isEqualTo(2);
  }

  @Test
  @DisplayName("Закрытый подписчик удаляется при следующей доставке")
  void shouldRemoveClosedSubscriber() {
    RecordingSink sink = new RecordingSink();
    hub.subscribe(sink);
    sink.open = false;

    hub.publish("sensor_data", 1);

    await().atMost(Duration.ofSeconds(5)).until(() -> hub.subscriberCount() == 0);
    assertThat(sink.events).isEmpty();
  }

  @Test
  @DisplayName("После отписки события не доставляются")
  void shouldStopDeliveryAfterUnsubscribe() throws Exception {
    RecordingSink sink = new RecordingSink();
    Subscription subscription = hub.subscribe(sink);
    hub.publish("sensor_data", 1);
    await().atMost(Duration.ofSeconds(5)).until(() -> sink.events.size() == 1);

    hub.unsubscribe(subscription);
    hub.publish("sensor_data", 2);
    Thread.sleep(200);

    assertThat(sink.payloads()).containsExactly(1);
    assertThat(hub.subscriberCount()).isZero();
  }

  @Test
  @DisplayName("Публикация без подписчиков ничего не делает")
  void shouldPublishWithoutSubscribers() {
    hub.publish("sensor_data", 1);

    assertThat(hub.subscriberCount()).isZero();
  }

  private static class RecordingSink implements EventSink {
    final List<HubEvent> events = new CopyOnWriteArrayList<>();
    volatile boolean open = true;

    @Override
    public void deliver(HubEvent event) {
      events.add(event);
    }

    @Override
    public boolean isOpen() {
      return open;
    }

    List<Object> payloads() {
      return events.stream().map(HubEvent::getPayload).collect(Collectors.toList());
    }
  }

  private static class BlockingSink implements EventSink {
    private final CountDownLatch release;

    BlockingSink(CountDownLatch release) {
      this.release = release;
    }

    @Override
    public void deliver(HubEvent event) throws InterruptedException {
      release.await(10, TimeUnit.SECONDS);
    }

    @Override
    public boolean isOpen() {
      return true;
    }
  }
}
