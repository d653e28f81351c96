package com.agri.simulation;

import com.agri.config.SimulationSettings;
import com.agri.db.PersistenceGateway;
import com.agri.hub.BroadcastHub;
import com.agri.model.Reading;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Генератор показаний почвенных датчиков.
 * <p>
 * На каждом такте для каждого датчика формирует показание, сохраняет его через
 * {@link PersistenceGateway} и публикует событие "sensor_data". Ошибка одного датчика
 * логируется и пропускается; следующий такт выполняется по расписанию.
 */
public class SensorSimulator implements AutoCloseable {

  public static final String SENSOR_DATA_EVENT = "sensor_data";

  private static final Logger logger = LoggerFactory.getLogger(SensorSimulator.class);

  /** Базовые значения исходной фермы: N, P, K, pH, влажность, температура. */
  private static final Map<String, double[]> KNOWN_BASELINES = Map.of(
      "Probe_1", new double[] {45, 30, 35, 6.5, 65, 24},
      "Probe_2", new double[] {40, 25, 30, 6.8, 70, 23},
      "Probe_3", new double[] {50, 35, 40, 6.3, 60, 25},
      "Probe_4", new double[] {35, 20, 25, 7.0, 75, 22});

  private final PersistenceGateway gateway;
  private final BroadcastHub hub;
  private final SimulationSettings settings;
  private final Clock clock;
  private final Random random;
  private final Map<String, ProbeState> probes = new LinkedHashMap<>();

  private ScheduledExecutorService scheduler;

  public SensorSimulator(PersistenceGateway gateway, BroadcastHub hub, SimulationSettings settings,
                         Clock clock, Random random) {
    this.gateway = gateway;
    this.hub = hub;
    this.settings = settings;
    this.clock = clock;
    this.random = random;
    for (String probeId : settings.getProbeIds()) {
      probes.put(probeId, new ProbeState(probeId, initialBaseline(probeId)));
    }
  }

  private Map<Metric, Double> initialBaseline(String probeId) {
    double[] known = KNOWN_BASELINES.get(probeId);
    Map<Metric, Double> baseline = new EnumMap<>(Metric.class);
    if (known != null) {
      baseline.put(Metric.NITROGEN, known[0]);
      baseline.put(Metric.PHOSPHORUS, known[1]);
      baseline.put(Metric.POTASSIUM, known[2]);
      baseline.put(Metric.PH, known[3]);
      baseline.put(Metric.HUMIDITY, known[4]);
      baseline.put(Metric.TEMPERATURE, known[5]);
    } else {
      baseline.put(Metric.NITROGEN, 35 + random.nextDouble() * 15);
      baseline.put(Metric.PHOSPHORUS, 20 + random.nextDouble() * 15);
      baseline.put(Metric.POTASSIUM, 25 + random.nextDouble() * 15);
      baseline.put(Metric.PH, 6.3 + random.nextDouble() * 0.7);
      baseline.put(Metric.HUMIDITY, 60 + random.nextDouble() * 15);
      baseline.put(Metric.TEMPERATURE, 22 + random.nextDouble() * 3);
    }
    baseline.put(Metric.SOIL_MOISTURE, 40 + random.nextDouble() * 20);
    baseline.put(Metric.FERTILITY_INDEX, 70 + random.nextDouble() * 15);
    return baseline;
  }

  /**
   * Один такт симуляции: по одному показанию на датчик.
   *
   * @return Успешно сохранённые показания (с присвоенными id).
   */
  public synchronized List<Reading> tick() {
    List<Reading> saved = new ArrayList<>(probes.size());
    for (ProbeState probe : probes.values()) {
      Reading reading = probe.next(clock.instant().truncatedTo(ChronoUnit.MILLIS), random);
      try {
        long id = gateway.insertReading(reading);
        Reading stored = reading.withId(id);
        hub.publish(SENSOR_DATA_EVENT, stored);
        saved.add(stored);
      } catch (RuntimeException e) {
        logger.error("❌ Показание датчика {} пропущено: {}", probe.probeId(), e.getMessage());
      }
    }
    logger.debug("Такт датчиков: сохранено {} из {}", saved.size(), probes.size());
    return saved;
  }

  /**
   * Запускает периодические такты с интервалом sensor.tick.interval.ms.
   */
  public synchronized void start() {
    if (scheduler != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
      Thread t = new Thread(r, "sensor-simulator");
      t.setDaemon(true);
      return t;
    });
    long interval = settings.getSensorTickInterval().toMillis();
    scheduler.scheduleWithFixedDelay(this::scheduledTick, 0, interval, TimeUnit.MILLISECONDS);
    logger.info("🌱 Симулятор датчиков запущен: {} датчиков, интервал {} мс", probes.size(), interval);
  }

  private void scheduledTick() {
    try {
      tick();
    } catch (RuntimeException e) {
      // исключение из задачи отменило бы все последующие такты
      logger.error("❌ Такт датчиков завершился ошибкой", e);
    }
  }

  public synchronized boolean isRunning() {
    return scheduler != null && !scheduler.isShutdown();
  }

  public void stop() {
    ScheduledExecutorService current;
    synchronized (this) {
      current = scheduler;
      scheduler = null;
    }
    if (current == null) {
      return;
    }
    current.shutdownNow();
    try {
      current.awaitTermination(5, TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    logger.info("Симулятор датчиков остановлен");
  }

  @Override
  public void close() {
    stop();
  }
}
