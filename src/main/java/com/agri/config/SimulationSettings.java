package com.agri.config;

import java.time.Duration;
import java.util.List;

/**
 * Неизменяемый набор параметров симуляции: датчики, интервалы планировщиков,
 * модель выполнения команд и ёмкость очередей подписчиков.
 * <p>
 * Создаётся один раз при старте через {@link #fromConfig()} или {@link #builder()} (в тестах).
 */
public final class SimulationSettings {

  public static final List<String> DEFAULT_PROBES = List.of("Probe_1", "Probe_2", "Probe_3", "Probe_4");

  private final List<String> probeIds;
  private final Duration sensorTickInterval;
  private final Duration dispatchPollInterval;
  private final int dispatcherWorkers;
  private final double failureProbability;
  private final Duration executionBase;
  private final Duration executionPerUnit;
  private final Duration executionMax;
  private final int subscriberQueueCapacity;

  private SimulationSettings(Builder b) {
    if (b.probeIds == null || b.probeIds.isEmpty()) {
      throw new IllegalArgumentException("At least one probe id is required");
    }
    if (b.failureProbability < 0.0 || b.failureProbability > 1.0) {
      throw new IllegalArgumentException("Failure probability must be within [0, 1]: " + b.failureProbability);
    }
    if (b.dispatcherWorkers < 1) {
      throw new IllegalArgumentException("Dispatcher needs at least one worker");
    }
    if (b.subscriberQueueCapacity < 1) {
      throw new IllegalArgumentException("Subscriber queue capacity must be positive");
    }
    requirePositive(b.sensorTickInterval, "sensor tick interval");
    requirePositive(b.dispatchPollInterval, "dispatch poll interval");
    this.probeIds = List.copyOf(b.probeIds);
    this.sensorTickInterval = b.sensorTickInterval;
    this.dispatchPollInterval = b.dispatchPollInterval;
    this.dispatcherWorkers = b.dispatcherWorkers;
    this.failureProbability = b.failureProbability;
    this.executionBase = b.executionBase;
    this.executionPerUnit = b.executionPerUnit;
    this.executionMax = b.executionMax;
    this.subscriberQueueCapacity = b.subscriberQueueCapacity;
  }

  private static void requirePositive(Duration d, String what) {
    if (d == null || d.isZero() || d.isNegative()) {
      throw new IllegalArgumentException("The " + what + " must be positive: " + d);
    }
  }

  /**
   * Читает параметры из {@link Config}; отсутствующие ключи получают значения по умолчанию.
   */
  public static SimulationSettings fromConfig() {
    return builder()
        .probeIds(Config.getList("simulation.probes", DEFAULT_PROBES))
        .sensorTickInterval(Duration.ofMillis(Config.getLong("sensor.tick.interval.ms", 10_000)))
        .dispatchPollInterval(Duration.ofMillis(Config.getLong("dispatcher.poll.interval.ms", 5_000)))
        .dispatcherWorkers(Config.getInt("dispatcher.workers", 1))
        .failureProbability(Config.getDouble("dispatcher.failure.probability", 0.05))
        .executionBase(Duration.ofMillis(Config.getLong("execution.base.ms", 5_000)))
        .executionPerUnit(Duration.ofMillis(Config.getLong("execution.per.unit.ms", 250)))
        .executionMax(Duration.ofMillis(Config.getLong("execution.max.ms", 15_000)))
        .subscriberQueueCapacity(Config.getInt("hub.subscriber.queue.capacity", 256))
        .build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public List<String> getProbeIds() {
    return probeIds;
  }

  public Duration getSensorTickInterval() {
    return sensorTickInterval;
  }

  public Duration getDispatchPollInterval() {
    return dispatchPollInterval;
  }

  public int getDispatcherWorkers() {
    return dispatcherWorkers;
  }

  public double getFailureProbability() {
    return failureProbability;
  }

  public Duration getExecutionBase() {
    return executionBase;
  }

  public Duration getExecutionPerUnit() {
    return executionPerUnit;
  }

  public Duration getExecutionMax() {
    return executionMax;
  }

  public int getSubscriberQueueCapacity() {
    return subscriberQueueCapacity;
  }

  public static final class Builder {
    private List<String> probeIds = DEFAULT_PROBES;
    private Duration sensorTickInterval = Duration.ofSeconds(10);
    private Duration dispatchPollInterval = Duration.ofSeconds(5);
    private int dispatcherWorkers = 1;
    private double failureProbability = 0.05;
    private Duration executionBase = Duration.ofSeconds(5);
    private Duration executionPerUnit = Duration.ofMillis(250);
    private Duration executionMax = Duration.ofSeconds(15);
    private int subscriberQueueCapacity = 256;

    private Builder() {
    }

    public Builder probeIds(List<String> probeIds) {
      this.probeIds = probeIds;
      return this;
    }

    public Builder sensorTickInterval(Duration sensorTickInterval) {
      this.sensorTickInterval = sensorTickInterval;
      return this;
    }

    public Builder dispatchPollInterval(Duration dispatchPollInterval) {
      this.dispatchPollInterval = dispatchPollInterval;
      return this;
    }

    public Builder dispatcherWorkers(int dispatcherWorkers) {
      this.dispatcherWorkers = dispatcherWorkers;
      return this;
    }

    public Builder failureProbability(double failureProbability) {
      this.failureProbability = failureProbability;
      return this;
    }

    public Builder executionBase(Duration executionBase) {
      this.executionBase = executionBase;
      return this;
    }

    public Builder executionPerUnit(Duration executionPerUnit) {
      this.executionPerUnit = executionPerUnit;
      return this;
    }

    public Builder executionMax(Duration executionMax) {
      this.executionMax = executionMax;
      return this;
    }

    public Builder subscriberQueueCapacity(int subscriberQueueCapacity) {
      this.subscriberQueueCapacity = subscriberQueueCapacity;
      return this;
    }

    public SimulationSettings build() {
      return new SimulationSettings(this);
    }
  }
}
