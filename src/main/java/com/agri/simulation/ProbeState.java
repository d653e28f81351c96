package com.agri.simulation;

import com.agri.model.Reading;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Random;

/**
 * Состояние одного датчика: медленно дрейфующая базовая линия по каждой метрике
 * и время последнего показания. Принадлежит {@link SensorSimulator}, вне его не изменяется.
 */
final class ProbeState {

  private final String probeId;
  private final Map<Metric, Double> baseline;
  private Instant lastTimestamp;

  ProbeState(String probeId, Map<Metric, Double> baseline) {
    this.probeId = probeId;
    this.baseline = new EnumMap<>(baseline);
  }

  String probeId() {
    return probeId;
  }

  /**
   * Сдвигает базовую линию и формирует следующее показание.
   * Время строго больше предыдущего, даже если часы не сдвинулись.
   */
  Reading next(Instant now, Random random) {
    Instant timestamp = lastTimestamp == null || now.isAfter(lastTimestamp)
        ? now
        : lastTimestamp.plusMillis(1);
    lastTimestamp = timestamp;

    for (Metric m : Metric.values()) {
      double drifted = baseline.get(m) + uniform(random, m.drift());
      baseline.put(m, m.clampBaseline(drifted));
    }

    return Reading.builder()
        .probeId(probeId)
        .timestamp(timestamp)
        .nitrogen(sample(Metric.NITROGEN, random))
        .phosphorus(sample(Metric.PHOSPHORUS, random))
        .potassium(sample(Metric.POTASSIUM, random))
        .ph(round(sample(Metric.PH, random), 2))
        .humidity(sample(Metric.HUMIDITY, random))
        .temperature(sample(Metric.TEMPERATURE, random))
        .soilMoisture(sample(Metric.SOIL_MOISTURE, random))
        .fertilityIndex(sample(Metric.FERTILITY_INDEX, random))
        .build();
  }

  private double sample(Metric m, Random random) {
    return round(m.clamp(baseline.get(m) + uniform(random, m.noise())), 2);
  }

  private static double uniform(Random random, double amplitude) {
    return (random.nextDouble() * 2.0 - 1.0) * amplitude;
  }

  private static double round(double value, int digits) {
    double scale = Math.pow(10, digits);
    return Math.round(value * scale) / scale;
  }
}
