package com.agri.simulation;

/**
 * Метрики датчика и их допустимые диапазоны в симуляции.
 * <p>
 * noise — амплитуда равномерного шума вокруг базовой линии за одно показание,
 * drift — максимальный сдвиг базовой линии за такт.
 */
public enum Metric {
  NITROGEN(0.0, 100.0, 5.0, 0.5),
  PHOSPHORUS(0.0, 100.0, 3.0, 0.3),
  POTASSIUM(0.0, 100.0, 4.0, 0.4),
  PH(4.0, 9.0, 0.3, 0.02),
  HUMIDITY(0.0, 100.0, 5.0, 0.5),
  TEMPERATURE(-10.0, 50.0, 2.0, 0.2),
  SOIL_MOISTURE(20.0, 80.0, 8.0, 0.5),
  FERTILITY_INDEX(60.0, 95.0, 5.0, 0.3);

  private final double min;
  private final double max;
  private final double noise;
  private final double drift;

  Metric(double min, double max, double noise, double drift) {
    this.min = min;
    this.max = max;
    this.noise = noise;
    this.drift = drift;
  }

  public double min() {
    return min;
  }

  public double max() {
    return max;
  }

  double noise() {
    return noise;
  }

  double drift() {
    return drift;
  }

  double clamp(double value) {
    return Math.max(min, Math.min(max, value));
  }

  /** Базовая линия держится так, чтобы шум не упирался в границы. */
  double clampBaseline(double value) {
    double low = Math.min(min + noise, (min + max) / 2);
    double high = Math.max(max - noise, (min + max) / 2);
    return Math.max(low, Math.min(high, value));
  }
}
