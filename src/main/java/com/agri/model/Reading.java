package com.agri.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Одно показание почвенного датчика. Неизменяемое.
 * <p>
 * До сохранения {@code id} равен null; после вставки gateway возвращает присвоенный идентификатор,
 * а копию с ним даёт {@link #withId(long)}.
 */
public final class Reading {

  private final Long id;
  private final String probeId;
  private final Instant timestamp;
  private final double nitrogen;
  private final double phosphorus;
  private final double potassium;
  private final double ph;
  private final double humidity;
  private final double temperature;
  private final double soilMoisture;
  private final double fertilityIndex;

  private Reading(Builder b) {
    this.id = b.id;
    this.probeId = Objects.requireNonNull(b.probeId, "probeId");
    this.timestamp = Objects.requireNonNull(b.timestamp, "timestamp");
    this.nitrogen = b.nitrogen;
    this.phosphorus = b.phosphorus;
    this.potassium = b.potassium;
    this.ph = b.ph;
    this.humidity = b.humidity;
    this.temperature = b.temperature;
    this.soilMoisture = b.soilMoisture;
    this.fertilityIndex = b.fertilityIndex;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Reading withId(long newId) {
    return toBuilder().id(newId).build();
  }

  public Builder toBuilder() {
    return new Builder()
        .id(id)
        .probeId(probeId)
        .timestamp(timestamp)
        .nitrogen(nitrogen)
        .phosphorus(phosphorus)
        .potassium(potassium)
        .ph(ph)
        .humidity(humidity)
        .temperature(temperature)
        .soilMoisture(soilMoisture)
        .fertilityIndex(fertilityIndex);
  }

  public Long getId() {
    return id;
  }

  public String getProbeId() {
    return probeId;
  }

  public Instant getTimestamp() {
    return timestamp;
  }

  /** Азот, мг/кг. */
  public double getNitrogen() {
    return nitrogen;
  }

  /** Фосфор, мг/кг. */
  public double getPhosphorus() {
    return phosphorus;
  }

  /** Калий, мг/кг. */
  public double getPotassium() {
    return potassium;
  }

  public double getPh() {
    return ph;
  }

  /** Влажность воздуха, %. */
  public double getHumidity() {
    return humidity;
  }

  /** Температура, °C. */
  public double getTemperature() {
    return temperature;
  }

  /** Влажность почвы, %. */
  public double getSoilMoisture() {
    return soilMoisture;
  }

  /** Индекс плодородия, %. */
  public double getFertilityIndex() {
    return fertilityIndex;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Reading)) {
      return false;
    }
    Reading other = (Reading) o;
    return Objects.equals(id, other.id)
        && probeId.equals(other.probeId)
        && timestamp.equals(other.timestamp)
        && Double.compare(nitrogen, other.nitrogen) == 0
        && Double.compare(phosphorus, other.phosphorus) == 0
        && Double.compare(potassium, other.potassium) == 0
        && Double.compare(ph, other.ph) == 0
        && Double.compare(humidity, other.humidity) == 0
        && Double.compare(temperature, other.temperature) == 0
        && Double.compare(soilMoisture, other.soilMoisture) == 0
        && Double.compare(fertilityIndex, other.fertilityIndex) == 0;
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, probeId, timestamp, nitrogen, phosphorus, potassium, ph, humidity,
        temperature, soilMoisture, fertilityIndex);
  }

  @Override
  public String toString() {
    return "Reading{id=" + id + ", probeId=" + probeId + ", timestamp=" + timestamp
        + ", ph=" + ph + ", soilMoisture=" + soilMoisture + '}';
  }

  public static final class Builder {
    private Long id;
    private String probeId;
    private Instant timestamp;
    private double nitrogen;
    private double phosphorus;
    private double potassium;
    private double ph;
    private double humidity;
    private double temperature;
    private double soilMoisture;
    private double fertilityIndex;

    private Builder() {
    }

    public Builder id(Long id) {
      this.id = id;
      return this;
    }

    public Builder probeId(String probeId) {
      this.probeId = probeId;
      return this;
    }

    public Builder timestamp(Instant timestamp) {
      this.timestamp = timestamp;
      return this;
    }

    public Builder nitrogen(double nitrogen) {
      this.nitrogen = nitrogen;
      return this;
    }

    public Builder phosphorus(double phosphorus) {
      this.phosphorus = phosphorus;
      return this;
    }

    public Builder potassium(double potassium) {
      this.potassium = potassium;
      return this;
    }

    public Builder ph(double ph) {
      this.ph = ph;
      return this;
    }

    public Builder humidity(double humidity) {
      this.humidity = humidity;
      return this;
    }

    public Builder temperature(double temperature) {
      this.temperature = temperature;
      return this;
    }

    public Builder soilMoisture(double soilMoisture) {
      this.soilMoisture = soilMoisture;
      return this;
    }

    public Builder fertilityIndex(double fertilityIndex) {
      this.fertilityIndex = fertilityIndex;
      return this;
    }

    public Reading build() {
      return new Reading(this);
    }
  }
}
