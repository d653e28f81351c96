package com.agri.model;

import java.util.Objects;

/**
 * Запись статического реестра роверов.
 */
public final class Rover {

  private final String id;
  private final String name;
  private final String type;
  private final RoverStatus status;
  private final String currentZone;
  private final double batteryLevel;

  public Rover(String id, String name, String type, RoverStatus status, String currentZone, double batteryLevel) {
    this.id = Objects.requireNonNull(id, "id");
    this.name = Objects.requireNonNull(name, "name");
    this.type = Objects.requireNonNull(type, "type");
    this.status = Objects.requireNonNull(status, "status");
    this.currentZone = currentZone;
    this.batteryLevel = batteryLevel;
  }

  public String getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public String getType() {
    return type;
  }

  public RoverStatus getStatus() {
    return status;
  }

  public String getCurrentZone() {
    return currentZone;
  }

  public double getBatteryLevel() {
    return batteryLevel;
  }

  @Override
  public String toString() {
    return "Rover{id=" + id + ", name=" + name + ", type=" + type + ", status=" + status.wireName() + '}';
  }
}
