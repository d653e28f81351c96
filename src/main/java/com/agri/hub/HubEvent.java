package com.agri.hub;

import java.util.Objects;

/**
 * Событие для подписчиков: имя ("sensor_data", "command_completed", ...) и полезная нагрузка.
 */
public final class HubEvent {

  private final String name;
  private final Object payload;

  public HubEvent(String name, Object payload) {
    this.name = Objects.requireNonNull(name, "name");
    this.payload = payload;
  }

  public String getName() {
    return name;
  }

  public Object getPayload() {
    return payload;
  }

  @Override
  public String toString() {
    return "HubEvent{" + name + '}';
  }
}
