package com.agri.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Известные типы команд для роверов.
 * Синонимы из клиентского интерфейса ("irrigation", "fertilizer") сводятся к каноническому имени.
 */
public enum CommandType {
  IRRIGATE("irrigate", "irrigation", Set.of("irrigation")),
  FERTILIZE("fertilize", "fertilizer", Set.of("fertilizer")),
  SOIL_SAMPLE("soil_sample", "irrigation", Set.of("soil_sampling")),
  SCOUT("scout", "fertilizer", Set.of("scouting"));

  private final String wireName;
  private final String roverType;
  private final Set<String> aliases;

  CommandType(String wireName, String roverType, Set<String> aliases) {
    this.wireName = wireName;
    this.roverType = roverType;
    this.aliases = aliases;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }

  /** Тип ровера, который выполняет команду. */
  public String roverType() {
    return roverType;
  }

  public static Optional<CommandType> parse(String value) {
    if (value == null) {
      return Optional.empty();
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (CommandType t : values()) {
      if (t.wireName.equals(normalized) || t.aliases.contains(normalized)) {
        return Optional.of(t);
      }
    }
    return Optional.empty();
  }
}
