package com.agri.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RoverStatus {
  IDLE("idle"),
  BUSY("busy");

  private final String wireName;

  RoverStatus(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }

  public static RoverStatus fromWireName(String value) {
    for (RoverStatus s : values()) {
      if (s.wireName.equals(value)) {
        return s;
      }
    }
    throw new IllegalArgumentException("Unknown rover status: " + value);
  }
}
