package com.agri.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Жизненный цикл команды: pending → in_progress → completed | failed.
 */
public enum CommandStatus {
  PENDING("pending"),
  IN_PROGRESS("in_progress"),
  COMPLETED("completed"),
  FAILED("failed");

  private final String wireName;

  CommandStatus(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED;
  }

  /**
   * Единственное состояние, из которого разрешён переход в данное.
   *
   * @throws IllegalArgumentException для PENDING: в него перейти нельзя.
   */
  public CommandStatus predecessor() {
    switch (this) {
      case IN_PROGRESS:
        return PENDING;
      case COMPLETED:
      case FAILED:
        return IN_PROGRESS;
      default:
        throw new IllegalArgumentException("No transition leads to " + wireName);
    }
  }

  public static CommandStatus fromWireName(String value) {
    for (CommandStatus s : values()) {
      if (s.wireName.equals(value)) {
        return s;
      }
    }
    throw new IllegalArgumentException("Unknown command status: " + value);
  }
}
