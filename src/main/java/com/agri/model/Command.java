package com.agri.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Команда роверу с отслеживаемым жизненным циклом. Неизменяемая копия строки таблицы commands.
 * <p>
 * Инвариант: {@code completedAt} и {@code result} заданы тогда и только тогда,
 * когда статус терминальный.
 */
public final class Command {

  private final String id;
  private final CommandType commandType;
  private final String zone;
  private final Map<String, Object> parameters;
  private final CommandStatus status;
  private final Instant createdAt;
  private final Instant completedAt;
  private final String result;

  public Command(String id, CommandType commandType, String zone, Map<String, Object> parameters,
                 CommandStatus status, Instant createdAt, Instant completedAt, String result) {
    this.id = Objects.requireNonNull(id, "id");
    this.commandType = Objects.requireNonNull(commandType, "commandType");
    this.zone = Objects.requireNonNull(zone, "zone");
    this.parameters = parameters == null
        ? Collections.emptyMap()
        : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    this.status = Objects.requireNonNull(status, "status");
    this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
    if (status.isTerminal() != (completedAt != null) || status.isTerminal() != (result != null)) {
      throw new IllegalArgumentException(
          "completedAt and result must be set exactly when status is terminal, status=" + status.wireName());
    }
    this.completedAt = completedAt;
    this.result = result;
  }

  /**
   * Новая команда в статусе pending со свежим UUID.
   */
  public static Command pending(CommandType type, String zone, Map<String, Object> parameters, Instant createdAt) {
    return new Command(UUID.randomUUID().toString(), type, zone, parameters,
        CommandStatus.PENDING, createdAt, null, null);
  }

  public String getId() {
    return id;
  }

  public CommandType getCommandType() {
    return commandType;
  }

  public String getZone() {
    return zone;
  }

  public Map<String, Object> getParameters() {
    return parameters;
  }

  public CommandStatus getStatus() {
    return status;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getCompletedAt() {
    return completedAt;
  }

  public String getResult() {
    return result;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Command)) {
      return false;
    }
    Command other = (Command) o;
    return id.equals(other.id)
        && commandType == other.commandType
        && zone.equals(other.zone)
        && parameters.equals(other.parameters)
        && status == other.status
        && createdAt.equals(other.createdAt)
        && Objects.equals(completedAt, other.completedAt)
        && Objects.equals(result, other.result);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, commandType, zone, parameters, status, createdAt, completedAt, result);
  }

  @Override
  public String toString() {
    return "Command{id=" + id + ", type=" + commandType.wireName() + ", zone=" + zone
        + ", status=" + status.wireName() + '}';
  }
}
