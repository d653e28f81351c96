package com.agri.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CommandTest {

  private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

  @Test
  @DisplayName("Новая команда: pending, без результата и времени завершения")
  void shouldCreatePendingCommand() {
    Command command = Command.pending(CommandType.FERTILIZE, "Zone_B", Map.of("amount", 2.5), NOW);

    assertThat(command.getStatus()).isEqualTo(CommandStatus.PENDING);
    assertThat(command.getCompletedAt()).isNull();
    assertThat(command.getResult()).isNull();
    assertThat(command.getId()).isNotEqualTo(Command.pending(CommandType.FERTILIZE, "Zone_B", Map.of(), NOW).getId());
  }

  @Test
  @DisplayName("Результат и время завершения только у терминальных статусов")
  void shouldEnforceTerminalFields() {
    assertThatThrownBy(() -> new Command("c1", CommandType.SCOUT, "Z", Map.of(),
        CommandStatus.COMPLETED, NOW, null, null))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new Command("c1", CommandType.SCOUT, "Z", Map.of(),
        CommandStatus.IN_PROGRESS, NOW, NOW, "done"))
        .isInstanceOf(IllegalArgumentException.class);

    Command failed = new Command("c1", CommandType.SCOUT, "Z", Map.of(), CommandStatus.FAILED, NOW, NOW, "lost");
    assertThat(failed.getStatus().isTerminal()).isTrue();
  }

  @Test
  @DisplayName("Переходы статусов: только вперёд по одному шагу")
  void shouldDefinePredecessors() {
    assertThat(CommandStatus.IN_PROGRESS.predecessor()).isEqualTo(CommandStatus.PENDING);
    assertThat(CommandStatus.COMPLETED.predecessor()).isEqualTo(CommandStatus.IN_PROGRESS);
    assertThat(CommandStatus.FAILED.predecessor()).isEqualTo(CommandStatus.IN_PROGRESS);
    assertThatThrownBy(CommandStatus.PENDING::predecessor).isInstanceOf(IllegalArgumentException.class);
    assertThat(CommandStatus.fromWireName("in_progress")).isEqualTo(CommandStatus.IN_PROGRESS);
  }

  @Test
  @DisplayName("Тип команды: канонические имена и синонимы без учёта регистра")
  void shouldParseCommandTypes() {
    assertThat(CommandType.parse("irrigate")).contains(CommandType.IRRIGATE);
    assertThat(CommandType.parse("FERTILIZER")).contains(CommandType.FERTILIZE);
    assertThat(CommandType.parse(" soil_sample ")).contains(CommandType.SOIL_SAMPLE);
    assertThat(CommandType.parse("scouting")).contains(CommandType.SCOUT);
    assertThat(CommandType.parse("harvest")).isEmpty();
    assertThat(CommandType.parse(null)).isEmpty();
    assertThat(CommandType.SOIL_SAMPLE.roverType()).isEqualTo("irrigation");
  }
}
