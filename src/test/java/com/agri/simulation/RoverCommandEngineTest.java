package com.agri.simulation;

import com.agri.config.SimulationSettings;
import com.agri.db.DatabaseConnection;
import com.agri.db.JdbcPersistenceGateway;
import com.agri.db.PersistenceGateway;
import com.agri.error.StorageException;
import com.agri.error.ValidationException;
import com.agri.hub.BroadcastHub;
import com.agri.model.Command;
import com.agri.model.CommandStatus;
import com.agri.model.CommandType;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.Statement;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Проверки движка команд на H2: приём, захват, завершение и восстановление.
 */
class RoverCommandEngineTest {

  private static HikariDataSource dataSource;

  private PersistenceGateway gateway;
  private BroadcastHub hub;
  private ScheduledExecutorService scheduler;

  @BeforeAll
  static void startDatabase() {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl("jdbc:h2:mem:engine-test;DB_CLOSE_DELAY=-1;MODE=PostgreSQL");
    config.setUsername("sa");
    config.setPassword("");
    config.setMaximumPoolSize(8);
    dataSource = new HikariDataSource(config);
    DatabaseConnection.initializeDatabase(dataSource);
  }

  @AfterAll
  static void stopDatabase() {
    dataSource.close();
  }

  @BeforeEach
  void setUp() throws Exception {
    try (Connection conn = dataSource.getConnection();
         Statement stmt = conn.createStatement()) {
      stmt.executeUpdate("DELETE FROM commands");
    }
    gateway = new JdbcPersistenceGateway(dataSource, Clock.systemUTC());
    hub = mock(BroadcastHub.class);
    scheduler = Executors.newScheduledThreadPool(2);
  }

  @AfterEach
  void tearDown() {
    scheduler.shutdownNow();
  }

  private RoverCommandEngine engine(SimulationSettings settings) {
    return new RoverCommandEngine(gateway, hub, settings, Clock.systemUTC(), new Random(7), scheduler);
  }

  private static SimulationSettings.Builder fast() {
    return SimulationSettings.builder()
        .dispatchPollInterval(Duration.ofMillis(50))
        .executionBase(Duration.ofMillis(20))
        .executionPerUnit(Duration.ofMillis(1))
        .executionMax(Duration.ofMillis(200))
        .failureProbability(0.0);
  }

  @Test
  @DisplayName("Новая команда сохраняется как pending и публикуется new_command")
  void shouldPersistPendingCommandAndPublish() {
    RoverCommandEngine engine = engine(fast().build());

    Command command = engine.submit("irrigate", "Zone_A", Map.of("duration", 30));

    assertThat(command.getStatus()).isEqualTo(CommandStatus.PENDING);
    assertThat(command.getId()).isNotBlank();
    assertThat(gateway.findCommand(command.getId())).contains(command);
    verify(hub).publish(RoverCommandEngine.NEW_COMMAND_EVENT, command);
  }

  @Test
  @DisplayName("Синоним типа из клиентского интерфейса приводится к каноническому")
  void shouldAcceptTypeAlias() {
    Command command = engine(fast().build()).submit(" Irrigation ", " Zone_B ", null);

    assertThat(command.getCommandType()).isEqualTo(CommandType.IRRIGATE);
    assertThat(command.getZone()).isEqualTo("Zone_B");
    assertThat(command.getParameters()).isEmpty();
  }

  @Test
  @DisplayName("Неверная команда отклоняется и ничего не сохраняется")
  void shouldRejectInvalidCommandWithoutPersisting() {
    RoverCommandEngine engine = engine(fast().build());

    assertThatThrownBy(() -> engine.submit("teleport", "Zone_A", Map.of()))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("irrigate");
    assertThatThrownBy(() -> engine.submit("irrigate", "  ", Map.of()))
        .isInstanceOf(ValidationException.class);
    assertThatThrownBy(() -> engine.submit("irrigate", "Zone_A", Map.of("duration", -5)))
        .isInstanceOf(ValidationException.class);
    assertThatThrownBy(() -> engine.submit("irrigate", "Zone_A", Map.of("duration", "long")))
        .isInstanceOf(ValidationException.class);
    assertThatThrownBy(() -> engine.submit("irrigate", "Zone_A", Map.of("duration", Double.POSITIVE_INFINITY)))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("finite");
    assertThatThrownBy(() -> engine.submit("irrigate", "Zone_A", Map.of("duration", Double.NaN)))
        .isInstanceOf(ValidationException.class);

    assertThat(gateway.queryCommandHistory(10)).isEmpty();
    verify(hub, never()).publish(anyString(), any());
  }

  @Test
  @DisplayName("Задержка выполнения: base + duration × perUnit, не больше max")
  void shouldComputeExecutionDelay() {
    RoverCommandEngine engine = engine(SimulationSettings.builder().build());

    assertThat(engine.executionDelay(Command.pending(CommandType.SCOUT, "Z", Map.of(), Instant.EPOCH)))
        .isEqualTo(Duration.ofSeconds(5));
    assertThat(engine.executionDelay(Command.pending(CommandType.IRRIGATE, "Z", Map.of("duration", 20),
        Instant.EPOCH))).isEqualTo(Duration.ofSeconds(10));
    assertThat(engine.executionDelay(Command.pending(CommandType.IRRIGATE, "Z", Map.of("duration", 600),
        Instant.EPOCH))).isEqualTo(Duration.ofSeconds(15));
  }

  @Test
  @DisplayName("Огромный duration не переполняет задержку и упирается в max")
  void shouldCapExecutionDelayForHugeDuration() {
    RoverCommandEngine engine = engine(SimulationSettings.builder().build());

    assertThat(engine.executionDelay(Command.pending(CommandType.IRRIGATE, "Z", Map.of("duration", 1e17),
        Instant.EPOCH))).isEqualTo(Duration.ofSeconds(15));
    assertThat(engine.executionDelay(Command.pending(CommandType.IRRIGATE, "Z", Map.of("duration", 1e300),
        Instant.EPOCH))).isEqualTo(Duration.ofSeconds(15));
    assertThat(engine.executionDelay(Command.pending(CommandType.IRRIGATE, "Z", Map.of("duration", Long.MAX_VALUE),
        Instant.EPOCH))).isEqualTo(Duration.ofSeconds(15));

    Command accepted = engine.submit("irrigate", "Zone_A", Map.of("duration", Long.MAX_VALUE));
    assertThat(engine.executionDelay(accepted)).isEqualTo(Duration.ofSeconds(15));
  }

  @Test
  @DisplayName("Параллельные проходы диспетчера захватывают каждую команду ровно один раз")
  void shouldClaimEachCommandOnceAcrossConcurrentPasses() throws Exception {
    RoverCommandEngine engine = engine(SimulationSettings.builder()
        .executionBase(Duration.ofMinutes(1))
        .build());
    for (int i = 0; i < 20; i++) {
      engine.submit("fertilize", "Zone_" + i, Map.of());
    }

    int passes = 4;
    ExecutorService pool = Executors.newFixedThreadPool(passes);
    CountDownLatch go = new CountDownLatch(1);
    List<Future<Integer>> results = new ArrayList<>();
    try {
      for (int i = 0; i < passes; i++) {
        Callable<Integer> pass = () -> {
          go.await();
          return engine.dispatchPass();
        };
        results.add(pool.submit(pass));
      }
      go.countDown();
      int claimed = 0;
      for (Future<Integer> f : results) {
        claimed += f.get();
      }

      assertThat(claimed).isEqualTo(20);
    } finally {
      pool.shutdownNow();
    }
    assertThat(gateway.listCommandsByStatus(CommandStatus.IN_PROGRESS)).hasSize(20);
    assertThat(gateway.listCommandsByStatus(CommandStatus.PENDING)).isEmpty();
    assertThat(engine.inFlightCount()).isEqualTo(20);
  }

  @Test
  @DisplayName("Успешное выполнение: completed, итог с именем ровера, одно событие")
  void shouldCompleteCommandOnce() {
    RoverCommandEngine engine = engine(fast().build());
    Command command = engine.submit("irrigate", "Zone_A", Map.of("duration", 30));
    gateway.updateCommandStatus(command.getId(), CommandStatus.IN_PROGRESS, null, null);

    engine.complete(command);
    engine.complete(command);

    Command stored = gateway.findCommand(command.getId()).orElseThrow();
    assertThat(stored.getStatus()).isEqualTo(CommandStatus.COMPLETED);
    assertThat(stored.getResult()).startsWith("Successfully executed irrigate in Zone_A by Irrigation Rover");
    assertThat(stored.getCompletedAt()).isNotNull();

    ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);
    verify(hub, times(1)).publish(eq(RoverCommandEngine.COMMAND_COMPLETED_EVENT), payload.capture());
    assertThat(payload.getValue())
        .asInstanceOf(InstanceOfAssertFactories.map(String.class, Object.class))
        .containsEntry("command_id", command.getId())
        .containsEntry("status", "completed")
        .containsEntry("result", stored.getResult())
        .containsKey("timestamp");
  }

  @Test
  @DisplayName("Имитация сбоя: failed с непустым объяснением")
  void shouldFailCommandWhenFailureDrawn() {
    RoverCommandEngine engine = engine(fast().failureProbability(1.0).build());
    Command command = engine.submit("fertilize", "Zone_C", Map.of());
    gateway.updateCommandStatus(command.getId(), CommandStatus.IN_PROGRESS, null, null);

    engine.complete(command);

    Command stored = gateway.findCommand(command.getId()).orElseThrow();
    assertThat(stored.getStatus()).isEqualTo(CommandStatus.FAILED);
    assertThat(stored.getResult()).startsWith("Fertilizer Rover failed to execute fertilize in Zone_C: ");
  }

  @Test
  @DisplayName("Запущенный диспетчер доводит команду до терминального статуса")
  void shouldDriveCommandToTerminalStatusWhenStarted() {
    RoverCommandEngine engine = engine(fast().build());
    Command command = engine.submit("soil_sample", "Zone_D", Map.of("duration", 5));

    engine.start();

    await().atMost(Duration.ofSeconds(5)).until(() ->
        gateway.findCommand(command.getId()).orElseThrow().getStatus() == CommandStatus.COMPLETED);
    assertThat(engine.isRunning()).isTrue();
    engine.stop();
    assertThat(engine.isRunning()).isFalse();
  }

  @Test
  @DisplayName("Команды in_progress после перезапуска завершаются")
  void shouldRecoverInProgressCommandsOnStart() {
    Command orphan = Command.pending(CommandType.SCOUT, "Zone_E", Map.of(), Instant.now());
    gateway.insertCommand(orphan);
    gateway.updateCommandStatus(orphan.getId(), CommandStatus.IN_PROGRESS, null, null);

    engine(fast().build()).start();

    await().atMost(Duration.ofSeconds(5)).until(() ->
        gateway.findCommand(orphan.getId()).orElseThrow().getStatus().isTerminal());
  }

  @Test
  @DisplayName("Файловая БД: команда in_progress переживает перезапуск и завершается новым движком")
  void shouldRecoverInProgressCommandAfterDatabaseRestart(@TempDir Path dir) {
    String url = "jdbc:h2:file:" + dir.resolve("agri").toAbsolutePath()
        + ";MODE=PostgreSQL;DB_CLOSE_ON_EXIT=FALSE";
    Command orphan = Command.pending(CommandType.FERTILIZE, "Zone_C", Map.of("duration", 3), Instant.now());
    try (HikariDataSource first = fileDataSource(url)) {
      DatabaseConnection.initializeDatabase(first);
      PersistenceGateway before = new JdbcPersistenceGateway(first, Clock.systemUTC());
      before.insertCommand(orphan);
      before.updateCommandStatus(orphan.getId(), CommandStatus.IN_PROGRESS, null, null);
    }

    try (HikariDataSource second = fileDataSource(url)) {
      DatabaseConnection.initializeDatabase(second);
      PersistenceGateway after = new JdbcPersistenceGateway(second, Clock.systemUTC());
      assertThat(after.listRovers()).hasSize(2);
      assertThat(after.findCommand(orphan.getId())).get()
          .extracting(Command::getStatus).isEqualTo(CommandStatus.IN_PROGRESS);

      RoverCommandEngine engine = new RoverCommandEngine(after, hub, fast().build(),
          Clock.systemUTC(), new Random(7), scheduler);
      engine.start();

      await().atMost(Duration.ofSeconds(5)).until(() ->
          after.findCommand(orphan.getId()).orElseThrow().getStatus() == CommandStatus.COMPLETED);
      engine.stop();
    }
  }

  private static HikariDataSource fileDataSource(String url) {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl(url);
    config.setUsername("sa");
    config.setPassword("");
    config.setMaximumPoolSize(2);
    return new HikariDataSource(config);
  }

  @Test
  @DisplayName("Сбой хранилища при завершении → повтор позже, событие одно")
  void shouldRetryCompletionAfterStorageFailure() {
    PersistenceGateway flaky = mock(PersistenceGateway.class);
    when(flaky.listRovers()).thenReturn(List.of());
    when(flaky.updateCommandStatus(anyString(), eq(CommandStatus.COMPLETED), anyString(), any()))
        .thenThrow(new StorageException("connection reset", null))
        .thenReturn(true);
    RoverCommandEngine engine = new RoverCommandEngine(flaky, hub, fast().build(),
        Clock.systemUTC(), new Random(7), scheduler);
    Command command = Command.pending(CommandType.IRRIGATE, "Zone_A", Map.of(), Instant.now());

    engine.complete(command);

    await().atMost(Duration.ofSeconds(5)).untilAsserted(() ->
        verify(hub, times(1)).publish(eq(RoverCommandEngine.COMMAND_COMPLETED_EVENT), any()));
    verify(flaky, times(2)).updateCommandStatus(eq(command.getId()), eq(CommandStatus.COMPLETED), anyString(), any());
  }
}
