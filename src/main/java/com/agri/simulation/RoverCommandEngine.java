package com.agri.simulation;

import com.agri.config.SimulationSettings;
import com.agri.db.PersistenceGateway;
import com.agri.error.NotFoundException;
import com.agri.error.StorageException;
import com.agri.error.ValidationException;
import com.agri.hub.BroadcastHub;
import com.agri.model.Command;
import com.agri.model.CommandStatus;
import com.agri.model.CommandType;
import com.agri.model.Rover;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Жизненный цикл команд роверам: приём, захват диспетчером и имитация выполнения.
 * <p>
 * Переходы: pending → in_progress → completed | failed. Захват команды — условное обновление
 * в хранилище, поэтому при любом числе параллельных проходов диспетчера команду берёт ровно один.
 * Задержка выполнения реализована отложенной задачей планировщика, поток при этом не спит.
 */
public class RoverCommandEngine implements AutoCloseable {

  public static final String NEW_COMMAND_EVENT = "new_command";
  public static final String COMMAND_COMPLETED_EVENT = "command_completed";

  private static final Logger logger = LoggerFactory.getLogger(RoverCommandEngine.class);

  private static final String[] FAILURE_REASONS = {
      "obstacle detected on route",
      "battery level too low",
      "actuator jammed",
      "lost GPS fix",
  };

  private final PersistenceGateway gateway;
  private final BroadcastHub hub;
  private final SimulationSettings settings;
  private final Clock clock;
  private final Random random;
  private final ScheduledExecutorService scheduler;
  private final Map<String, Rover> roversByType;
  private final AtomicInteger inFlight = new AtomicInteger();

  private volatile boolean running;

  public RoverCommandEngine(PersistenceGateway gateway, BroadcastHub hub, SimulationSettings settings,
                            Clock clock, Random random) {
    this(gateway, hub, settings, clock, random,
        Executors.newScheduledThreadPool(settings.getDispatcherWorkers(), dispatcherThreads()));
  }

  RoverCommandEngine(PersistenceGateway gateway, BroadcastHub hub, SimulationSettings settings,
                     Clock clock, Random random, ScheduledExecutorService scheduler) {
    this.gateway = gateway;
    this.hub = hub;
    this.settings = settings;
    this.clock = clock;
    this.random = random;
    this.scheduler = scheduler;
    this.roversByType = new HashMap<>();
    for (Rover rover : gateway.listRovers()) {
      roversByType.putIfAbsent(rover.getType(), rover);
    }
  }

  /**
   * Принимает новую команду: проверяет, сохраняет в статусе pending, публикует "new_command".
   * Не ждёт выполнения.
   *
   * @throws ValidationException неизвестный тип, пустая зона или неверные параметры; ничего не сохраняется.
   */
  public Command submit(String commandType, String zone, Map<String, Object> parameters) {
    CommandType type = CommandType.parse(commandType)
        .orElseThrow(() -> new ValidationException("Unknown command_type '" + commandType
            + "', expected one of " + knownTypes()));
    if (zone == null || zone.trim().isEmpty()) {
      throw new ValidationException("zone is required");
    }
    Map<String, Object> params = parameters == null ? Map.of() : parameters;
    validateParameters(params);

    Command command = Command.pending(type, zone.trim(), params, now());
    gateway.insertCommand(command);
    hub.publish(NEW_COMMAND_EVENT, command);
    logger.info("📥 Команда {} принята: {} в {}", command.getId(), type.wireName(), command.getZone());
    return command;
  }

  private static void validateParameters(Map<String, Object> params) {
    if (!params.containsKey("duration")) {
      return;
    }
    Object duration = params.get("duration");
    if (!(duration instanceof Number)) {
      throw new ValidationException("parameters.duration must be a number");
    }
    double value = ((Number) duration).doubleValue();
    if (!Double.isFinite(value)) {
      throw new ValidationException("parameters.duration must be a finite number");
    }
    if (value < 0) {
      throw new ValidationException("parameters.duration must not be negative");
    }
  }

  private static String knownTypes() {
    return Arrays.stream(CommandType.values()).map(CommandType::wireName).collect(Collectors.joining(", "));
  }

  /**
   * Один проход диспетчера: захватывает каждую pending-команду и планирует её завершение.
   * Безопасен при параллельном вызове.
   *
   * @return Сколько команд захвачено этим проходом.
   * @throws StorageException если не удалось прочитать список команд.
   */
  public int dispatchPass() {
    int claimed = 0;
    for (Command command : gateway.listCommandsByStatus(CommandStatus.PENDING)) {
      if (claim(command)) {
        claimed++;
      }
    }
    return claimed;
  }

  private boolean claim(Command command) {
    boolean claimed;
    try {
      claimed = gateway.updateCommandStatus(command.getId(), CommandStatus.IN_PROGRESS, null, null);
    } catch (NotFoundException e) {
      logger.warn("⚠️ Команда {} исчезла до захвата", command.getId());
      return false;
    } catch (StorageException e) {
      logger.error("❌ Не удалось захватить команду {}, повтор на следующем проходе", command.getId());
      return false;
    }
    if (!claimed) {
      logger.debug("Команда {} уже захвачена другим проходом", command.getId());
      return false;
    }
    Duration delay = executionDelay(command);
    logger.info("🤖 Выполнение {}: {} в {}, ожидаемое время {} мс",
        command.getId(), command.getCommandType().wireName(), command.getZone(), delay.toMillis());
    scheduleCompletion(command, delay);
    return true;
  }

  /**
   * Задержка пропорциональна parameters.duration: base + duration × perUnit, но не больше max.
   */
  Duration executionDelay(Command command) {
    Object duration = command.getParameters().get("duration");
    double units = duration instanceof Number ? ((Number) duration).doubleValue() : 0;
    if (Double.isNaN(units) || units < 0) {
      units = 0;
    }
    long base = settings.getExecutionBase().toMillis();
    long max = settings.getExecutionMax().toMillis();
    // считаем в double, чтобы огромный duration не переполнил long
    double millis = base + units * settings.getExecutionPerUnit().toMillis();
    return Duration.ofMillis(millis >= max ? max : Math.round(millis));
  }

  private void scheduleCompletion(Command command, Duration delay) {
    inFlight.incrementAndGet();
    try {
      scheduler.schedule(() -> {
        inFlight.decrementAndGet();
        complete(command);
      }, delay.toMillis(), TimeUnit.MILLISECONDS);
    } catch (RejectedExecutionException e) {
      inFlight.decrementAndGet();
      logger.warn("Диспетчер остановлен, команда {} будет завершена после перезапуска", command.getId());
    }
  }

  /**
   * Завершает выполнение: определяет исход и переводит команду в терминальный статус.
   * "command_completed" публикуется только если переход действительно произошёл.
   */
  void complete(Command command) {
    boolean failed = random.nextDouble() < settings.getFailureProbability();
    CommandStatus outcome = failed ? CommandStatus.FAILED : CommandStatus.COMPLETED;
    String result = describe(command, failed);
    Instant completedAt = now();
    try {
      boolean changed = gateway.updateCommandStatus(command.getId(), outcome, result, completedAt);
      if (!changed) {
        logger.warn("⚠️ Команда {} уже в терминальном статусе, завершение пропущено", command.getId());
        return;
      }
      Map<String, Object> payload = new LinkedHashMap<>();
      payload.put("command_id", command.getId());
      payload.put("status", outcome.wireName());
      payload.put("result", result);
      payload.put("timestamp", completedAt);
      hub.publish(COMMAND_COMPLETED_EVENT, payload);
      logger.info("✅ Команда {} завершена: {}", command.getId(), outcome.wireName());
    } catch (NotFoundException e) {
      logger.warn("⚠️ Команда {} исчезла до завершения", command.getId());
    } catch (StorageException e) {
      logger.error("❌ Не удалось завершить команду {}, повтор через {} мс",
          command.getId(), settings.getDispatchPollInterval().toMillis());
      scheduleCompletion(command, settings.getDispatchPollInterval());
    }
  }

  private String describe(Command command, boolean failed) {
    String roverName = rover(command.getCommandType());
    String type = command.getCommandType().wireName();
    if (failed) {
      String reason = FAILURE_REASONS[random.nextInt(FAILURE_REASONS.length)];
      return String.format("%s failed to execute %s in %s: %s", roverName, type, command.getZone(), reason);
    }
    Object duration = command.getParameters().get("duration");
    String details = duration == null ? "" : " (duration " + duration + ")";
    return String.format("Successfully executed %s in %s by %s%s", type, command.getZone(), roverName, details);
  }

  private String rover(CommandType type) {
    Rover rover = roversByType.get(type.roverType());
    return rover == null ? "Rover" : rover.getName();
  }

  /**
   * Запускает диспетчер: заново планирует завершение команд, оставшихся in_progress
   * после прошлого запуска, и {@code dispatcher.workers} периодических проходов.
   */
  public synchronized void start() {
    if (running) {
      return;
    }
    running = true;
    recoverInFlight();
    long poll = settings.getDispatchPollInterval().toMillis();
    int workers = settings.getDispatcherWorkers();
    for (int i = 0; i < workers; i++) {
      long initialDelay = poll * (i + 1) / workers;
      scheduler.scheduleWithFixedDelay(this::scheduledPass, initialDelay, poll, TimeUnit.MILLISECONDS);
    }
    logger.info("🚜 Диспетчер команд запущен: {} обработчиков, опрос каждые {} мс", workers, poll);
  }

  private void recoverInFlight() {
    try {
      List<Command> orphaned = gateway.listCommandsByStatus(CommandStatus.IN_PROGRESS);
      for (Command command : orphaned) {
        scheduleCompletion(command, executionDelay(command));
      }
      if (!orphaned.isEmpty()) {
        logger.info("Восстановлено выполнение {} команд после перезапуска", orphaned.size());
      }
    } catch (StorageException e) {
      logger.error("❌ Не удалось восстановить команды in_progress", e);
    }
  }

  private void scheduledPass() {
    try {
      int claimed = dispatchPass();
      if (claimed > 0) {
        logger.debug("Проход диспетчера захватил {} команд", claimed);
      }
    } catch (RuntimeException e) {
      // исключение из задачи отменило бы все последующие проходы
      logger.error("❌ Проход диспетчера пропущен", e);
    }
  }

  public boolean isRunning() {
    return running && !scheduler.isShutdown();
  }

  /** Команды, у которых запланировано завершение. */
  public int inFlightCount() {
    return inFlight.get();
  }

  public void stop() {
    running = false;
    List<Runnable> abandoned = scheduler.shutdownNow();
    try {
      scheduler.awaitTermination(5, TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    logger.info("Диспетчер команд остановлен, незавершённых задач: {}", abandoned.size());
  }

  @Override
  public void close() {
    stop();
  }

  private Instant now() {
    return clock.instant().truncatedTo(ChronoUnit.MILLIS);
  }

  private static ThreadFactory dispatcherThreads() {
    AtomicInteger counter = new AtomicInteger();
    return r -> {
      Thread t = new Thread(r, "rover-dispatcher-" + counter.incrementAndGet());
      t.setDaemon(true);
      return t;
    };
  }
}
