package com.agri.service;

import com.agri.config.Config;
import com.agri.db.PersistenceGateway;
import com.agri.error.NotFoundException;
import com.agri.error.ValidationException;
import com.agri.model.Command;
import com.agri.model.CommandStatus;
import com.agri.model.Reading;
import com.agri.model.Rover;
import com.agri.model.RoverStatus;
import com.agri.model.SystemStatus;
import com.agri.server.CommandRequest;
import com.agri.simulation.RoverCommandEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Реализация фасада запросов и команд.
 */
public class AgricultureServiceImpl implements AgricultureService {

  private static final Logger logger = LoggerFactory.getLogger(AgricultureServiceImpl.class);

  private final PersistenceGateway gateway;
  private final RoverCommandEngine commandEngine;
  private final Set<String> knownProbes;
  private final Clock clock;
  private final Instant startedAt;
  private final String version;

  /**
   * Конструктор сервиса.
   *
   * @param gateway Доступ к хранилищу.
   * @param commandEngine Движок команд, принимающий новые команды.
   * @param knownProbes Сконфигурированные датчики; неизвестный датчик даёт 404.
   * @param clock Часы для окна истории и времени работы.
   */
  public AgricultureServiceImpl(PersistenceGateway gateway, RoverCommandEngine commandEngine,
                                List<String> knownProbes, Clock clock) {
    this.gateway = gateway;
    this.commandEngine = commandEngine;
    this.knownProbes = Set.copyOf(knownProbes);
    this.clock = clock;
    this.startedAt = clock.instant();
    this.version = Config.getProperty("app.version", "1.0.0");
  }

  @Override
  public Map<String, Reading> latestReadings() {
    return gateway.queryLatestPerProbe();
  }

  @Override
  public List<Reading> history(String probeId, int hours) {
    if (!knownProbes.contains(probeId)) {
      throw new NotFoundException("Unknown probe: " + probeId);
    }
    if (hours <= 0) {
      throw new ValidationException("hours must be positive");
    }
    return gateway.queryHistory(probeId, Duration.ofHours(hours));
  }

  @Override
  public Command submitCommand(CommandRequest request) {
    if (request == null) {
      throw new ValidationException("Command body is required");
    }
    return commandEngine.submit(request.getCommandType(), request.getZone(), request.getParameters());
  }

  @Override
  public List<Command> commandHistory() {
    return commandHistory(DEFAULT_COMMAND_HISTORY_LIMIT);
  }

  @Override
  public List<Command> commandHistory(int limit) {
    if (limit <= 0) {
      throw new ValidationException("limit must be positive");
    }
    return gateway.queryCommandHistory(limit);
  }

  @Override
  public SystemStatus status() {
    Map<String, Reading> latest = gateway.queryLatestPerProbe();
    Instant lastUpdate = latest.values().stream()
        .map(Reading::getTimestamp)
        .max(Instant::compareTo)
        .orElse(null);

    List<Rover> rovers = gateway.listRovers();
    Map<String, Long> roversByStatus = new LinkedHashMap<>();
    for (RoverStatus s : RoverStatus.values()) {
      roversByStatus.put(s.wireName(), 0L);
    }
    for (Rover rover : rovers) {
      roversByStatus.merge(rover.getStatus().wireName(), 1L, Long::sum);
    }

    Map<String, Long> commandsByStatus = new LinkedHashMap<>();
    long totalCommands = 0;
    for (Map.Entry<CommandStatus, Long> e : gateway.countCommandsByStatus().entrySet()) {
      commandsByStatus.put(e.getKey().wireName(), e.getValue());
      totalCommands += e.getValue();
    }

    logger.debug("Статус: {} датчиков с данными, {} команд", latest.size(), totalCommands);
    return new SystemStatus(
        new SystemStatus.Probes(knownProbes.size(), latest.size(), lastUpdate),
        new SystemStatus.Counts(rovers.size(), roversByStatus),
        new SystemStatus.Counts(totalCommands, commandsByStatus),
        new SystemStatus.Service("operational", version,
            Duration.between(startedAt, clock.instant()).getSeconds()));
  }

  @Override
  public Map<String, Object> health() {
    Map<String, Object> health = new LinkedHashMap<>();
    health.put("status", "healthy");
    health.put("timestamp", clock.instant());
    health.put("version", version);
    return health;
  }
}
