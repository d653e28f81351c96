package com.agri.db;

import com.agri.model.Command;
import com.agri.model.CommandStatus;
import com.agri.model.Reading;
import com.agri.model.Rover;

import javax.sql.DataSource;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Реализация {@link PersistenceGateway} поверх JDBC-пула.
 * Транзакционность и блокировки обеспечивает сама СУБД.
 */
public class JdbcPersistenceGateway implements PersistenceGateway {

  private final ReadingDao readingDao;
  private final CommandDao commandDao;
  private final RoverDao roverDao;
  private final Clock clock;

  public JdbcPersistenceGateway(DataSource dataSource, Clock clock) {
    this(new ReadingDao(dataSource), new CommandDao(dataSource), new RoverDao(dataSource), clock);
  }

  JdbcPersistenceGateway(ReadingDao readingDao, CommandDao commandDao, RoverDao roverDao, Clock clock) {
    this.readingDao = readingDao;
    this.commandDao = commandDao;
    this.roverDao = roverDao;
    this.clock = clock;
  }

  @Override
  public long insertReading(Reading reading) {
    return readingDao.insert(Objects.requireNonNull(reading, "reading"));
  }

  @Override
  public Map<String, Reading> queryLatestPerProbe() {
    return readingDao.findLatestPerProbe();
  }

  @Override
  public List<Reading> queryHistory(String probeId, Duration since) {
    return readingDao.findByProbeSince(probeId, clock.instant().minus(since));
  }

  @Override
  public long insertCommand(Command command) {
    return commandDao.insert(Objects.requireNonNull(command, "command"));
  }

  @Override
  public boolean updateCommandStatus(String commandId, CommandStatus status, String result, Instant completedAt) {
    return commandDao.updateStatus(commandId, status, result, completedAt);
  }

  @Override
  public Optional<Command> findCommand(String commandId) {
    return commandDao.findById(commandId);
  }

  @Override
  public List<Command> queryCommandHistory(int limit) {
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be positive: " + limit);
    }
    return commandDao.findRecent(limit);
  }

  @Override
  public List<Command> listCommandsByStatus(CommandStatus status) {
    return commandDao.findByStatus(status);
  }

  @Override
  public Map<CommandStatus, Long> countCommandsByStatus() {
    return commandDao.countByStatus();
  }

  @Override
  public List<Rover> listRovers() {
    return roverDao.findAll();
  }
}
