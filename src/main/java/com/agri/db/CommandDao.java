package com.agri.db;

import com.agri.config.JsonMapper;
import com.agri.error.NotFoundException;
import com.agri.error.StorageException;
import com.agri.model.Command;
import com.agri.model.CommandStatus;
import com.agri.model.CommandType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * DAO-класс для операций с таблицей commands.
 * <p>
 * Смена статуса выполняется условным UPDATE с проверкой предыдущего состояния, поэтому
 * хранилище само упорядочивает конкурирующие переходы одной команды.
 */
public class CommandDao {

  private static final Logger logger = LoggerFactory.getLogger(CommandDao.class);

  private static final TypeReference<Map<String, Object>> PARAMS_TYPE = new TypeReference<>() {
  };

  private static final String COLUMNS =
      "command_id, command_type, zone, parameters, status, created_at, completed_at, result";

  private final DataSource dataSource;

  public CommandDao(DataSource dataSource) {
    this.dataSource = dataSource;
  }

  public long insert(Command command) {
    String sql = "INSERT INTO commands (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?)";
    try (Connection conn = dataSource.getConnection();
         PreparedStatement pstmt = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
      pstmt.setString(1, command.getId());
      pstmt.setString(2, command.getCommandType().wireName());
      pstmt.setString(3, command.getZone());
      pstmt.setString(4, writeParameters(command.getParameters()));
      pstmt.setString(5, command.getStatus().wireName());
      pstmt.setTimestamp(6, Timestamp.from(command.getCreatedAt()));
      pstmt.setTimestamp(7, command.getCompletedAt() == null ? null : Timestamp.from(command.getCompletedAt()));
      pstmt.setString(8, command.getResult());
      pstmt.executeUpdate();
      try (ResultSet keys = pstmt.getGeneratedKeys()) {
        if (!keys.next()) {
          throw new SQLException("No generated key returned for command " + command.getId());
        }
        logger.debug("Команда сохранена: id={}, type={}", command.getId(), command.getCommandType().wireName());
        return keys.getLong(1);
      }
    } catch (SQLException e) {
      throw ExceptionTranslator.translate(e, "insert command " + command.getId(), logger);
    }
  }

  /**
   * Условный переход статуса в одной транзакции.
   *
   * @return true, если строка изменена.
   * @throws NotFoundException если команды нет.
   */
  public boolean updateStatus(String commandId, CommandStatus status, String result, Instant completedAt) {
    if (status.isTerminal() && (result == null || completedAt == null)) {
      throw new IllegalArgumentException("Terminal status requires result and completedAt");
    }
    if (!status.isTerminal() && (result != null || completedAt != null)) {
      throw new IllegalArgumentException("Non-terminal status cannot carry result or completedAt");
    }
    String updateSql = "UPDATE commands SET status = ?, result = ?, completed_at = ? "
        + "WHERE command_id = ? AND status = ?";
    String existsSql = "SELECT status FROM commands WHERE command_id = ?";
    String currentStatus;
    try (Connection conn = dataSource.getConnection()) {
      conn.setAutoCommit(false);
      try (PreparedStatement update = conn.prepareStatement(updateSql);
           PreparedStatement exists = conn.prepareStatement(existsSql)) {
        update.setString(1, status.wireName());
        update.setString(2, result);
        update.setTimestamp(3, completedAt == null ? null : Timestamp.from(completedAt));
        update.setString(4, commandId);
        update.setString(5, status.predecessor().wireName());
        if (update.executeUpdate() > 0) {
          conn.commit();
          return true;
        }
        exists.setString(1, commandId);
        try (ResultSet rs = exists.executeQuery()) {
          currentStatus = rs.next() ? rs.getString("status") : null;
        }
        conn.commit();
      } catch (SQLException e) {
        conn.rollback();
        throw e;
      }
    } catch (SQLException e) {
      throw ExceptionTranslator.translate(e, "update command " + commandId + " to " + status.wireName(), logger);
    }
    if (currentStatus == null) {
      throw new NotFoundException("Command not found: " + commandId);
    }
    logger.debug("Переход {} → {} не выполнен: текущий статус {}", commandId, status.wireName(), currentStatus);
    return false;
  }

  public Optional<Command> findById(String commandId) {
    String sql = "SELECT " + COLUMNS + " FROM commands WHERE command_id = ?";
    try (Connection conn = dataSource.getConnection();
         PreparedStatement pstmt = conn.prepareStatement(sql)) {
      pstmt.setString(1, commandId);
      try (ResultSet rs = pstmt.executeQuery()) {
        return rs.next() ? Optional.of(map(rs)) : Optional.empty();
      }
    } catch (SQLException e) {
      throw ExceptionTranslator.translate(e, "find command " + commandId, logger);
    }
  }

  public List<Command> findRecent(int limit) {
    String sql = "SELECT " + COLUMNS + " FROM commands ORDER BY created_at DESC, id DESC LIMIT ?";
    try (Connection conn = dataSource.getConnection();
         PreparedStatement pstmt = conn.prepareStatement(sql)) {
      pstmt.setInt(1, limit);
      return mapAll(pstmt);
    } catch (SQLException e) {
      throw ExceptionTranslator.translate(e, "query command history", logger);
    }
  }

  public List<Command> findByStatus(CommandStatus status) {
    String sql = "SELECT " + COLUMNS + " FROM commands WHERE status = ? ORDER BY created_at ASC, id ASC";
    try (Connection conn = dataSource.getConnection();
         PreparedStatement pstmt = conn.prepareStatement(sql)) {
      pstmt.setString(1, status.wireName());
      return mapAll(pstmt);
    } catch (SQLException e) {
      throw ExceptionTranslator.translate(e, "query " + status.wireName() + " commands", logger);
    }
  }

  public Map<CommandStatus, Long> countByStatus() {
    String sql = "SELECT status, COUNT(*) AS cnt FROM commands GROUP BY status";
    Map<CommandStatus, Long> counts = new EnumMap<>(CommandStatus.class);
    for (CommandStatus s : CommandStatus.values()) {
      counts.put(s, 0L);
    }
    try (Connection conn = dataSource.getConnection();
         Statement stmt = conn.createStatement();
         ResultSet rs = stmt.executeQuery(sql)) {
      while (rs.next()) {
        counts.put(CommandStatus.fromWireName(rs.getString("status")), rs.getLong("cnt"));
      }
      return counts;
    } catch (SQLException e) {
      throw ExceptionTranslator.translate(e, "count commands by status", logger);
    }
  }

  private List<Command> mapAll(PreparedStatement pstmt) throws SQLException {
    List<Command> commands = new ArrayList<>();
    try (ResultSet rs = pstmt.executeQuery()) {
      while (rs.next()) {
        commands.add(map(rs));
      }
    }
    return commands;
  }

  private static Command map(ResultSet rs) throws SQLException {
    String commandId = rs.getString("command_id");
    CommandType type = CommandType.parse(rs.getString("command_type"))
        .orElseThrow(() -> new SQLException("Unknown command_type stored for " + commandId));
    Timestamp completedAt = rs.getTimestamp("completed_at");
    return new Command(
        commandId,
        type,
        rs.getString("zone"),
        readParameters(commandId, rs.getString("parameters")),
        CommandStatus.fromWireName(rs.getString("status")),
        rs.getTimestamp("created_at").toInstant(),
        completedAt == null ? null : completedAt.toInstant(),
        rs.getString("result"));
  }

  private static String writeParameters(Map<String, Object> parameters) {
    try {
      return JsonMapper.get().writeValueAsString(parameters);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Command parameters are not serializable", e);
    }
  }

  private static Map<String, Object> readParameters(String commandId, String json) {
    if (json == null || json.isEmpty()) {
      return Map.of();
    }
    try {
      return JsonMapper.get().readValue(json, PARAMS_TYPE);
    } catch (JsonProcessingException e) {
      throw new StorageException("Corrupt parameters stored for command " + commandId, e);
    }
  }
}
