package com.agri.db;

import com.agri.config.Config;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Класс для создания пула соединений и инициализации таблиц.
 * Использует параметры db.* из application.properties.
 * <p>
 * SQL совместим с PostgreSQL и с H2 в режиме MODE=PostgreSQL.
 */
public final class DatabaseConnection {

  private static final Logger logger = LoggerFactory.getLogger(DatabaseConnection.class);

  private static final String CREATE_READINGS_SQL = """
      CREATE TABLE IF NOT EXISTS sensor_readings (
          id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
          probe_id VARCHAR(100) NOT NULL,
          recorded_at TIMESTAMP NOT NULL,
          nitrogen DOUBLE PRECISION NOT NULL,
          phosphorus DOUBLE PRECISION NOT NULL,
          potassium DOUBLE PRECISION NOT NULL,
          ph DOUBLE PRECISION NOT NULL,
          humidity DOUBLE PRECISION NOT NULL,
          temperature DOUBLE PRECISION NOT NULL,
          soil_moisture DOUBLE PRECISION NOT NULL,
          fertility_index DOUBLE PRECISION NOT NULL
      )
      """;

  private static final String CREATE_READINGS_INDEX_SQL =
      "CREATE INDEX IF NOT EXISTS idx_sensor_readings_probe_time ON sensor_readings (probe_id, recorded_at)";

  private static final String CREATE_COMMANDS_SQL = """
      CREATE TABLE IF NOT EXISTS commands (
          id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
          command_id VARCHAR(64) NOT NULL UNIQUE,
          command_type VARCHAR(50) NOT NULL,
          zone VARCHAR(100) NOT NULL,
          parameters VARCHAR(4000),
          status VARCHAR(20) NOT NULL,
          created_at TIMESTAMP NOT NULL,
          completed_at TIMESTAMP,
          result VARCHAR(1000)
      )
      """;

  private static final String CREATE_ROVERS_SQL = """
      CREATE TABLE IF NOT EXISTS rovers (
          id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
          rover_id VARCHAR(50) NOT NULL UNIQUE,
          name VARCHAR(100) NOT NULL,
          rover_type VARCHAR(50) NOT NULL,
          status VARCHAR(20) NOT NULL,
          current_zone VARCHAR(100),
          battery_level DOUBLE PRECISION NOT NULL
      )
      """;

  private static final Object[][] ROVER_SEED = {
      {"rover_1", "Irrigation Rover", "irrigation", 100.0},
      {"rover_2", "Fertilizer Rover", "fertilizer", 95.0},
  };

  private DatabaseConnection() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Создаёт пул соединений по параметрам db.url, db.user, db.password, db.pool.size.
   *
   * @return Пул соединений HikariCP.
   * @throws IllegalStateException если обязательный параметр не задан.
   */
  public static HikariDataSource createDataSource() {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl(Config.getRequiredProperty("db.url"));
    config.setUsername(Config.getRequiredProperty("db.user"));
    config.setPassword(Config.getProperty("db.password", ""));
    config.setMaximumPoolSize(Config.getInt("db.pool.size", 10));
    config.setPoolName("agri-db");
    HikariDataSource dataSource = new HikariDataSource(config);
    logger.info("✅ Пул соединений с БД создан: {}", config.getJdbcUrl());
    return dataSource;
  }

  /**
   * Инициализирует базу данных: создаёт таблицы sensor_readings, commands, rovers,
   * если они отсутствуют, и заполняет реестр роверов.
   * Вызывается при старте приложения.
   *
   * @throws com.agri.error.StorageException если не удалось создать таблицы.
   */
  public static void initializeDatabase(DataSource dataSource) {
    try (Connection conn = dataSource.getConnection();
         Statement stmt = conn.createStatement()) {
      stmt.execute(CREATE_READINGS_SQL);
      stmt.execute(CREATE_READINGS_INDEX_SQL);
      stmt.execute(CREATE_COMMANDS_SQL);
      stmt.execute(CREATE_ROVERS_SQL);
      seedRovers(conn);
      logger.info("✅ Таблицы 'sensor_readings', 'commands', 'rovers' созданы или уже существуют.");
    } catch (SQLException e) {
      throw ExceptionTranslator.translate(e, "initialize database schema", logger);
    }
  }

  private static void seedRovers(Connection conn) throws SQLException {
    String existsSql = "SELECT COUNT(*) FROM rovers WHERE rover_id = ?";
    String insertSql = "INSERT INTO rovers (rover_id, name, rover_type, status, current_zone, battery_level) "
        + "VALUES (?, ?, ?, 'idle', NULL, ?)";
    try (PreparedStatement exists = conn.prepareStatement(existsSql);
         PreparedStatement insert = conn.prepareStatement(insertSql)) {
      for (Object[] rover : ROVER_SEED) {
        exists.setString(1, (String) rover[0]);
        try (ResultSet rs = exists.executeQuery()) {
          if (rs.next() && rs.getLong(1) > 0) {
            continue;
          }
        }
        insert.setString(1, (String) rover[0]);
        insert.setString(2, (String) rover[1]);
        insert.setString(3, (String) rover[2]);
        insert.setDouble(4, (Double) rover[3]);
        insert.executeUpdate();
        logger.info("Ровер {} добавлен в реестр", rover[0]);
      }
    }
  }
}
