package com.agri.db;

import com.agri.model.Reading;
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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * DAO-класс для операций с таблицей sensor_readings.
 */
public class ReadingDao {

  private static final Logger logger = LoggerFactory.getLogger(ReadingDao.class);

  private static final String COLUMNS = "id, probe_id, recorded_at, nitrogen, phosphorus, potassium, ph, "
      + "humidity, temperature, soil_moisture, fertility_index";

  private final DataSource dataSource;

  public ReadingDao(DataSource dataSource) {
    this.dataSource = dataSource;
  }

  /**
   * Сохраняет показание в таблицу sensor_readings.
   *
   * @return Идентификатор новой строки.
   */
  public long insert(Reading reading) {
    String sql = "INSERT INTO sensor_readings (probe_id, recorded_at, nitrogen, phosphorus, potassium, ph, "
        + "humidity, temperature, soil_moisture, fertility_index) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
    try (Connection conn = dataSource.getConnection();
         PreparedStatement pstmt = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
      pstmt.setString(1, reading.getProbeId());
      pstmt.setTimestamp(2, Timestamp.from(reading.getTimestamp()));
      pstmt.setDouble(3, reading.getNitrogen());
      pstmt.setDouble(4, reading.getPhosphorus());
      pstmt.setDouble(5, reading.getPotassium());
      pstmt.setDouble(6, reading.getPh());
      pstmt.setDouble(7, reading.getHumidity());
      pstmt.setDouble(8, reading.getTemperature());
      pstmt.setDouble(9, reading.getSoilMoisture());
      pstmt.setDouble(10, reading.getFertilityIndex());
      pstmt.executeUpdate();
      try (ResultSet keys = pstmt.getGeneratedKeys()) {
        if (!keys.next()) {
          throw new SQLException("No generated key returned for sensor reading");
        }
        return keys.getLong(1);
      }
    } catch (SQLException e) {
      throw ExceptionTranslator.translate(e, "insert reading for " + reading.getProbeId(), logger);
    }
  }

  public Map<String, Reading> findLatestPerProbe() {
    String sql = "SELECT " + prefixed("r") + " FROM sensor_readings r "
        + "JOIN (SELECT probe_id, MAX(recorded_at) AS max_ts FROM sensor_readings GROUP BY probe_id) m "
        + "ON r.probe_id = m.probe_id AND r.recorded_at = m.max_ts "
        + "ORDER BY r.probe_id, r.id";
    Map<String, Reading> latest = new LinkedHashMap<>();
    try (Connection conn = dataSource.getConnection();
         Statement stmt = conn.createStatement();
         ResultSet rs = stmt.executeQuery(sql)) {
      while (rs.next()) {
        Reading reading = map(rs);
        // при совпадении времени берём последнюю вставленную строку
        latest.put(reading.getProbeId(), reading);
      }
      return latest;
    } catch (SQLException e) {
      throw ExceptionTranslator.translate(e, "query latest readings", logger);
    }
  }

  public List<Reading> findByProbeSince(String probeId, Instant since) {
    String sql = "SELECT " + COLUMNS + " FROM sensor_readings WHERE probe_id = ? AND recorded_at > ? "
        + "ORDER BY recorded_at ASC, id ASC";
    try (Connection conn = dataSource.getConnection();
         PreparedStatement pstmt = conn.prepareStatement(sql)) {
      pstmt.setString(1, probeId);
      pstmt.setTimestamp(2, Timestamp.from(since));
      List<Reading> history = new ArrayList<>();
      try (ResultSet rs = pstmt.executeQuery()) {
        while (rs.next()) {
          history.add(map(rs));
        }
      }
      return history;
    } catch (SQLException e) {
      throw ExceptionTranslator.translate(e, "query history for " + probeId, logger);
    }
  }

  private static String prefixed(String alias) {
    return alias + "." + COLUMNS.replace(", ", ", " + alias + ".");
  }

  private static Reading map(ResultSet rs) throws SQLException {
    return Reading.builder()
        .id(rs.getLong("id"))
        .probeId(rs.getString("probe_id"))
        .timestamp(rs.getTimestamp("recorded_at").toInstant())
        .nitrogen(rs.getDouble("nitrogen"))
        .phosphorus(rs.getDouble("phosphorus"))
        .potassium(rs.getDouble("potassium"))
        .ph(rs.getDouble("ph"))
        .humidity(rs.getDouble("humidity"))
        .temperature(rs.getDouble("temperature"))
        .soilMoisture(rs.getDouble("soil_moisture"))
        .fertilityIndex(rs.getDouble("fertility_index"))
        .build();
  }
}
