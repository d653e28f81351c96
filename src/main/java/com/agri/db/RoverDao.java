package com.agri.db;

import com.agri.model.Rover;
import com.agri.model.RoverStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * DAO-класс для чтения реестра роверов.
 */
public class RoverDao {

  private static final Logger logger = LoggerFactory.getLogger(RoverDao.class);

  private final DataSource dataSource;

  public RoverDao(DataSource dataSource) {
    this.dataSource = dataSource;
  }

  public List<Rover> findAll() {
    String sql = "SELECT rover_id, name, rover_type, status, current_zone, battery_level FROM rovers ORDER BY rover_id";
    List<Rover> rovers = new ArrayList<>();
    try (Connection conn = dataSource.getConnection();
         Statement stmt = conn.createStatement();
         ResultSet rs = stmt.executeQuery(sql)) {
      while (rs.next()) {
        rovers.add(new Rover(
            rs.getString("rover_id"),
            rs.getString("name"),
            rs.getString("rover_type"),
            RoverStatus.fromWireName(rs.getString("status")),
            rs.getString("current_zone"),
            rs.getDouble("battery_level")));
      }
      return rovers;
    } catch (SQLException e) {
      throw ExceptionTranslator.translate(e, "list rovers", logger);
    }
  }
}
