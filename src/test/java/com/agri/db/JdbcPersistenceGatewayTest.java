package com.agri.db;

import com.agri.error.StorageException;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.time.Clock;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Проверки шлюза на H2 в режиме совместимости с PostgreSQL.
 */
class JdbcPersistenceGatewayTest extends AbstractPersistenceGatewayTest {

  private static HikariDataSource dataSource;

  @BeforeAll
  static void startDatabase() {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl("jdbc:h2:mem:gateway-test;DB_CLOSE_DELAY=-1;MODE=PostgreSQL");
    config.setUsername("sa");
    config.setPassword("");
    config.setMaximumPoolSize(4);
    dataSource = new HikariDataSource(config);
  }

  @AfterAll
  static void stopDatabase() {
    dataSource.close();
  }

  @Override
  DataSource dataSource() {
    return dataSource;
  }

  @Test
  @DisplayName("Ошибка JDBC → StorageException")
  void shouldTranslateSqlException() throws Exception {
    DataSource broken = mock(DataSource.class);
    when(broken.getConnection()).thenThrow(new SQLException("connection refused"));
    PersistenceGateway brokenGateway = new JdbcPersistenceGateway(broken, Clock.systemUTC());

    assertThatThrownBy(brokenGateway::queryLatestPerProbe)
        .isInstanceOf(StorageException.class)
        .hasCauseInstanceOf(SQLException.class);
    assertThatThrownBy(() -> brokenGateway.insertReading(reading("Probe_1", NOW, 1)))
        .isInstanceOf(StorageException.class);
  }

  @Test
  @DisplayName("Неположительный лимит истории команд отклоняется")
  void shouldRejectNonPositiveLimit() {
    assertThatThrownBy(() -> gateway.queryCommandHistory(0))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
