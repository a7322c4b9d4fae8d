package dbmanager.jdbc.pool;

import com.zaxxer.hikari.HikariDataSource;
import dbmanager.spi.ConnectionPool;
import dbmanager.spi.DataSourceHandle;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;

/**
 * {@link DataSourceHandle} owning one HikariCP pool.
 */
public final class HikariDataSourceHandle implements DataSourceHandle {
  private final String name;
  private final HikariDataSource dataSource;
  private final TrackingDataSource physical;
  private final HikariConnectionPool pool;

  HikariDataSourceHandle(String name, HikariDataSource dataSource, TrackingDataSource physical,
                         WaitTracker waits) {
    this.name = name;
    this.dataSource = dataSource;
    this.physical = physical;
    this.pool = new HikariConnectionPool(dataSource, waits, physical);
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public DataSource dataSource() {
    return dataSource;
  }

  @Override
  public void ping(Duration timeout) throws SQLException {
    int seconds = (int) Math.max(1, (timeout.toMillis() + 999) / 1000);
    try (Connection conn = dataSource.getConnection()) {
      if (!conn.isValid(seconds)) {
        throw new SQLException("connection validation failed");
      }
    }
  }

  @Override
  public ConnectionPool pool() {
    return dataSource.isClosed() ? null : pool;
  }

  @Override
  public boolean isClosed() {
    return dataSource.isClosed();
  }

  @Override
  public void close() {
    physical.markShutdown();
    dataSource.close();
  }

  @Override
  public String toString() {
    return "HikariDataSourceHandle{name=" + name + ", pool=" + dataSource.getPoolName() + "}";
  }
}
