package dbmanager.jdbc.pool;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import dbmanager.ConnectionException;
import dbmanager.config.DataSourceConfig;
import dbmanager.jdbc.engine.Engines;
import dbmanager.jdbc.engine.JdbcTarget;
import dbmanager.jdbc.spi.Engine;
import dbmanager.spi.DataSourceDriver;
import dbmanager.spi.DataSourceHandle;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Opens data sources as HikariCP pools.
 *
 * <p>The engine type selects the DSN translation (see {@link Engines}); the JDBC driver is
 * resolved by {@link java.sql.DriverManager}. Opening performs one connection attempt, so an
 * unreachable database fails here rather than on first use.
 */
public final class HikariDataSourceDriver implements DataSourceDriver {
  private final Consumer<HikariConfig> customizer;

  public HikariDataSourceDriver() {
    this(config -> {
    });
  }

  /**
   * @param customizer applied to each pool's configuration before the pool starts, e.g. to set
   *                   {@code connectionTimeout}
   */
  public HikariDataSourceDriver(Consumer<HikariConfig> customizer) {
    this.customizer = Objects.requireNonNull(customizer, "customizer");
  }

  @Override
  public DataSourceHandle open(String name, DataSourceConfig config) {
    JdbcTarget target;
    try {
      Engine engine = Engines.get(config.type());
      target = engine.translate(config.dsn());
    } catch (IllegalArgumentException e) {
      throw new ConnectionException("failed to connect to " + name + " database: " + e.getMessage(), e);
    }

    TrackingDataSource physical = new TrackingDataSource(target);
    WaitTracker waits = new WaitTracker();

    HikariConfig hikari = new HikariConfig();
    hikari.setPoolName("dbmanager-" + name);
    hikari.setDataSource(physical);
    hikari.setMetricsTrackerFactory((poolName, poolStats) -> waits);
    customizer.accept(hikari);

    HikariDataSource dataSource;
    try {
      dataSource = new HikariDataSource(hikari);
    } catch (RuntimeException e) {
      throw new ConnectionException("failed to connect to " + name + " database", e);
    }
    physical.bind(dataSource.getHikariConfigMXBean());
    return new HikariDataSourceHandle(name, dataSource, physical, waits);
  }
}
