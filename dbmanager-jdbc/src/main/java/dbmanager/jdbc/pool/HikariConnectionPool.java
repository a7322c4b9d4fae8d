package dbmanager.jdbc.pool;

import com.zaxxer.hikari.HikariConfigMXBean;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariPoolMXBean;
import dbmanager.pool.PoolStats;
import dbmanager.spi.ConnectionPool;

import java.time.Duration;

/**
 * {@link ConnectionPool} over a running HikariCP pool. Shape changes go through
 * {@link HikariConfigMXBean}, which accepts them while the pool is running.
 */
public final class HikariConnectionPool implements ConnectionPool {
  private final HikariDataSource dataSource;
  private final WaitTracker waits;
  private final TrackingDataSource closes;

  HikariConnectionPool(HikariDataSource dataSource, WaitTracker waits, TrackingDataSource closes) {
    this.dataSource = dataSource;
    this.waits = waits;
    this.closes = closes;
  }

  @Override
  public void setMaxOpenConnections(int maxOpen) {
    HikariConfigMXBean config = dataSource.getHikariConfigMXBean();
    config.setMaximumPoolSize(maxOpen);
    if (config.getMinimumIdle() > maxOpen) {
      config.setMinimumIdle(maxOpen);
    }
    // connections opened before the limit was lowered are retired and refilled up to it
    HikariPoolMXBean pool = dataSource.getHikariPoolMXBean();
    if (pool != null && pool.getTotalConnections() > maxOpen) {
      pool.softEvictConnections();
    }
  }

  @Override
  public void setMaxIdleConnections(int maxIdle) {
    HikariConfigMXBean config = dataSource.getHikariConfigMXBean();
    config.setMinimumIdle(Math.min(maxIdle, config.getMaximumPoolSize()));
  }

  @Override
  public void setMaxConnectionLifetime(Duration lifetime) {
    dataSource.getHikariConfigMXBean().setMaxLifetime(lifetime.toMillis());
  }

  @Override
  public void setMaxConnectionIdleTime(Duration idleTime) {
    dataSource.getHikariConfigMXBean().setIdleTimeout(idleTime.toMillis());
  }

  @Override
  public PoolStats stats() {
    HikariPoolMXBean pool = dataSource.getHikariPoolMXBean();
    if (pool == null || dataSource.isClosed()) {
      return PoolStats.EMPTY;
    }
    return new PoolStats(
        pool.getTotalConnections(),
        pool.getActiveConnections(),
        pool.getIdleConnections(),
        waits.waitCount(),
        waits.waitDuration(),
        closes.idleCountClosed(),
        closes.idleTimeClosed(),
        closes.lifetimeClosed());
  }

  /** Maximum pool size currently in effect. */
  public int maximumPoolSize() {
    return dataSource.getHikariConfigMXBean().getMaximumPoolSize();
  }

  /** Minimum idle connections currently in effect. */
  public int minimumIdle() {
    return dataSource.getHikariConfigMXBean().getMinimumIdle();
  }

  public Duration maxLifetime() {
    return Duration.ofMillis(dataSource.getHikariConfigMXBean().getMaxLifetime());
  }

  public Duration idleTimeout() {
    return Duration.ofMillis(dataSource.getHikariConfigMXBean().getIdleTimeout());
  }
}
