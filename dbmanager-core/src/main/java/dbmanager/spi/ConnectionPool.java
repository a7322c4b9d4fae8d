package dbmanager.spi;

import dbmanager.pool.PoolStats;

import java.time.Duration;

/**
 * Runtime controls and counters of a handle's connection pool.
 */
public interface ConnectionPool {

  void setMaxOpenConnections(int maxOpenConnections);

  void setMaxIdleConnections(int maxIdleConnections);

  void setMaxConnectionLifetime(Duration maxConnectionLifetime);

  void setMaxConnectionIdleTime(Duration maxConnectionIdleTime);

  /**
   * Snapshot of the pool's live counters, recomputed on each call.
   */
  PoolStats stats();
}
