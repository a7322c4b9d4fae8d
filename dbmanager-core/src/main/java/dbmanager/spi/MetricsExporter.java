package dbmanager.spi;

import dbmanager.health.HealthStatus;
import dbmanager.pool.PoolStats;

/**
 * Observability hook for exporting manager counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface to
 * bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /**
   * Increments the count of transactions committed successfully.
   */
  void incrementTransactionCommitted();

  /**
   * Increments the count of transactions rolled back because the callback failed.
   */
  void incrementTransactionRolledBack();

  /**
   * Increments the count of statements at or above the slow threshold.
   */
  void incrementSlowStatement();

  /**
   * Records the outcome of one probe.
   *
   * @param dataSource data-source key
   * @param status     probe result
   */
  void recordHealth(String dataSource, HealthStatus status);

  /**
   * Records the pool counters of one data source.
   *
   * @param dataSource data-source key
   * @param stats      current counters
   */
  default void recordPoolStats(String dataSource, PoolStats stats) {
  }

  /**
   * Default no-op implementation that discards all metrics.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void incrementTransactionCommitted() {
    }

    @Override
    public void incrementTransactionRolledBack() {
    }

    @Override
    public void incrementSlowStatement() {
    }

    @Override
    public void recordHealth(String dataSource, HealthStatus status) {
    }
  }
}
