package dbmanager.config;

import dbmanager.ConfigException;

import java.time.Duration;
import java.util.List;

/**
 * Rejects malformed configurations before any resource is allocated. Pure function of its
 * input.
 */
public final class ConfigValidator {

  private ConfigValidator() {
  }

  /**
   * Validates the configuration.
   *
   * @param config configuration to check, may be {@code null}
   * @throws ConfigException describing the first violated rule
   */
  public static void validate(DbManagerConfig config) {
    if (config == null) {
      throw new ConfigException("config cannot be null");
    }
    DataSourceConfig primary = config.primary();
    if (primary == null || isEmpty(primary.dsn())) {
      throw new ConfigException("primary database DSN cannot be empty");
    }
    if (isEmpty(primary.type())) {
      throw new ConfigException("database type cannot be empty");
    }

    validatePool("pool", config.pool());

    List<ReplicaConfig> replicas = config.replicas();
    for (int i = 0; i < replicas.size(); i++) {
      ReplicaConfig replica = replicas.get(i);
      String name = "replica_" + i;
      if (replica == null) {
        throw new ConfigException(name + " cannot be null");
      }
      if (isEmpty(replica.dsn())) {
        throw new ConfigException(name + " DSN cannot be empty");
      }
      if (replica.weight() < 0) {
        throw new ConfigException(name + " weight cannot be negative");
      }
      validatePool(name + " pool", replica.pool());
    }

    SlowQueryConfig slowQuery = config.slowQuery();
    if (slowQuery.enabled() && !isPositive(slowQuery.threshold())) {
      throw new ConfigException("slow query threshold must be positive when enabled");
    }

    MonitorConfig monitor = config.monitor();
    if (monitor.enabled()) {
      if (!isPositive(monitor.healthCheckInterval())) {
        throw new ConfigException("health check interval must be positive when monitoring is enabled");
      }
      if (!isPositive(monitor.connectionTimeout())) {
        throw new ConfigException("connection timeout must be positive when monitoring is enabled");
      }
      if (monitor.maxRetries() < 0) {
        throw new ConfigException("max retries cannot be negative");
      }
    }
  }

  private static void validatePool(String name, PoolConfig pool) {
    if (pool.maxOpenConnections() < 0) {
      throw new ConfigException(name + ": max open connections cannot be negative");
    }
    if (pool.maxIdleConnections() < 0) {
      throw new ConfigException(name + ": max idle connections cannot be negative");
    }
    if (pool.maxOpenConnections() > 0 && pool.maxIdleConnections() > pool.maxOpenConnections()) {
      throw new ConfigException(name + ": max idle connections cannot be greater than max open connections");
    }
    if (pool.maxConnectionLifetime().isNegative()) {
      throw new ConfigException(name + ": max connection lifetime cannot be negative");
    }
    if (pool.maxConnectionIdleTime().isNegative()) {
      throw new ConfigException(name + ": max connection idle time cannot be negative");
    }
  }

  private static boolean isEmpty(String value) {
    return value == null || value.isEmpty();
  }

  private static boolean isPositive(Duration duration) {
    return !duration.isNegative() && !duration.isZero();
  }
}
