package dbmanager.config;

import java.time.Duration;

/**
 * Pool shape applied to every opened handle. A zero field keeps the pool's own default.
 *
 * @param maxOpenConnections    upper bound of physical connections (idle + in use)
 * @param maxIdleConnections    number of idle connections the pool keeps ready
 * @param maxConnectionLifetime age after which a connection is retired
 * @param maxConnectionIdleTime idle time after which a connection is retired
 */
public record PoolConfig(
    int maxOpenConnections,
    int maxIdleConnections,
    Duration maxConnectionLifetime,
    Duration maxConnectionIdleTime
) {
  /** All fields unset: the pool's own defaults apply. */
  public static final PoolConfig DEFAULT = new PoolConfig(0, 0, Duration.ZERO, Duration.ZERO);

  public PoolConfig {
    maxConnectionLifetime = maxConnectionLifetime == null ? Duration.ZERO : maxConnectionLifetime;
    maxConnectionIdleTime = maxConnectionIdleTime == null ? Duration.ZERO : maxConnectionIdleTime;
  }

  public static PoolConfig of(int maxOpenConnections, int maxIdleConnections) {
    return new PoolConfig(maxOpenConnections, maxIdleConnections, Duration.ZERO, Duration.ZERO);
  }

  /**
   * Returns {@code true} when no field is set.
   */
  public boolean isUnset() {
    return maxOpenConnections == 0
        && maxIdleConnections == 0
        && maxConnectionLifetime.isZero()
        && maxConnectionIdleTime.isZero();
  }
}
