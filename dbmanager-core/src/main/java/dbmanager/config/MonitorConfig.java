package dbmanager.config;

import java.time.Duration;

/**
 * Background health monitoring.
 *
 * <p>{@code maxRetries} is validated and exposed for callers and drivers that implement their own
 * retry; the monitor itself never retries a failed probe.
 *
 * @param enabled             start the background monitor at construction
 * @param healthCheckInterval period between two probe passes
 * @param connectionTimeout   deadline of a single probe
 * @param maxRetries          retry budget advertised to callers, must be &ge; 0
 */
public record MonitorConfig(
    boolean enabled,
    Duration healthCheckInterval,
    Duration connectionTimeout,
    int maxRetries
) {
  /** Monitoring off; explicit probes use a 5 second deadline. */
  public static final MonitorConfig DISABLED =
      new MonitorConfig(false, Duration.ZERO, Duration.ofSeconds(5), 0);

  public MonitorConfig {
    healthCheckInterval = healthCheckInterval == null ? Duration.ZERO : healthCheckInterval;
    connectionTimeout = connectionTimeout == null ? Duration.ZERO : connectionTimeout;
  }

  public static MonitorConfig every(Duration healthCheckInterval, Duration connectionTimeout) {
    return new MonitorConfig(true, healthCheckInterval, connectionTimeout, 0);
  }
}
