package dbmanager.health;

import java.time.Duration;
import java.time.Instant;

/**
 * Outcome of one liveness probe against a data source.
 *
 * @param healthy       whether the probe succeeded within its deadline
 * @param lastCheckedAt when the probe started
 * @param errorMessage  failure description, {@code null} when healthy
 * @param responseTime  time the probe took
 */
public record HealthStatus(
    boolean healthy,
    Instant lastCheckedAt,
    String errorMessage,
    Duration responseTime
) {

  public static HealthStatus healthy(Instant checkedAt, Duration responseTime) {
    return new HealthStatus(true, checkedAt, null, responseTime);
  }

  public static HealthStatus unhealthy(Instant checkedAt, String errorMessage, Duration responseTime) {
    return new HealthStatus(false, checkedAt, errorMessage, responseTime);
  }
}
