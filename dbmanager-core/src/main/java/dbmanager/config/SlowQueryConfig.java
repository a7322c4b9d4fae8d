package dbmanager.config;

import java.time.Duration;

/**
 * Slow statement detection.
 *
 * @param enabled   turns the slow-query logger on
 * @param threshold elapsed time at or above which a statement is slow
 * @param logParams inline bound parameter values in slow-statement records
 */
public record SlowQueryConfig(boolean enabled, Duration threshold, boolean logParams) {
  public static final SlowQueryConfig DISABLED = new SlowQueryConfig(false, Duration.ZERO, false);

  public SlowQueryConfig {
    threshold = threshold == null ? Duration.ZERO : threshold;
  }

  public static SlowQueryConfig of(Duration threshold) {
    return new SlowQueryConfig(true, threshold, false);
  }
}
