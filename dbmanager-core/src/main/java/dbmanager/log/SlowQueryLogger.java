package dbmanager.log;

import dbmanager.config.SlowQueryConfig;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Slow statement detector wrapping a base {@link DbLogger}.
 *
 * <p>Driven only by {@link SlowQueryConfig}: every traced statement whose elapsed time reaches
 * the threshold is written to the {@code dbmanager.slow} logger and forwarded to the base logger
 * as a warning. Faster statements are ignored. {@code info}, {@code warn} and {@code error}
 * delegate to the base logger unchanged.
 */
public final class SlowQueryLogger implements DbLogger {
  /** Name of the {@code java.util.logging} logger slow-statement records are written to. */
  public static final String LOGGER_NAME = "dbmanager.slow";

  private final SlowQueryConfig config;
  private final DbLogger base;
  private final Logger sink;

  public SlowQueryLogger(SlowQueryConfig config, DbLogger base) {
    this.config = Objects.requireNonNull(config, "config");
    this.base = Objects.requireNonNull(base, "base");
    this.sink = Logger.getLogger(LOGGER_NAME);
  }

  /**
   * Returns {@code true} if a statement that ran for {@code elapsed} counts as slow.
   */
  public boolean isSlow(Duration elapsed) {
    return config.enabled() && elapsed.compareTo(config.threshold()) >= 0;
  }

  /** The level belongs to the base logger; this logger is configured by its threshold only. */
  @Override
  public DbLogger setLevel(LogLevel level) {
    return this;
  }

  @Override
  public void info(String message, Object... data) {
    base.info(message, data);
  }

  @Override
  public void warn(String message, Object... data) {
    base.warn(message, data);
  }

  @Override
  public void error(String message, Object... data) {
    base.error(message, data);
  }

  @Override
  public void trace(Instant begin, Supplier<TraceResult> result, Throwable error) {
    if (!config.enabled()) {
      return;
    }
    Duration elapsed = Duration.between(begin, Instant.now());
    if (!isSlow(elapsed)) {
      return;
    }
    TraceResult r = result.get();
    String sql = r.render(config.logParams());
    String elapsedMs = String.format(Locale.ROOT, "%.3fms", elapsed.toNanos() / 1_000_000.0);

    StringBuilder record = new StringBuilder("slow statement: elapsed=")
        .append(elapsedMs)
        .append(" rows=").append(r.rowsAffected())
        .append(" sql=").append(sql);
    if (error != null) {
      record.append(" error=").append(error.getMessage());
    }
    sink.log(Level.WARNING, record.toString());

    base.warn("slow statement detected", "elapsed", elapsedMs, "sql", sql, "rows", r.rowsAffected());
  }
}
