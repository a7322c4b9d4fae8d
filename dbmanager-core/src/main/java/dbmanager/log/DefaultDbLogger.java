package dbmanager.log;

import dbmanager.RecordNotFoundException;
import dbmanager.config.LogConfig;
import dbmanager.config.SlowQueryConfig;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link DbLogger} writing through {@code java.util.logging} to the {@code dbmanager.sql} logger.
 *
 * <p>Statement traces are classified as failed (SEVERE), slow (WARNING) or plain (INFO). The
 * slow threshold is the slow-query threshold when slow detection is enabled, otherwise
 * {@value #DEFAULT_SLOW_THRESHOLD_MS} ms.
 *
 * <p>Instances are immutable; {@link #setLevel} returns a copy.
 */
public final class DefaultDbLogger implements DbLogger {
  /** Name of the {@code java.util.logging} logger records are written to. */
  public static final String LOGGER_NAME = "dbmanager.sql";
  static final long DEFAULT_SLOW_THRESHOLD_MS = 200;

  private static final String RESET = "\033[0m";
  private static final String RED = "\033[31m";
  private static final String YELLOW = "\033[33m";
  private static final String GREEN = "\033[32m";

  private final Logger sink;
  private final LogLevel level;
  private final Duration slowThreshold;
  private final boolean colorful;
  private final boolean ignoreRecordNotFoundError;
  private final boolean parameterizedQueries;

  private DefaultDbLogger(Logger sink, LogLevel level, Duration slowThreshold, boolean colorful,
      boolean ignoreRecordNotFoundError, boolean parameterizedQueries) {
    this.sink = Objects.requireNonNull(sink, "sink");
    this.level = Objects.requireNonNull(level, "level");
    this.slowThreshold = Objects.requireNonNull(slowThreshold, "slowThreshold");
    this.colorful = colorful;
    this.ignoreRecordNotFoundError = ignoreRecordNotFoundError;
    this.parameterizedQueries = parameterizedQueries;
  }

  /**
   * Creates a logger from the logging and slow-query options of a manager configuration.
   */
  public static DefaultDbLogger from(LogConfig log, SlowQueryConfig slowQuery) {
    Duration threshold = slowQuery.enabled()
        ? slowQuery.threshold()
        : Duration.ofMillis(DEFAULT_SLOW_THRESHOLD_MS);
    return new DefaultDbLogger(Logger.getLogger(LOGGER_NAME), log.logLevel(), threshold,
        log.colorful(), log.ignoreRecordNotFoundError(), log.parameterizedQueries());
  }

  /**
   * Creates an info-level logger with the default slow threshold.
   */
  public static DefaultDbLogger create() {
    return new DefaultDbLogger(Logger.getLogger(LOGGER_NAME), LogLevel.INFO,
        Duration.ofMillis(DEFAULT_SLOW_THRESHOLD_MS), false, false, false);
  }

  public LogLevel level() {
    return level;
  }

  public Duration slowThreshold() {
    return slowThreshold;
  }

  @Override
  public DbLogger setLevel(LogLevel level) {
    return new DefaultDbLogger(sink, level, slowThreshold, colorful,
        ignoreRecordNotFoundError, parameterizedQueries);
  }

  @Override
  public void info(String message, Object... data) {
    if (level.allows(LogLevel.INFO)) {
      sink.log(Level.INFO, DbLoggers.withFields(message, data));
    }
  }

  @Override
  public void warn(String message, Object... data) {
    if (level.allows(LogLevel.WARN)) {
      sink.log(Level.WARNING, DbLoggers.withFields(message, data));
    }
  }

  @Override
  public void error(String message, Object... data) {
    if (level.allows(LogLevel.ERROR)) {
      sink.log(Level.SEVERE, DbLoggers.withFields(message, data));
    }
  }

  @Override
  public void trace(Instant begin, Supplier<TraceResult> result, Throwable error) {
    if (level == LogLevel.SILENT) {
      return;
    }
    Duration elapsed = Duration.between(begin, Instant.now());
    Throwable failure = ignoreRecordNotFoundError && error instanceof RecordNotFoundException
        ? null
        : error;

    if (failure != null && level.allows(LogLevel.ERROR)) {
      TraceResult r = result.get();
      sink.log(Level.SEVERE, paint(RED, line(elapsed, r) + " | " + failure.getMessage()));
    } else if (isSlow(elapsed) && level.allows(LogLevel.WARN)) {
      TraceResult r = result.get();
      sink.log(Level.WARNING, paint(YELLOW,
          "SLOW SQL >= " + slowThreshold.toMillis() + "ms " + line(elapsed, r)));
    } else if (level.allows(LogLevel.INFO)) {
      TraceResult r = result.get();
      sink.log(Level.INFO, paint(GREEN, line(elapsed, r)));
    }
  }

  private boolean isSlow(Duration elapsed) {
    return !slowThreshold.isZero() && elapsed.compareTo(slowThreshold) > 0;
  }

  private String line(Duration elapsed, TraceResult r) {
    String rows = r.rowsAffected() < 0 ? "-" : Long.toString(r.rowsAffected());
    return String.format(Locale.ROOT, "[%.3fms] [rows:%s] %s",
        elapsed.toNanos() / 1_000_000.0, rows, r.render(!parameterizedQueries));
  }

  private String paint(String color, String text) {
    return colorful ? color + text + RESET : text;
  }
}
